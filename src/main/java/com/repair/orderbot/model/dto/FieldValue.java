package com.repair.orderbot.model.dto;

import com.repair.orderbot.model.enums.LabeledChoice;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * 字段值：自由文本、固定选项、日期、或"不适用"标记
 * 字段缺失用 Map 中没有该键表示，不使用本类
 */
@Getter
@EqualsAndHashCode
public final class FieldValue {

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    public enum Kind { TEXT, CHOICE, DATE, UNSET }

    private static final FieldValue UNSET = new FieldValue(Kind.UNSET, null, null, null);

    private final Kind kind;
    private final String text;
    private final LabeledChoice choice;
    private final LocalDate date;

    private FieldValue(Kind kind, String text, LabeledChoice choice, LocalDate date) {
        this.kind = kind;
        this.text = text;
        this.choice = choice;
        this.date = date;
    }

    public static FieldValue text(String text) {
        if (text == null) {
            throw new IllegalArgumentException("文本值不能为空");
        }
        return new FieldValue(Kind.TEXT, text, null, null);
    }

    public static FieldValue choice(LabeledChoice choice) {
        if (choice == null) {
            throw new IllegalArgumentException("选项值不能为空");
        }
        return new FieldValue(Kind.CHOICE, null, choice, null);
    }

    public static FieldValue date(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("日期值不能为空");
        }
        return new FieldValue(Kind.DATE, null, null, date);
    }

    public static FieldValue unset() {
        return UNSET;
    }

    public boolean isUnset() {
        return kind == Kind.UNSET;
    }

    /**
     * 面向操作员的展示文本
     */
    public String render() {
        switch (kind) {
            case TEXT:
                return text;
            case CHOICE:
                return choice.getLabel();
            case DATE:
                return date.format(DATE_FORMAT);
            default:
                return "不适用";
        }
    }

    @Override
    public String toString() {
        return kind + "(" + render() + ")";
    }
}
