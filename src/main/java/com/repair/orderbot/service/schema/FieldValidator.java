package com.repair.orderbot.service.schema;

import com.repair.orderbot.exception.ValidationException;
import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.LabeledChoice;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 字段校验：把操作员输入或文档提取结果转换为 FieldValue
 * 键盘输入和文档提取走同一套规则
 */
@Component
public class FieldValidator {

    public static final DateTimeFormatter DATE_INPUT = DateTimeFormatter.ofPattern("dd/MM/uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern IDENTIFIER = Pattern.compile("^\\d+$");
    private static final Pattern NUMBER = Pattern.compile("^[\\d\\s,.]+$");
    private static final String[] UNSET_WORDS = {"N/A", "NA", "不适用"};

    /**
     * 校验并转换原始输入
     * @throws ValidationException 输入不合法，调用方应保持当前状态并重新提示
     */
    public FieldValue parse(FieldKey key, String raw) {
        String value = raw != null ? raw.trim() : "";
        if (value.isEmpty()) {
            throw new ValidationException(key.getLabel() + "不能为空，请重新输入");
        }

        switch (key.getType()) {
            case IDENTIFIER:
                return FieldValue.text(normalizeIdentifier(value));
            case NUMBER:
                if (!NUMBER.matcher(value).matches()) {
                    throw new ValidationException(key.getLabel() + "只能包含数字，请重新输入");
                }
                return FieldValue.text(value);
            case CHOICE:
                return FieldValue.choice(matchChoice(key, value));
            case DATE:
                return parseDate(key, value);
            default:
                return FieldValue.text(value);
        }
    }

    /**
     * 工单编号规范化：去除首尾空白，必须为纯数字
     */
    public String normalizeIdentifier(String raw) {
        String value = raw != null ? raw.trim() : "";
        if (value.isEmpty()) {
            throw new ValidationException("工单编号不能为空，请重新输入");
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new ValidationException("请输入有效的工单编号（只能是数字）");
        }
        return value;
    }

    /**
     * 按钮令牌只接受枚举名，防止任意文本进入固定选项字段
     */
    public FieldValue parseChoiceToken(FieldKey key, String token) {
        for (LabeledChoice choice : FieldSchema.choicesFor(key)) {
            if (choice.name().equals(token)) {
                return FieldValue.choice(choice);
            }
        }
        throw new ValidationException(key.getLabel() + "请从按钮中选择：" + describeChoices(key));
    }

    private LabeledChoice matchChoice(FieldKey key, String value) {
        for (LabeledChoice choice : FieldSchema.choicesFor(key)) {
            if (choice.matches(value)) {
                return choice;
            }
        }
        throw new ValidationException(key.getLabel() + "取值无效，可选：" + describeChoices(key));
    }

    private FieldValue parseDate(FieldKey key, String value) {
        if (isUnsetWord(value)) {
            if (key.isUnsetAllowed()) {
                return FieldValue.unset();
            }
            throw new ValidationException(key.getLabel() + "为必填日期，不能设为不适用");
        }
        try {
            return FieldValue.date(LocalDate.parse(value, DATE_INPUT));
        } catch (DateTimeParseException e) {
            String hint = key.isUnsetAllowed() ? "DD/MM/AAAA 或 N/A" : "DD/MM/AAAA";
            throw new ValidationException(key.getLabel() + "格式无效，请使用 " + hint + "（例如 25/10/2025）");
        }
    }

    private boolean isUnsetWord(String value) {
        for (String word : UNSET_WORDS) {
            if (word.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }

    private String describeChoices(FieldKey key) {
        List<LabeledChoice> choices = FieldSchema.choicesFor(key);
        return choices.stream().map(LabeledChoice::getLabel).collect(Collectors.joining("、"));
    }
}
