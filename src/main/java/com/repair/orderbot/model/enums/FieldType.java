package com.repair.orderbot.model.enums;

/**
 * 字段取值域
 */
public enum FieldType {
    /**
     * 工单编号：纯数字
     */
    IDENTIFIER,
    TEXT,
    /**
     * 数字文本，如距离 "12,5"
     */
    NUMBER,
    /**
     * 固定选项，只能通过按钮选择
     */
    CHOICE,
    /**
     * dd/MM/yyyy 日期
     */
    DATE
}
