package com.repair.orderbot.model.enums;

import lombok.Getter;

/**
 * 工单字段，声明顺序即展示与录入顺序
 */
@Getter
public enum FieldKey {
    IDENTIFIER("工单编号", FieldType.IDENTIFIER, true, null, false),
    REQUEST_NUMBER("报修单号", FieldType.TEXT, true, null, false),
    SITE("网点/站点", FieldType.TEXT, true, null, false),
    DISTANCE_KM("距离(km)", FieldType.NUMBER, true, null, false),
    DESCRIPTION("问题描述", FieldType.TEXT, true, null, false),
    CRITICALITY("紧急程度", FieldType.CHOICE, true, Criticality.class, false),
    CATEGORY("工单类型", FieldType.CHOICE, true, OrderCategory.class, false),
    DUE_DATE("截止日期", FieldType.DATE, true, null, false),
    STATUS("状态", FieldType.CHOICE, false, OrderStatus.class, false),
    ASSIGNEE("负责技术员", FieldType.TEXT, false, null, false),
    SCHEDULED_DATE("预约日期", FieldType.DATE, false, null, true);

    private final String label;
    private final FieldType type;
    private final boolean required;
    private final Class<? extends LabeledChoice> choiceType;
    /**
     * 是否接受 "N/A" 表示不适用
     */
    private final boolean unsetAllowed;

    FieldKey(String label, FieldType type, boolean required,
             Class<? extends LabeledChoice> choiceType, boolean unsetAllowed) {
        this.label = label;
        this.type = type;
        this.required = required;
        this.choiceType = choiceType;
        this.unsetAllowed = unsetAllowed;
    }
}
