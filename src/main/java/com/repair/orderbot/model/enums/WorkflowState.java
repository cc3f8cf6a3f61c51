package com.repair.orderbot.model.enums;

/**
 * 对话状态机的全部状态
 */
public enum WorkflowState {
    MENU,
    // 新建
    COLLECT_IDENTIFIER,
    COLLECT_FIELD,
    DUPLICATE_CHOICE,
    CONFIRM_SUMMARY,
    // 修改
    LOOKUP_FOR_UPDATE,
    FIELD_EDIT_MENU,
    AWAIT_FIELD_VALUE,
    // 删除
    LOOKUP_FOR_DELETE,
    CONFIRM_DELETE,
    // 列表
    FILTER_CATEGORY,
    FILTER_STATUS,
    // 上传文档
    AWAIT_DOCUMENT,
    // 手动提醒
    REMINDER_LOOKUP,
    REMINDER_TIME,
    REMINDER_MESSAGE
}
