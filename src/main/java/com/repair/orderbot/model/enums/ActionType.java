package com.repair.orderbot.model.enums;

/**
 * 按钮动作，回调数据格式为 ACTION 或 ACTION:参数
 */
public enum ActionType {
    // 主菜单
    CREATE,
    UPDATE,
    DELETE,
    LIST,
    UPLOAD,
    REMIND,
    HELP,
    // 通用
    CONFIRM,
    EDIT,
    CANCEL,
    FINISH,
    /**
     * 重复编号时转入编辑已有工单
     */
    EDIT_EXISTING,
    /**
     * 选择要编辑的字段，参数为 FieldKey
     */
    PICK_FIELD,
    /**
     * 选择固定选项，参数为枚举名或 ALL
     */
    CHOOSE,
    /**
     * 提醒不关联工单
     */
    NO_ORDER
}
