package com.repair.orderbot.model.enums;

/**
 * 一次输入的形态
 */
public enum InputKind {
    /**
     * /start、/menu、/cancel 等命令
     */
    COMMAND,
    /**
     * 按钮回调
     */
    ACTION,
    TEXT,
    DOCUMENT
}
