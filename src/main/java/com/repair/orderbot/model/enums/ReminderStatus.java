package com.repair.orderbot.model.enums;

/**
 * 手动提醒状态，只有 PENDING 可以迁移
 */
public enum ReminderStatus {
    PENDING,
    FIRED,
    CANCELLED
}
