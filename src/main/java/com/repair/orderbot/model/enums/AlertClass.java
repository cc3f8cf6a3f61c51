package com.repair.orderbot.model.enums;

import lombok.Getter;

/**
 * 截止日期预警类别
 */
@Getter
public enum AlertClass {
    OVERDUE("🚨 已逾期"),
    DUE_TODAY("⏰ 今日到期"),
    DUE_TOMORROW("⚠️ 明日到期"),
    DUE_IN_2_DAYS("🔔 2天后到期");

    private final String label;

    AlertClass(String label) {
        this.label = label;
    }

    /**
     * 按距离截止日的自然日数分类
     * @param daysUntilDue 截止日期 - 今天
     * @param includeDueToday 是否启用"今日到期"类别
     * @return 预警类别，无需预警时返回 null
     */
    public static AlertClass classify(long daysUntilDue, boolean includeDueToday) {
        if (daysUntilDue < 0) {
            return OVERDUE;
        }
        if (daysUntilDue == 0) {
            return includeDueToday ? DUE_TODAY : null;
        }
        if (daysUntilDue == 1) {
            return DUE_TOMORROW;
        }
        if (daysUntilDue == 2) {
            return DUE_IN_2_DAYS;
        }
        return null;
    }
}
