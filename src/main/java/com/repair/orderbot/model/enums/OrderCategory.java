package com.repair.orderbot.model.enums;

import lombok.Getter;

/**
 * 工单类型
 */
@Getter
public enum OrderCategory implements LabeledChoice {
    /**
     * 故障维修：设备已损坏需要修复
     */
    CORRECTIVE("故障维修", "Corretiva", "Corrective"),

    /**
     * 预防性维护：定期巡检、保养
     */
    PREVENTIVE("预防性维护", "Preventiva", "Preventive");

    private final String label;
    private final String[] aliases;

    OrderCategory(String label, String... aliases) {
        this.label = label;
        this.aliases = aliases;
    }
}
