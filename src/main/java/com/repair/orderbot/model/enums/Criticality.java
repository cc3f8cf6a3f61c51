package com.repair.orderbot.model.enums;

import lombok.Getter;

/**
 * 紧急程度
 */
@Getter
public enum Criticality implements LabeledChoice {
    EMERGENCY("紧急", "Emergencial", "Emergência"),
    URGENT("加急", "Urgente"),
    NORMAL("普通", "Normal");

    private final String label;
    private final String[] aliases;

    Criticality(String label, String... aliases) {
        this.label = label;
        this.aliases = aliases;
    }
}
