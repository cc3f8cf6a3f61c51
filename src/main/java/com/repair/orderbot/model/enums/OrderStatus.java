package com.repair.orderbot.model.enums;

import lombok.Getter;

/**
 * 工单状态，DONE / CANCELLED 为终态，不参与截止日期巡检
 */
@Getter
public enum OrderStatus implements LabeledChoice {
    OPEN("待处理", false, "Pendente", "Aguardando agendamento"),
    SCHEDULED("已预约", false, "Agendado"),
    IN_PROGRESS("处理中", false, "Em andamento"),
    DONE("已完成", true, "Concluído"),
    CANCELLED("已取消", true, "Cancelado");

    private final String label;
    private final boolean terminal;
    private final String[] aliases;

    OrderStatus(String label, boolean terminal, String... aliases) {
        this.label = label;
        this.terminal = terminal;
        this.aliases = aliases;
    }
}
