package com.repair.orderbot.service.dialog;

import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.dto.ManualReminder;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.enums.FieldKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkOrderFormatterTest {

    private final WorkOrderFormatter formatter = new WorkOrderFormatter();

    @Test
    void summaryDistinguishesAbsentFromUnset() {
        WorkOrder order = new WorkOrder();
        order.put(FieldKey.IDENTIFIER, FieldValue.text("1001"));
        order.put(FieldKey.SCHEDULED_DATE, FieldValue.unset());

        String summary = formatter.summary(order);

        assertThat(summary).contains("工单编号：1001");
        assertThat(summary).contains("预约日期：不适用");
        assertThat(summary).contains("负责技术员：未填写");
    }

    @Test
    void chunksNeverExceedLimitAndKeepItemsWhole() {
        formatter.setMaxMessageLength(40);
        List<String> items = Arrays.asList("a".repeat(15), "b".repeat(15), "c".repeat(15));

        List<String> chunks = formatter.chunk("header", items);

        assertThat(chunks).hasSize(2);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(40));
        assertThat(String.join("", chunks)).contains("a".repeat(15), "b".repeat(15), "c".repeat(15));
    }

    @Test
    void pendingRemindersRenderInLocalTime() {
        ManualReminder reminder = ManualReminder.builder()
                .firesAt(Instant.parse("2025-10-20T14:00:00Z"))
                .message("Visitar")
                .build();

        assertThat(formatter.pendingReminders(List.of(reminder), ZoneId.of("America/Sao_Paulo")))
                .isEqualTo("\n\n⏰ 待触发提醒：\n· 20/10/2025 11:00 Visitar");
        assertThat(formatter.pendingReminders(List.of(), ZoneId.of("UTC"))).isEmpty();
    }
}
