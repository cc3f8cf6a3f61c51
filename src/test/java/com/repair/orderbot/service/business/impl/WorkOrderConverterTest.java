package com.repair.orderbot.service.business.impl;

import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.entity.WorkOrderEntity;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.FieldType;
import com.repair.orderbot.model.enums.OrderCategory;
import com.repair.orderbot.model.enums.OrderStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class WorkOrderConverterTest {

    @Test
    void entityColumnsUseStorageFormat() {
        WorkOrder order = new WorkOrder();
        order.put(FieldKey.IDENTIFIER, FieldValue.text("1001"));
        order.put(FieldKey.CATEGORY, FieldValue.choice(OrderCategory.CORRECTIVE));
        order.put(FieldKey.DUE_DATE, FieldValue.date(LocalDate.of(2025, 10, 25)));
        order.put(FieldKey.SCHEDULED_DATE, FieldValue.unset());

        WorkOrderEntity entity = WorkOrderConverter.toEntity(order);

        assertThat(entity.getBusinessId()).isEqualTo("1001");
        assertThat(entity.getCategory()).isEqualTo("CORRECTIVE");
        assertThat(entity.getDueDate()).isEqualTo("2025-10-25");
        assertThat(entity.getScheduledDate()).isEqualTo(WorkOrderConverter.UNSET_TOKEN);
        assertThat(entity.getSite()).isNull();
    }

    @Test
    void nullColumnsStayAbsentAndUnsetIsDistinct() {
        WorkOrderEntity entity = new WorkOrderEntity();
        entity.setId(7L);
        entity.setBusinessId("1001");
        entity.setScheduledDate("<unset>");
        entity.setStatus("SCHEDULED");

        WorkOrder order = WorkOrderConverter.toDomain(entity);

        assertThat(order.getStoreId()).isEqualTo(7L);
        assertThat(order.has(FieldKey.SITE)).isFalse();
        assertThat(order.get(FieldKey.SCHEDULED_DATE).isUnset()).isTrue();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.SCHEDULED);
    }

    @Test
    void malformedStoredDateIsKeptAsText() {
        WorkOrderEntity entity = new WorkOrderEntity();
        entity.setBusinessId("1002");
        entity.setDueDate("amanhã");

        WorkOrder order = WorkOrderConverter.toDomain(entity);

        assertThat(order.get(FieldKey.DUE_DATE).getKind()).isEqualTo(FieldValue.Kind.TEXT);
        assertThat(order.getDueDate()).isNull();
    }

    @Test
    void legacyChoiceSpellingIsRecognised() {
        assertThat(WorkOrderConverter.decode(FieldKey.STATUS, "Pendente", "1").getChoice()).isEqualTo(OrderStatus.OPEN);
    }

    @Test
    void everyFieldHasAColumn() {
        for (FieldKey key : FieldKey.values()) {
            assertThat(WorkOrderConverter.column(key)).as(key.name()).isNotNull();
        }
        assertThat(FieldKey.SCHEDULED_DATE.getType()).isEqualTo(FieldType.DATE);
    }
}
