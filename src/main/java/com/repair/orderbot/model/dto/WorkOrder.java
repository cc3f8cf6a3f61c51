package com.repair.orderbot.model.dto;

import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.OrderCategory;
import com.repair.orderbot.model.enums.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * 工单领域对象
 * storeId 为空表示尚未入库的草稿
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkOrder {

    /**
     * 存储主键
     */
    private Long storeId;

    /**
     * 字段值，EnumMap 按 FieldKey 声明顺序迭代
     */
    @Builder.Default
    private Map<FieldKey, FieldValue> fields = new EnumMap<>(FieldKey.class);

    /**
     * 创建工单的会话通道，截止日期预警发往这里
     */
    private String notifyChannel;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public String getBusinessId() {
        FieldValue value = fields.get(FieldKey.IDENTIFIER);
        return value != null ? value.getText() : null;
    }

    public FieldValue get(FieldKey key) {
        return fields.get(key);
    }

    public void put(FieldKey key, FieldValue value) {
        fields.put(key, value);
    }

    public boolean has(FieldKey key) {
        return fields.containsKey(key);
    }

    public boolean isPersisted() {
        return storeId != null;
    }

    public OrderStatus getStatus() {
        FieldValue value = fields.get(FieldKey.STATUS);
        if (value != null && value.getChoice() instanceof OrderStatus) {
            return (OrderStatus) value.getChoice();
        }
        return OrderStatus.OPEN;
    }

    public OrderCategory getCategory() {
        FieldValue value = fields.get(FieldKey.CATEGORY);
        if (value != null && value.getChoice() instanceof OrderCategory) {
            return (OrderCategory) value.getChoice();
        }
        return null;
    }

    /**
     * 截止日期；未填写或存储中格式错误时返回 null
     */
    public LocalDate getDueDate() {
        FieldValue value = fields.get(FieldKey.DUE_DATE);
        return value != null ? value.getDate() : null;
    }

    public WorkOrder copy() {
        Map<FieldKey, FieldValue> copied = new EnumMap<>(FieldKey.class);
        copied.putAll(fields);
        return WorkOrder.builder()
                .storeId(storeId)
                .fields(copied)
                .notifyChannel(notifyChannel)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
