package com.repair.orderbot.service.business.impl;

import com.baomidou.mybatisplus.core.toolkit.support.SFunction;
import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.entity.WorkOrderEntity;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.LabeledChoice;
import com.repair.orderbot.service.schema.FieldSchema;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;

/**
 * 工单领域对象与表记录之间的转换
 * 列存储格式：文本原样、选项存枚举名、日期存 yyyy-MM-dd、不适用存 &lt;unset&gt;
 */
@Slf4j
public final class WorkOrderConverter {

    public static final String UNSET_TOKEN = "<unset>";

    private WorkOrderConverter() {
    }

    public static WorkOrderEntity toEntity(WorkOrder order) {
        WorkOrderEntity entity = new WorkOrderEntity();
        entity.setId(order.getStoreId());
        for (Map.Entry<FieldKey, FieldValue> entry : order.getFields().entrySet()) {
            write(entity, entry.getKey(), encode(entry.getValue()));
        }
        entity.setNotifyChannel(order.getNotifyChannel());
        entity.setCreatedAt(order.getCreatedAt());
        entity.setUpdatedAt(order.getUpdatedAt());
        return entity;
    }

    public static WorkOrder toDomain(WorkOrderEntity entity) {
        Map<FieldKey, FieldValue> fields = new EnumMap<>(FieldKey.class);
        for (FieldKey key : FieldSchema.orderedFields()) {
            String raw = read(entity, key);
            if (raw != null) {
                fields.put(key, decode(key, raw, entity.getBusinessId()));
            }
        }
        return WorkOrder.builder()
                .storeId(entity.getId())
                .fields(fields)
                .notifyChannel(entity.getNotifyChannel())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public static String encode(FieldValue value) {
        if (value == null) {
            return null;
        }
        switch (value.getKind()) {
            case CHOICE:
                return value.getChoice().name();
            case DATE:
                return value.getDate().toString();
            case UNSET:
                return UNSET_TOKEN;
            default:
                return value.getText();
        }
    }

    /**
     * 解码时对历史脏数据保持宽松：无法识别的日期、选项以文本形式保留，由使用方决定如何处理
     */
    static FieldValue decode(FieldKey key, String raw, String businessId) {
        if (UNSET_TOKEN.equals(raw)) {
            return FieldValue.unset();
        }
        switch (key.getType()) {
            case DATE:
                try {
                    return FieldValue.date(LocalDate.parse(raw));
                } catch (DateTimeParseException e) {
                    log.warn("工单 {} 的{}存储格式无效：{}", businessId, key.getLabel(), raw);
                    return FieldValue.text(raw);
                }
            case CHOICE:
                for (LabeledChoice choice : FieldSchema.choicesFor(key)) {
                    if (choice.matches(raw)) {
                        return FieldValue.choice(choice);
                    }
                }
                log.warn("工单 {} 的{}存储值无法识别：{}", businessId, key.getLabel(), raw);
                return FieldValue.text(raw);
            default:
                return FieldValue.text(raw);
        }
    }

    public static SFunction<WorkOrderEntity, ?> column(FieldKey key) {
        switch (key) {
            case IDENTIFIER:
                return WorkOrderEntity::getBusinessId;
            case REQUEST_NUMBER:
                return WorkOrderEntity::getRequestNumber;
            case SITE:
                return WorkOrderEntity::getSite;
            case DISTANCE_KM:
                return WorkOrderEntity::getDistanceKm;
            case DESCRIPTION:
                return WorkOrderEntity::getDescription;
            case CRITICALITY:
                return WorkOrderEntity::getCriticality;
            case CATEGORY:
                return WorkOrderEntity::getCategory;
            case DUE_DATE:
                return WorkOrderEntity::getDueDate;
            case STATUS:
                return WorkOrderEntity::getStatus;
            case ASSIGNEE:
                return WorkOrderEntity::getAssignee;
            case SCHEDULED_DATE:
                return WorkOrderEntity::getScheduledDate;
            default:
                throw new IllegalArgumentException("未映射的字段：" + key);
        }
    }

    private static String read(WorkOrderEntity entity, FieldKey key) {
        switch (key) {
            case IDENTIFIER:
                return entity.getBusinessId();
            case REQUEST_NUMBER:
                return entity.getRequestNumber();
            case SITE:
                return entity.getSite();
            case DISTANCE_KM:
                return entity.getDistanceKm();
            case DESCRIPTION:
                return entity.getDescription();
            case CRITICALITY:
                return entity.getCriticality();
            case CATEGORY:
                return entity.getCategory();
            case DUE_DATE:
                return entity.getDueDate();
            case STATUS:
                return entity.getStatus();
            case ASSIGNEE:
                return entity.getAssignee();
            case SCHEDULED_DATE:
                return entity.getScheduledDate();
            default:
                return null;
        }
    }

    private static void write(WorkOrderEntity entity, FieldKey key, String value) {
        switch (key) {
            case IDENTIFIER:
                entity.setBusinessId(value);
                break;
            case REQUEST_NUMBER:
                entity.setRequestNumber(value);
                break;
            case SITE:
                entity.setSite(value);
                break;
            case DISTANCE_KM:
                entity.setDistanceKm(value);
                break;
            case DESCRIPTION:
                entity.setDescription(value);
                break;
            case CRITICALITY:
                entity.setCriticality(value);
                break;
            case CATEGORY:
                entity.setCategory(value);
                break;
            case DUE_DATE:
                entity.setDueDate(value);
                break;
            case STATUS:
                entity.setStatus(value);
                break;
            case ASSIGNEE:
                entity.setAssignee(value);
                break;
            case SCHEDULED_DATE:
                entity.setScheduledDate(value);
                break;
            default:
                break;
        }
    }
}
