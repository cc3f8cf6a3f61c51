package com.repair.orderbot.service.schema;

import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.FieldType;
import com.repair.orderbot.model.enums.LabeledChoice;
import com.repair.orderbot.model.enums.OrderStatus;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 工单字段的静态描述：顺序、必填、取值域、默认值
 */
public final class FieldSchema {

    /**
     * 未指派技术员时的占位值
     */
    public static final String UNASSIGNED = "未指派";

    private static final List<FieldKey> ORDERED = Collections.unmodifiableList(Arrays.asList(FieldKey.values()));

    private FieldSchema() {
    }

    public static List<FieldKey> orderedFields() {
        return ORDERED;
    }

    public static List<FieldKey> requiredFields() {
        List<FieldKey> required = new ArrayList<>();
        for (FieldKey key : ORDERED) {
            if (key.isRequired()) {
                required.add(key);
            }
        }
        return required;
    }

    /**
     * 编辑菜单中展示的字段；工单编号也可修改，但会重新校验唯一性
     */
    public static List<FieldKey> editableFields() {
        return ORDERED;
    }

    public static List<LabeledChoice> choicesFor(FieldKey key) {
        if (key.getType() != FieldType.CHOICE || key.getChoiceType() == null) {
            return Collections.emptyList();
        }
        return Arrays.<LabeledChoice>asList(key.getChoiceType().getEnumConstants());
    }

    /**
     * 补齐可选字段的默认值，已有值不覆盖
     */
    public static void applyDefaults(WorkOrder order) {
        if (!order.has(FieldKey.STATUS)) {
            order.put(FieldKey.STATUS, FieldValue.choice(OrderStatus.OPEN));
        }
        if (!order.has(FieldKey.ASSIGNEE)) {
            order.put(FieldKey.ASSIGNEE, FieldValue.text(UNASSIGNED));
        }
        if (!order.has(FieldKey.SCHEDULED_DATE)) {
            order.put(FieldKey.SCHEDULED_DATE, FieldValue.unset());
        }
    }

    /**
     * 从 fromIndex（requiredFields 下标）开始，找到第一个还没有值的必填字段
     * @return 下标；全部已填写时返回 -1
     */
    public static int nextMissingRequired(WorkOrder order, int fromIndex) {
        List<FieldKey> required = requiredFields();
        for (int i = Math.max(fromIndex, 0); i < required.size(); i++) {
            if (!order.has(required.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
