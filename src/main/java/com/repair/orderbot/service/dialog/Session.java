package com.repair.orderbot.service.dialog;

import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.OrderCategory;
import com.repair.orderbot.model.enums.WorkflowState;
import lombok.Data;

import java.time.Instant;

/**
 * 单个会话的对话状态，只由 WorkOrderDialogService 在持有会话锁时修改
 */
@Data
public class Session {

    private final String sessionId;

    /**
     * 回复发送的通道
     */
    private String channel;

    private WorkflowState state = WorkflowState.MENU;

    /**
     * 正在录入或编辑的工单；storeId 为空表示未入库草稿
     */
    private WorkOrder draft;

    /**
     * 编号重复时已存在的工单
     */
    private WorkOrder duplicate;

    /**
     * COLLECT_FIELD 当前字段在必填字段列表中的下标
     */
    private int collectIndex;

    private FieldKey editingField;

    // 列表筛选，null 表示全部
    private OrderCategory filterCategory;

    // 提醒草稿
    private String reminderBusinessId;
    private Instant reminderFiresAt;

    private Instant lastActiveAt;

    public void reset() {
        state = WorkflowState.MENU;
        draft = null;
        duplicate = null;
        collectIndex = 0;
        editingField = null;
        filterCategory = null;
        reminderBusinessId = null;
        reminderFiresAt = null;
    }
}
