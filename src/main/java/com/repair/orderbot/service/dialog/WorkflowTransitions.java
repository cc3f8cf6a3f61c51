package com.repair.orderbot.service.dialog;

import com.repair.orderbot.model.enums.ActionType;
import com.repair.orderbot.model.enums.WorkflowState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 按钮导航表：状态 × 动作 → 下一状态
 * 取消动作在所有状态下都返回主菜单，不在表中逐一登记
 */
public final class WorkflowTransitions {

    private static final Map<WorkflowState, Map<ActionType, WorkflowState>> TABLE = new EnumMap<>(WorkflowState.class);

    static {
        on(WorkflowState.MENU, ActionType.CREATE, WorkflowState.COLLECT_IDENTIFIER);
        on(WorkflowState.MENU, ActionType.UPDATE, WorkflowState.LOOKUP_FOR_UPDATE);
        on(WorkflowState.MENU, ActionType.DELETE, WorkflowState.LOOKUP_FOR_DELETE);
        on(WorkflowState.MENU, ActionType.LIST, WorkflowState.FILTER_CATEGORY);
        on(WorkflowState.MENU, ActionType.UPLOAD, WorkflowState.AWAIT_DOCUMENT);
        on(WorkflowState.MENU, ActionType.REMIND, WorkflowState.REMINDER_LOOKUP);
        on(WorkflowState.MENU, ActionType.HELP, WorkflowState.MENU);

        on(WorkflowState.COLLECT_FIELD, ActionType.CHOOSE, WorkflowState.COLLECT_FIELD);
        on(WorkflowState.DUPLICATE_CHOICE, ActionType.EDIT_EXISTING, WorkflowState.FIELD_EDIT_MENU);

        on(WorkflowState.CONFIRM_SUMMARY, ActionType.CONFIRM, WorkflowState.MENU);
        on(WorkflowState.CONFIRM_SUMMARY, ActionType.EDIT, WorkflowState.FIELD_EDIT_MENU);

        on(WorkflowState.FIELD_EDIT_MENU, ActionType.PICK_FIELD, WorkflowState.AWAIT_FIELD_VALUE);
        // 已入库工单回主菜单，草稿回确认页
        on(WorkflowState.FIELD_EDIT_MENU, ActionType.FINISH, WorkflowState.MENU);
        on(WorkflowState.AWAIT_FIELD_VALUE, ActionType.CHOOSE, WorkflowState.FIELD_EDIT_MENU);

        on(WorkflowState.CONFIRM_DELETE, ActionType.CONFIRM, WorkflowState.MENU);

        on(WorkflowState.FILTER_CATEGORY, ActionType.CHOOSE, WorkflowState.FILTER_STATUS);
        on(WorkflowState.FILTER_STATUS, ActionType.CHOOSE, WorkflowState.MENU);

        on(WorkflowState.REMINDER_LOOKUP, ActionType.NO_ORDER, WorkflowState.REMINDER_TIME);
    }

    private WorkflowTransitions() {
    }

    private static void on(WorkflowState from, ActionType action, WorkflowState to) {
        TABLE.computeIfAbsent(from, s -> new EnumMap<>(ActionType.class)).put(action, to);
    }

    /**
     * @return 下一状态；该状态下不接受此动作时返回 null
     */
    public static WorkflowState target(WorkflowState state, ActionType action) {
        if (action == null) {
            return null;
        }
        if (action == ActionType.CANCEL) {
            return WorkflowState.MENU;
        }
        return TABLE.getOrDefault(state, Collections.emptyMap()).get(action);
    }

    public static boolean permits(WorkflowState state, ActionType action) {
        return target(state, action) != null;
    }
}
