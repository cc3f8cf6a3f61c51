package com.repair.orderbot.service.dialog;

import com.repair.orderbot.model.dto.TurnInput;
import com.repair.orderbot.model.enums.ActionType;

/**
 * 按钮回调数据编解码，格式 ACTION 或 ACTION:参数
 */
public final class CallbackData {

    private static final char SEPARATOR = ':';

    private CallbackData() {
    }

    public static String encode(ActionType action) {
        return action.name();
    }

    public static String encode(ActionType action, String argument) {
        return argument == null ? action.name() : action.name() + SEPARATOR + argument;
    }

    /**
     * 无法识别的回调数据解码为 action 为空的输入，由对话层按无效操作处理
     */
    public static TurnInput decode(String data) {
        if (data == null || data.isEmpty()) {
            return TurnInput.action(null);
        }
        int idx = data.indexOf(SEPARATOR);
        String name = idx >= 0 ? data.substring(0, idx) : data;
        String argument = idx >= 0 ? data.substring(idx + 1) : null;
        try {
            return TurnInput.action(ActionType.valueOf(name), argument);
        } catch (IllegalArgumentException e) {
            return TurnInput.action(null, argument);
        }
    }
}
