package com.repair.orderbot.model.dto;

import lombok.Data;

/**
 * 通用对话输入DTO（非 Telegram 通道或联调使用）
 */
@Data
public class ChatTurnDTO {
    /**
     * 会话ID，必填
     */
    private String sessionId;

    /**
     * 回复/通知发送的通道，为空时与 sessionId 相同
     */
    private String channel;

    /**
     * 文本输入，以 / 开头视为命令
     */
    private String text;

    /**
     * 按钮回调数据，优先于 text
     */
    private String callbackData;
}
