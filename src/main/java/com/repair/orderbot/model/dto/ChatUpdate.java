package com.repair.orderbot.model.dto;

import lombok.Builder;
import lombok.Data;

/**
 * 通道消息解析结果
 */
@Data
@Builder
public class ChatUpdate {
    /**
     * 会话ID：同一群内不同操作员互不干扰
     */
    private String sessionId;

    /**
     * 回复通道（聊天ID）
     */
    private String channel;

    private TurnInput input;

    /**
     * 文档消息的文件ID，内容需另行下载
     */
    private String fileId;

    /**
     * 按钮回调ID，用于应答回调
     */
    private String callbackQueryId;
}
