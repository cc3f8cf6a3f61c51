package com.repair.orderbot.service.notify;

import com.repair.orderbot.model.dto.ChoiceOption;

import java.util.List;

/**
 * 对话回复通道
 */
public interface ChatGateway {

    /**
     * 发送提示，choices 按顺序渲染为按钮；为空时只发文本
     */
    void sendPrompt(String channel, String text, List<ChoiceOption> choices);
}
