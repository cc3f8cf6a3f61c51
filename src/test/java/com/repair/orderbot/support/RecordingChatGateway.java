package com.repair.orderbot.support;

import com.repair.orderbot.exception.NotificationException;
import com.repair.orderbot.model.dto.ChoiceOption;
import com.repair.orderbot.service.notify.ChatGateway;
import com.repair.orderbot.service.notify.Notifier;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 记录所有发出的消息；可指定投递失败的通道
 */
public class RecordingChatGateway implements ChatGateway, Notifier {

    private final List<Sent> prompts = new ArrayList<>();
    private final List<Sent> notifications = new ArrayList<>();
    private final Set<String> failingChannels = new HashSet<>();

    @Data
    @AllArgsConstructor
    public static class Sent {
        private String channel;
        private String text;
        private List<ChoiceOption> choices;
    }

    public void failFor(String channel) {
        failingChannels.add(channel);
    }

    public void recover(String channel) {
        failingChannels.remove(channel);
    }

    @Override
    public void sendPrompt(String channel, String text, List<ChoiceOption> choices) {
        prompts.add(new Sent(channel, text, choices));
    }

    @Override
    public void send(String channel, String text) {
        if (failingChannels.contains(channel)) {
            throw new NotificationException("通道不可用：" + channel);
        }
        notifications.add(new Sent(channel, text, null));
    }

    public List<Sent> getPrompts() {
        return prompts;
    }

    public List<Sent> getNotifications() {
        return notifications;
    }

    public Sent lastPrompt() {
        return prompts.isEmpty() ? null : prompts.get(prompts.size() - 1);
    }

    /**
     * 最近 n 条提示的文本拼接，便于断言提示内容
     */
    public String recentText(int n) {
        StringBuilder text = new StringBuilder();
        for (int i = Math.max(0, prompts.size() - n); i < prompts.size(); i++) {
            text.append(prompts.get(i).getText()).append("\n");
        }
        return text.toString();
    }

    public void clear() {
        prompts.clear();
        notifications.clear();
    }
}
