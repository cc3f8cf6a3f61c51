package com.repair.orderbot.service.dialog;

import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.dto.ManualReminder;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.enums.AlertClass;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.service.schema.FieldSchema;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 工单文本渲染：摘要、列表条目、预警消息
 */
@Component
public class WorkOrderFormatter {

    public static final String ABSENT = "未填写";

    private static final DateTimeFormatter REMINDER_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    // 单条消息最大长度，超出后分条发送
    @Value("${orderbot.list.max-message-length:4096}")
    private int maxMessageLength = 4096;

    public String value(WorkOrder order, FieldKey key) {
        FieldValue value = order.get(key);
        return value != null ? value.render() : ABSENT;
    }

    public String summary(WorkOrder order) {
        StringBuilder text = new StringBuilder();
        for (FieldKey key : FieldSchema.orderedFields()) {
            text.append(key.getLabel()).append("：").append(value(order, key)).append("\n");
        }
        return text.toString().trim();
    }

    public String listItem(WorkOrder order) {
        return "📋 " + value(order, FieldKey.IDENTIFIER)
                + " | " + value(order, FieldKey.CATEGORY)
                + " | " + value(order, FieldKey.STATUS)
                + "\n   截止：" + value(order, FieldKey.DUE_DATE)
                + " | 站点：" + value(order, FieldKey.SITE)
                + " | 技术员：" + value(order, FieldKey.ASSIGNEE);
    }

    /**
     * 把列表条目拼成若干条消息，每条不超过最大长度；单个条目不拆开
     */
    public List<String> chunk(String header, List<String> items) {
        List<String> messages = new ArrayList<>();
        StringBuilder current = new StringBuilder(header);
        for (String item : items) {
            int extra = item.length() + 2;
            if (current.length() > 0 && current.length() + extra > maxMessageLength) {
                messages.add(current.toString());
                current = new StringBuilder();
            }
            if (current.length() > 0) {
                current.append("\n\n");
            }
            current.append(item);
        }
        if (current.length() > 0) {
            messages.add(current.toString());
        }
        return messages;
    }

    public String deadlineAlert(WorkOrder order, AlertClass alertClass, long daysUntilDue) {
        StringBuilder text = new StringBuilder();
        text.append(alertClass.getLabel()).append("\n");
        text.append("工单：").append(order.getBusinessId()).append("\n");
        text.append("截止日期：").append(value(order, FieldKey.DUE_DATE));
        if (daysUntilDue < 0) {
            text.append("（已逾期 ").append(-daysUntilDue).append(" 天）");
        }
        text.append("\n");
        text.append("站点：").append(value(order, FieldKey.SITE)).append("\n");
        text.append("状态：").append(value(order, FieldKey.STATUS)).append("\n");
        text.append("技术员：").append(value(order, FieldKey.ASSIGNEE));
        return text.toString();
    }

    /**
     * 工单摘要下方附带的待触发提醒，没有时返回空串
     */
    public String pendingReminders(List<ManualReminder> reminders, ZoneId zone) {
        if (reminders == null || reminders.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder("\n\n⏰ 待触发提醒：");
        for (ManualReminder reminder : reminders) {
            text.append("\n· ")
                    .append(REMINDER_TIME.format(reminder.getFiresAt().atZone(zone)))
                    .append(" ")
                    .append(reminder.getMessage());
        }
        return text.toString();
    }

    void setMaxMessageLength(int maxMessageLength) {
        this.maxMessageLength = maxMessageLength;
    }
}
