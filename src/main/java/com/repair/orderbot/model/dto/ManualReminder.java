package com.repair.orderbot.model.dto;

import com.repair.orderbot.model.enums.ReminderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 手动提醒，可以不关联工单
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualReminder {
    private Long id;
    private Instant firesAt;
    private String message;
    /**
     * 投递地址（会话通道），核心不解析
     */
    private String targetChannel;
    /**
     * 关联工单编号，可为空
     */
    private String businessId;
    private ReminderStatus status;
    private Instant createdAt;
    private Instant firedAt;
}
