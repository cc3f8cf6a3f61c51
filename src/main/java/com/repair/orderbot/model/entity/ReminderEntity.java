package com.repair.orderbot.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("reminders")
public class ReminderEntity {
    @TableId(type = IdType.AUTO)
    private Long id;
    private String businessId;     // 关联工单编号，可为空
    private String message;
    private String targetChannel;
    private Long firesAt;          // 触发时间（毫秒时间戳），用于排序和范围查询
    private String status;         // PENDING / FIRED / CANCELLED
    private LocalDateTime createdAt;
    private LocalDateTime firedAt;
}
