package com.repair.orderbot.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("work_orders")
public class WorkOrderEntity {
    @TableId(type = IdType.AUTO)
    private Long id;
    private String businessId;     // 工单编号（唯一索引）
    private String requestNumber;  // 报修单号
    private String site;           // 网点/站点
    private String distanceKm;     // 距离
    private String description;
    private String criticality;    // Criticality 枚举名
    private String category;       // OrderCategory 枚举名
    private String dueDate;        // yyyy-MM-dd
    private String status;         // OrderStatus 枚举名
    private String assignee;
    private String scheduledDate;  // yyyy-MM-dd 或 <unset>
    private String notifyChannel;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
