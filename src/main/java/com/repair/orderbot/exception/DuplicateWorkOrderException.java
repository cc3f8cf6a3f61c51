package com.repair.orderbot.exception;

import com.repair.orderbot.model.dto.WorkOrder;
import lombok.Getter;

/**
 * 工单编号已被占用，携带已存在的工单供对话转入"编辑已有工单"
 */
@Getter
public class DuplicateWorkOrderException extends WorkOrderException {

    private final transient WorkOrder existing;

    public DuplicateWorkOrderException(String businessId, WorkOrder existing) {
        super("工单 " + businessId + " 已存在");
        this.existing = existing;
    }

    @Override
    public String getCode() {
        return "DUPLICATE";
    }
}
