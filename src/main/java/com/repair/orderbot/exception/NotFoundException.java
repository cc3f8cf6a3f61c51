package com.repair.orderbot.exception;

import lombok.Getter;

/**
 * 按工单编号查询未命中
 */
@Getter
public class NotFoundException extends WorkOrderException {

    private final String businessId;

    public NotFoundException(String businessId) {
        super("工单 " + businessId + " 不存在");
        this.businessId = businessId;
    }

    @Override
    public String getCode() {
        return "NOT_FOUND";
    }
}
