package com.repair.orderbot.exception;

/**
 * 提醒时间不在未来（超出容差）或提醒参数不完整
 */
public class SchedulingException extends WorkOrderException {

    public SchedulingException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "SCHEDULING_ERROR";
    }
}
