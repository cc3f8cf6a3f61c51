package com.repair.orderbot.exception;

/**
 * 字段格式或取值错误，始终可恢复：重新提示同一状态
 */
public class ValidationException extends WorkOrderException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "VALIDATION_ERROR";
    }
}
