package com.repair.orderbot.exception;

/**
 * 通知投递失败（通道未配置、HTTP 错误等）
 */
public class NotificationException extends WorkOrderException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "NOTIFICATION_ERROR";
    }
}
