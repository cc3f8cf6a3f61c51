package com.repair.orderbot.exception;

/**
 * 工单业务异常基类
 * 每个子类对应一种错误类别，由产生它的对话状态自行处理
 */
public abstract class WorkOrderException extends RuntimeException {

    protected WorkOrderException(String message) {
        super(message);
    }

    protected WorkOrderException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 对外返回的错误码
     */
    public abstract String getCode();
}
