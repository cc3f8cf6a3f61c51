package com.repair.orderbot.exception;

/**
 * 存储不可用或写入失败，仅终止当前操作
 */
public class PersistenceException extends WorkOrderException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "PERSISTENCE_ERROR";
    }
}
