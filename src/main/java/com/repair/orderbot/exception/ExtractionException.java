package com.repair.orderbot.exception;

/**
 * 文档字段提取失败
 */
public class ExtractionException extends WorkOrderException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "EXTRACTION_ERROR";
    }
}
