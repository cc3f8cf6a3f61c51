package com.repair.orderbot.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理器
 * 对话内的字段错误在各自状态内处理，这里只兜底 REST 层漏出的异常
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("参数错误：{}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(e.getMessage(), "ILLEGAL_ARGUMENT"));
    }

    @ExceptionHandler(WorkOrderException.class)
    public ResponseEntity<Map<String, Object>> handleWorkOrderException(WorkOrderException e) {
        if (e instanceof PersistenceException || e instanceof NotificationException) {
            log.error("业务处理失败：code={}, message={}", e.getCode(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body(e.getMessage(), e.getCode()));
        }
        log.warn("业务校验失败：code={}, message={}", e.getCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body(e.getMessage(), e.getCode()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("未知异常：{}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("系统异常，请联系管理员", "INTERNAL_ERROR"));
    }

    private Map<String, Object> body(String message, String code) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "ERROR");
        response.put("message", message);
        response.put("code", code);
        return response;
    }
}
