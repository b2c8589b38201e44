package com.example.automation.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理器
 *
 * <p>统一处理Controller抛出的异常，返回规范的JSON错误响应。
 * </p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 处理任务未找到异常
     *
     * <p>轮询方会频繁命中尚未落库的任务，只记录debug日志。
     * </p>
     */
    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFoundException(JobNotFoundException e) {
        logger.debug("Automation not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, "Automation not found", e.getMessage());
    }

    @ExceptionHandler(JobNotCompletedException.class)
    public ResponseEntity<ErrorResponse> handleJobNotCompletedException(JobNotCompletedException e) {
        logger.warn("Automation not completed: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Automation not completed", e.getMessage());
    }

    /**
     * 处理参数验证异常
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        logger.warn("Validation error: {}", e.getMessage());

        Map<String, String> errors = new LinkedHashMap<>();
        e.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        return build(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        logger.warn("Illegal argument: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid argument", e.getMessage());
    }

    /**
     * 处理所有其他未预期的异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unexpected error occurred", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error",
                e.getMessage() != null ? e.getMessage() : "An unexpected error occurred");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String details) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message, details));
    }

    /**
     * 错误响应DTO
     *
     * @param status HTTP状态码
     * @param message 错误类型消息
     * @param details 详细错误信息
     */
    public record ErrorResponse(int status, String message, String details) {
    }
}
