package org.docstore.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CustomException.class)
    public ResponseEntity<Map<String, Object>> handleCustomException(CustomException ex) {
        return new ResponseEntity<>(body(ex.getStatus().value(), ex.getMessage()), ex.getStatus());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(body(400, ex.getMessage()));
    }

    // 并发写入同一文档时版本号唯一约束冲突
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(DataIntegrityViolationException ex) {
        logger.warn("数据约束冲突: {}", ex.getMostSpecificCause().getMessage());
        return new ResponseEntity<>(body(409, "Concurrent modification, please retry"), HttpStatus.CONFLICT);
    }

    // 文件系统错误：除 "不存在" 以外都按 500 处理
    @ExceptionHandler({IOException.class, UncheckedIOException.class})
    public ResponseEntity<Map<String, Object>> handleIoException(Exception ex) {
        logger.error("文件系统操作失败", ex);
        return ResponseEntity.internalServerError().body(body(500, "Storage error: " + ex.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleRuntimeException(RuntimeException ex) {
        logger.error("未处理的运行时异常", ex);
        return ResponseEntity.internalServerError().body(body(500, "运行时错误: " + ex.getMessage()));
    }

    // 顺便处理一下其他的异常，防止报出白页
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception ex) {
        logger.error("服务器内部错误", ex);
        return ResponseEntity.internalServerError().body(body(500, "服务器内部错误: " + ex.getMessage()));
    }

    private static Map<String, Object> body(int code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("code", code);
        body.put("message", message);
        body.put("success", false);
        return body;
    }
}
