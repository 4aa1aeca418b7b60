package com.bit.arena.api;

import com.bit.arena.exception.LedgerException;
import com.bit.arena.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 账本异常统一转换为 Result 错误信封，HTTP 状态码取错误大类的返回码
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Result<Void>> handleLedger(LedgerException e) {
        int code = e.getCategory().getCode();
        log.debug("请求被拒绝 {}：{}", e.getErrorType(), e.getMessage());
        return ResponseEntity.status(code)
                .body(Result.error(code, e.getMessage(), e.getErrorType().name(), e.getErrorType().isRetryable()));
    }

    // 地址/哈希格式错误等
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Result.error(Result.SC_BAD_REQUEST_400, e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Result<Void>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(Result.error(Result.SC_BAD_REQUEST_400, "请求格式不正确：" + e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleGeneral(Exception e) {
        log.error("未预期的错误", e);
        return ResponseEntity.internalServerError().body(Result.error("系统发生错误，请稍后重试"));
    }
}
