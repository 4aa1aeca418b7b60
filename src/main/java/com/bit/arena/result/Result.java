package com.bit.arena.result;

import lombok.Data;

import java.io.Serializable;

/**
 * 接口返回数据格式，账本错误额外带上错误类型名与是否可重试
 */
@Data
public class Result<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int SC_OK_200 = 200;
    public static final int SC_BAD_REQUEST_400 = 400;
    public static final int SC_INTERNAL_SERVER_ERROR_500 = 500;

    private boolean success;
    private String message = "";
    private int code;
    // 如 SIGNATURE_EXPIRED，成功时为空
    private String errorType;
    private boolean retryable;
    private T data;
    private long timestamp = System.currentTimeMillis();

    private static <T> Result<T> of(boolean success, int code, String message, T data) {
        Result<T> r = new Result<>();
        r.setSuccess(success);
        r.setCode(code);
        if (message != null) {
            r.setMessage(message);
        }
        r.setData(data);
        return r;
    }

    public static <T> Result<T> OK() {
        return of(true, SC_OK_200, null, null);
    }

    public static <T> Result<T> OK(T data) {
        return of(true, SC_OK_200, null, data);
    }

    public static <T> Result<T> error(String msg) {
        return error(SC_INTERNAL_SERVER_ERROR_500, msg);
    }

    public static <T> Result<T> error(int code, String msg) {
        return of(false, code, msg, null);
    }

    public static <T> Result<T> error(int code, String msg, String errorType, boolean retryable) {
        Result<T> r = error(code, msg);
        r.setErrorType(errorType);
        r.setRetryable(retryable);
        return r;
    }
}
