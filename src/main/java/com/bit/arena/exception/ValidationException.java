package com.bit.arena.exception;

/**
 * 参数校验失败
 */
public class ValidationException extends LedgerException {

    public ValidationException(ErrorType errorType, String message) {
        super(errorType, message);
    }
}
