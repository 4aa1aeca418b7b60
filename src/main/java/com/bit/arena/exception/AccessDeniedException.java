package com.bit.arena.exception;

/**
 * 角色权限不足
 */
public class AccessDeniedException extends LedgerException {

    public AccessDeniedException(ErrorType errorType, String message) {
        super(errorType, message);
    }
}
