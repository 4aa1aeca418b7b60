package com.bit.arena.exception;

/**
 * 签名授权失败
 */
public class AuthorizationException extends LedgerException {

    public AuthorizationException(ErrorType errorType, String message) {
        super(errorType, message);
    }
}
