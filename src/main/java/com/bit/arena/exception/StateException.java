package com.bit.arena.exception;

/**
 * 状态冲突
 */
public class StateException extends LedgerException {

    public StateException(ErrorType errorType, String message) {
        super(errorType, message);
    }
}
