package com.bit.arena.exception;

/**
 * 容量已达上限
 */
public class CapacityException extends LedgerException {

    public CapacityException(ErrorType errorType, String message) {
        super(errorType, message);
    }
}
