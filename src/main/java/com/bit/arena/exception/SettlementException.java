package com.bit.arena.exception;

/**
 * 结算失败
 */
public class SettlementException extends LedgerException {

    public SettlementException(ErrorType errorType, String message) {
        super(errorType, message);
    }

    public SettlementException(ErrorType errorType, String message, Throwable cause) {
        super(errorType, message, cause);
    }
}
