package com.bit.arena.exception;

/**
 * 账本层异常基类：统一封装错误类型与错误信息，便于问题定位
 * 抛出即表示本次操作整体失败，没有任何部分写入
 */
public class LedgerException extends RuntimeException {

    // 异常类型（用于分类处理）
    private final ErrorType errorType;

    protected LedgerException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    protected LedgerException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    /**
     * 按错误类型的大类构造对应的子类异常
     */
    public static LedgerException of(ErrorType errorType, String message) {
        switch (errorType.getCategory()) {
            case AUTHORIZATION:
                return new AuthorizationException(errorType, message);
            case STATE:
                return new StateException(errorType, message);
            case VALIDATION:
                return new ValidationException(errorType, message);
            case CAPACITY:
                return new CapacityException(errorType, message);
            case ACCESS:
                return new AccessDeniedException(errorType, message);
            case SETTLEMENT:
                return new SettlementException(errorType, message);
            default:
                return new LedgerException(errorType, message);
        }
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public ErrorCategory getCategory() {
        return errorType.getCategory();
    }
}
