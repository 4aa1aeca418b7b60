package com.bit.arena.exception;

/**
 * 错误大类：决定异常类型与 HTTP 层的返回码
 */
public enum ErrorCategory {
    AUTHORIZATION(401),   // 签名授权失败（过期、签名者无效、签名无效）
    STATE(409),           // 状态冲突（已存在、不存在、重复领取…）
    VALIDATION(400),      // 参数校验失败
    CAPACITY(409),        // 容量上限
    ACCESS(403),          // 角色权限不足
    SETTLEMENT(402);      // 结算失败

    private final int code;

    ErrorCategory(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
