package com.bit.arena.structure.auth;

/**
 * nonce 命名空间：每个账户每种操作独立计数，防止跨操作重放
 */
public enum NonceScope {
    REGISTER,
    STATS_UPDATE,
    CLAIM
}
