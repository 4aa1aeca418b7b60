package com.bit.arena.structure.auth;

import com.bit.arena.common.AccountId;

import java.util.List;

/**
 * 链下签名的结构化消息
 * 摘要 = keccak256(typeHash || 字段... || nonce || deadline)，每个字段ABI编码为32字节
 */
public interface AuthorizationPayload {

    /**
     * 类型签名，末尾两个字段固定为 nonce 与 deadline
     */
    String typeSignature();

    /**
     * 被授权的账户，nonce 按该账户计数
     */
    AccountId subject();

    NonceScope scope();

    /**
     * 除 nonce/deadline 以外的字段，按类型签名的顺序编码
     */
    List<byte[]> encodeFields();
}
