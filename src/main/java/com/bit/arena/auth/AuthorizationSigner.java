package com.bit.arena.auth;

import com.bit.arena.common.AccountId;
import com.bit.arena.structure.auth.AuthorizationPayload;
import com.bit.arena.util.Secp256k1Signer;
import org.bitcoinj.core.ECKey;

/**
 * 签名端：链下后端（持有 BACKEND_SIGNER 私钥）或用户钱包用它出具授权签名
 * 与 {@link AuthorizationVerifier} 共用同一个 {@link TypedDataEncoder}，保证摘要格式一致
 */
public class AuthorizationSigner {

    private final TypedDataEncoder encoder;
    private final ECKey key;

    public AuthorizationSigner(TypedDataEncoder encoder, ECKey key) {
        this.encoder = encoder;
        this.key = key;
    }

    public AccountId getAddress() {
        return Secp256k1Signer.addressOf(key);
    }

    /**
     * @param nonce 被授权账户在该命名空间下的当前 nonce
     * @return 65字节签名 r||s||v
     */
    public byte[] sign(AuthorizationPayload payload, long nonce, long deadline) {
        return Secp256k1Signer.signDigest(key, encoder.digest(payload, nonce, deadline));
    }
}
