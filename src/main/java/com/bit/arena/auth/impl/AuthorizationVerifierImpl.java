package com.bit.arena.auth.impl;

import com.bit.arena.access.AccessControlService;
import com.bit.arena.auth.AuthorizationVerifier;
import com.bit.arena.auth.TypedDataEncoder;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.common.LedgerSequencer;
import com.bit.arena.config.LedgerProperties;
import com.bit.arena.exception.AuthorizationException;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.structure.access.Role;
import com.bit.arena.structure.auth.AccountNonces;
import com.bit.arena.structure.auth.AuthorizationPayload;
import com.bit.arena.structure.auth.NonceScope;
import com.bit.arena.util.ByteUtils;
import com.bit.arena.util.Secp256k1Signer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class AuthorizationVerifierImpl implements AuthorizationVerifier {

    /**
     * 每个账户拥有自己的 nonce 计数器组
     */
    private final Map<AccountId, AccountNonces> nonces = new HashMap<>();

    /**
     * 签名者恢复缓存：key=摘要Hex:签名Hex，value=恢复出的地址（无法恢复时为空）
     * 恢复是纯函数，缓存命中不影响 nonce 校验
     */
    private final Cache<String, Optional<AccountId>> recoveryCache;

    private final TypedDataEncoder encoder;
    private final AccessControlService accessControl;
    private final LedgerSequencer sequencer;
    private final Clock clock;

    @Autowired
    public AuthorizationVerifierImpl(TypedDataEncoder encoder, AccessControlService accessControl,
                                     LedgerSequencer sequencer, Clock clock, LedgerProperties properties) {
        this(encoder, accessControl, sequencer, clock, properties.getSignatureCacheSize());
    }

    public AuthorizationVerifierImpl(TypedDataEncoder encoder, AccessControlService accessControl,
                                     LedgerSequencer sequencer, Clock clock, long cacheSize) {
        this.encoder = encoder;
        this.accessControl = accessControl;
        this.sequencer = sequencer;
        this.clock = clock;
        this.recoveryCache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .recordStats()
                .build();
    }

    @Override
    public AccountId verifyBackendAuthorization(AuthorizationPayload payload, long deadline, byte[] signature) {
        return sequencer.write(() -> {
            AccountId signer = recoverSigner(payload, deadline, signature);
            if (!accessControl.hasRole(Role.BACKEND_SIGNER, signer)) {
                log.warn("后端授权失败：签名者 {} 不是 BACKEND_SIGNER，主体 {} 命名空间 {}",
                        signer, payload.subject(), payload.scope());
                throw new AuthorizationException(ErrorType.INVALID_SIGNER, "签名者 " + signer);
            }
            consume(payload);
            return signer;
        });
    }

    @Override
    public AccountId verifySelfAuthorization(AuthorizationPayload payload, long deadline, byte[] signature) {
        return sequencer.write(() -> {
            AccountId signer = recoverSigner(payload, deadline, signature);
            if (!signer.equals(payload.subject())) {
                log.warn("自助授权失败：签名者 {} 与主体 {} 不一致", signer, payload.subject());
                throw new AuthorizationException(ErrorType.INVALID_SIGNATURE, "签名者与账户不一致");
            }
            consume(payload);
            return signer;
        });
    }

    /**
     * 截止时间检查 + 按当前 nonce 构造摘要 + 恢复签名者
     */
    private AccountId recoverSigner(AuthorizationPayload payload, long deadline, byte[] signature) {
        long now = clock.instant().getEpochSecond();
        if (now > deadline) {
            throw new AuthorizationException(ErrorType.SIGNATURE_EXPIRED,
                    "截止时间 " + deadline + " 早于当前时间 " + now);
        }
        long nonce = noncesOf(payload.subject()).current(payload.scope());
        byte[] digest = encoder.digest(payload, nonce, deadline);
        if (signature == null) {
            throw new AuthorizationException(ErrorType.INVALID_SIGNATURE, "签名为空");
        }
        String cacheKey = ByteUtils.bytesToHex(digest) + ":" + ByteUtils.bytesToHex(signature);
        Optional<AccountId> signer = recoveryCache.get(cacheKey,
                k -> Optional.ofNullable(Secp256k1Signer.recoverAddress(digest, signature)));
        if (signer.isEmpty()) {
            throw new AuthorizationException(ErrorType.INVALID_SIGNATURE, "无法从签名恢复公钥");
        }
        return signer.get();
    }

    private void consume(AuthorizationPayload payload) {
        long next = noncesOf(payload.subject()).consume(payload.scope());
        log.debug("nonce 已消费：{} {} -> {}", payload.subject(), payload.scope(), next);
    }

    private AccountNonces noncesOf(AccountId account) {
        return nonces.computeIfAbsent(account, k -> new AccountNonces());
    }

    @Override
    public long nonceOf(AccountId account, NonceScope scope) {
        return sequencer.read(() -> {
            AccountNonces accountNonces = nonces.get(account);
            return accountNonces == null ? 0L : accountNonces.current(scope);
        });
    }

    @Override
    public Hash32 domainSeparator() {
        return encoder.getDomainSeparator();
    }

    @Override
    public Hash32 digest(AuthorizationPayload payload, long deadline) {
        long nonce = nonceOf(payload.subject(), payload.scope());
        return Hash32.fromBytes(encoder.digest(payload, nonce, deadline));
    }
}
