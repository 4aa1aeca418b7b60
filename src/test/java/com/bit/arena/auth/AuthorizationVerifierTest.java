package com.bit.arena.auth;

import com.bit.arena.LedgerFixture;
import com.bit.arena.common.AccountId;
import com.bit.arena.exception.AuthorizationException;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.structure.access.Role;
import com.bit.arena.structure.auth.NonceScope;
import com.bit.arena.structure.auth.RegisterPayload;
import com.bit.arena.structure.auth.StatsUpdatePayload;
import com.bit.arena.structure.profile.ProfileStats;
import com.bit.arena.util.Secp256k1Signer;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class AuthorizationVerifierTest {

    private LedgerFixture fixture;
    private ECKey userKey;
    private AccountId user;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        userKey = Secp256k1Signer.generateKey();
        user = Secp256k1Signer.addressOf(userKey);
    }

    @Test
    void testBackendAuthorizationConsumesNonce() {
        StatsUpdatePayload payload = new StatsUpdatePayload(user, new ProfileStats(1, 1, 0, 0));
        long deadline = fixture.deadline();
        byte[] signature = fixture.backendSigner.sign(payload, 0, deadline);

        AccountId signer = fixture.verifier.verifyBackendAuthorization(payload, deadline, signature);
        assertEquals(fixture.backend, signer);
        assertEquals(1, fixture.verifier.nonceOf(user, NonceScope.STATS_UPDATE));
        // 其他命名空间不受影响
        assertEquals(0, fixture.verifier.nonceOf(user, NonceScope.CLAIM));
        assertEquals(0, fixture.verifier.nonceOf(user, NonceScope.REGISTER));
    }

    @Test
    void testReplayRejected() {
        StatsUpdatePayload payload = new StatsUpdatePayload(user, new ProfileStats(1, 1, 0, 0));
        long deadline = fixture.deadline();
        byte[] signature = fixture.backendSigner.sign(payload, 0, deadline);
        fixture.verifier.verifyBackendAuthorization(payload, deadline, signature);

        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> fixture.verifier.verifyBackendAuthorization(payload, deadline, signature));
        log.info("重放被拒绝：{}", e.getMessage());
        assertEquals(1, fixture.verifier.nonceOf(user, NonceScope.STATS_UPDATE));

        // 用新 nonce 重新签名可以通过
        byte[] fresh = fixture.backendSigner.sign(payload, 1, deadline);
        fixture.verifier.verifyBackendAuthorization(payload, deadline, fresh);
        assertEquals(2, fixture.verifier.nonceOf(user, NonceScope.STATS_UPDATE));
    }

    @Test
    void testExpiredSignature() {
        RegisterPayload payload = new RegisterPayload(user);
        long deadline = fixture.clock.now() + 10;
        byte[] signature = fixture.signerFor(userKey).sign(payload, 0, deadline);

        fixture.clock.advance(11);
        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> fixture.verifier.verifySelfAuthorization(payload, deadline, signature));
        assertEquals(ErrorType.SIGNATURE_EXPIRED, e.getErrorType());
        assertTrue(e.getErrorType().isRetryable());
        assertEquals(0, fixture.verifier.nonceOf(user, NonceScope.REGISTER));
    }

    @Test
    void testDeadlineIsInclusive() {
        RegisterPayload payload = new RegisterPayload(user);
        long deadline = fixture.clock.now() + 10;
        byte[] signature = fixture.signerFor(userKey).sign(payload, 0, deadline);
        fixture.clock.set(deadline);
        assertEquals(user, fixture.verifier.verifySelfAuthorization(payload, deadline, signature));
    }

    @Test
    void testSignerWithoutBackendRole() {
        StatsUpdatePayload payload = new StatsUpdatePayload(user, new ProfileStats(1, 1, 0, 0));
        long deadline = fixture.deadline();
        byte[] signature = fixture.signerFor(userKey).sign(payload, 0, deadline);

        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> fixture.verifier.verifyBackendAuthorization(payload, deadline, signature));
        assertEquals(ErrorType.INVALID_SIGNER, e.getErrorType());
        assertEquals(0, fixture.verifier.nonceOf(user, NonceScope.STATS_UPDATE));
    }

    @Test
    void testRevokedBackendSigner() {
        StatsUpdatePayload payload = new StatsUpdatePayload(user, new ProfileStats(1, 1, 0, 0));
        long deadline = fixture.deadline();
        byte[] signature = fixture.backendSigner.sign(payload, 0, deadline);

        fixture.accessControl.revokeRole(fixture.admin, Role.BACKEND_SIGNER, fixture.backend);
        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> fixture.verifier.verifyBackendAuthorization(payload, deadline, signature));
        assertEquals(ErrorType.INVALID_SIGNER, e.getErrorType());
    }

    @Test
    void testSelfAuthorizationRequiresSubject() {
        RegisterPayload payload = new RegisterPayload(user);
        long deadline = fixture.deadline();
        // 后端密钥也不能替用户签注册
        byte[] signature = fixture.backendSigner.sign(payload, 0, deadline);

        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> fixture.verifier.verifySelfAuthorization(payload, deadline, signature));
        assertEquals(ErrorType.INVALID_SIGNATURE, e.getErrorType());
    }

    @Test
    void testMalformedSignature() {
        RegisterPayload payload = new RegisterPayload(user);
        long deadline = fixture.deadline();
        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> fixture.verifier.verifySelfAuthorization(payload, deadline, new byte[10]));
        assertEquals(ErrorType.INVALID_SIGNATURE, e.getErrorType());

        e = assertThrows(AuthorizationException.class,
                () -> fixture.verifier.verifySelfAuthorization(payload, deadline, null));
        assertEquals(ErrorType.INVALID_SIGNATURE, e.getErrorType());
    }

    @Test
    void testSignatureForOtherTypeRejected() {
        long deadline = fixture.deadline();
        // 用户对注册消息的签名，拿去冒充统计更新
        byte[] registerSig = fixture.signerFor(userKey).sign(new RegisterPayload(user), 0, deadline);
        fixture.accessControl.grantRole(fixture.admin, Role.BACKEND_SIGNER, user);

        StatsUpdatePayload stats = new StatsUpdatePayload(user, new ProfileStats());
        assertThrows(AuthorizationException.class,
                () -> fixture.verifier.verifyBackendAuthorization(stats, deadline, registerSig));
        assertEquals(0, fixture.verifier.nonceOf(user, NonceScope.STATS_UPDATE));
    }

    @Test
    void testDigestPreviewMatchesSigner() {
        RegisterPayload payload = new RegisterPayload(user);
        long deadline = fixture.deadline();
        assertArrayEquals(fixture.encoder.digest(payload, 0, deadline),
                fixture.verifier.digest(payload, deadline).toBytes());
        assertEquals(fixture.encoder.getDomainSeparator(), fixture.verifier.domainSeparator());
    }
}
