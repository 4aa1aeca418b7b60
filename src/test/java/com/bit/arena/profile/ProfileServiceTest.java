package com.bit.arena.profile;

import com.bit.arena.LedgerFixture;
import com.bit.arena.common.AccountId;
import com.bit.arena.exception.AuthorizationException;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.StateException;
import com.bit.arena.exception.ValidationException;
import com.bit.arena.structure.auth.NonceScope;
import com.bit.arena.structure.auth.RegisterPayload;
import com.bit.arena.structure.auth.StatsUpdatePayload;
import com.bit.arena.structure.notification.ProfileNotifications;
import com.bit.arena.structure.profile.Profile;
import com.bit.arena.structure.profile.ProfileStats;
import com.bit.arena.structure.profile.Tier;
import com.bit.arena.util.Secp256k1Signer;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class ProfileServiceTest {

    private LedgerFixture fixture;
    private ProfileService profiles;
    private ECKey userKey;
    private AccountId user;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        profiles = fixture.profiles;
        userKey = Secp256k1Signer.generateKey();
        user = Secp256k1Signer.addressOf(userKey);
    }

    @Test
    void testRegister() {
        Profile profile = profiles.register(user);
        assertTrue(profile.isExists());
        assertEquals(0, profile.getXp());
        assertEquals(0, profile.getLevel());
        assertEquals(LedgerFixture.START, profile.getLastUpdated());
        assertTrue(profiles.isRegistered(user));
        assertEquals(Tier.BRONZE, profiles.getTier(user));
        assertEquals(1, profiles.registeredCount());

        StateException e = assertThrows(StateException.class, () -> profiles.register(user));
        assertEquals(ErrorType.ALREADY_REGISTERED, e.getErrorType());
        assertEquals(1, fixture.notificationsOf(ProfileNotifications.Registered.class).size());
    }

    @Test
    void testRegisterForRelayed() {
        long deadline = fixture.deadline();
        byte[] signature = fixture.signerFor(userKey).sign(new RegisterPayload(user), 0, deadline);
        Profile profile = profiles.registerFor(user, deadline, signature);
        assertTrue(profile.isExists());
        assertTrue(fixture.notificationsOf(ProfileNotifications.Registered.class).get(0).isRelayed());
        assertEquals(1, fixture.verifier.nonceOf(user, NonceScope.REGISTER));

        // 已注册后再次中继注册：签名有效但业务拒绝，nonce 依旧被消费
        byte[] second = fixture.signerFor(userKey).sign(new RegisterPayload(user), 1, deadline);
        StateException e = assertThrows(StateException.class, () -> profiles.registerFor(user, deadline, second));
        assertEquals(ErrorType.ALREADY_REGISTERED, e.getErrorType());
        assertEquals(2, fixture.verifier.nonceOf(user, NonceScope.REGISTER));
    }

    @Test
    void testRegisterForRejectsForeignSignature() {
        long deadline = fixture.deadline();
        ECKey other = Secp256k1Signer.generateKey();
        byte[] signature = fixture.signerFor(other).sign(new RegisterPayload(user), 0, deadline);
        assertThrows(AuthorizationException.class, () -> profiles.registerFor(user, deadline, signature));
        assertFalse(profiles.isRegistered(user));
    }

    @Test
    void testStatsUpdateTierUpgradeAndReplay() {
        profiles.register(user);
        long deadline = fixture.deadline();
        ProfileStats stats = new ProfileStats(1200, 3, 7, 1);
        byte[] signature = fixture.backendSigner.sign(new StatsUpdatePayload(user, stats), 0, deadline);

        fixture.clock.advance(60);
        Profile updated = profiles.updateStats(user, stats, deadline, signature);
        assertEquals(1200, updated.getXp());
        assertEquals(3, updated.getLevel());
        assertEquals(7, updated.getProgressCount());
        assertEquals(1, updated.getAchievementCount());
        assertEquals(LedgerFixture.START + 60, updated.getLastUpdated());

        List<ProfileNotifications.TierUpgraded> upgrades = fixture.notificationsOf(ProfileNotifications.TierUpgraded.class);
        assertEquals(1, upgrades.size());
        assertEquals(Tier.BRONZE, upgrades.get(0).getOldTier());
        assertEquals(Tier.SILVER, upgrades.get(0).getNewTier());
        assertEquals(fixture.backend, fixture.notificationsOf(ProfileNotifications.StatsUpdated.class).get(0).getSigner());

        // 原样重放
        assertThrows(AuthorizationException.class, () -> profiles.updateStats(user, stats, deadline, signature));
        assertEquals(1, fixture.verifier.nonceOf(user, NonceScope.STATS_UPDATE));
    }

    @Test
    void testSameTierNoUpgradeAndDowngradeAllowed() {
        profiles.register(user);
        long deadline = fixture.deadline();
        ProfileStats high = new ProfileStats(0, 9, 0, 0);
        profiles.updateStats(user, high, deadline,
                fixture.backendSigner.sign(new StatsUpdatePayload(user, high), 0, deadline));
        ProfileStats low = new ProfileStats(0, 4, 0, 0);
        profiles.updateStats(user, low, deadline,
                fixture.backendSigner.sign(new StatsUpdatePayload(user, low), 1, deadline));

        assertEquals(Tier.SILVER, profiles.getTier(user));
        assertEquals(1, fixture.notificationsOf(ProfileNotifications.TierUpgraded.class).size());
    }

    @Test
    void testStatsForUnregisteredConsumesNonce() {
        long deadline = fixture.deadline();
        ProfileStats stats = new ProfileStats(1, 1, 0, 0);
        byte[] signature = fixture.backendSigner.sign(new StatsUpdatePayload(user, stats), 0, deadline);

        StateException e = assertThrows(StateException.class, () -> profiles.updateStats(user, stats, deadline, signature));
        assertEquals(ErrorType.NOT_REGISTERED, e.getErrorType());
        assertEquals(1, fixture.verifier.nonceOf(user, NonceScope.STATS_UPDATE));
        assertNull(profiles.getProfile(user));
    }

    @Test
    void testNegativeStatsRejected() {
        profiles.register(user);
        ProfileStats stats = new ProfileStats(-1, 1, 0, 0);
        assertThrows(ValidationException.class,
                () -> profiles.updateStats(user, stats, fixture.deadline(), new byte[65]));
    }

    @Test
    void testReturnedProfileIsCopy() {
        profiles.register(user);
        Profile profile = profiles.getProfile(user);
        profile.setLevel(99);
        assertEquals(0, profiles.getProfile(user).getLevel());
    }
}
