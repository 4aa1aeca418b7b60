package com.bit.arena.achievement;

import com.bit.arena.LedgerFixture;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.exception.AuthorizationException;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.StateException;
import com.bit.arena.exception.ValidationException;
import com.bit.arena.structure.achievement.Achievement;
import com.bit.arena.structure.auth.ClaimAchievementPayload;
import com.bit.arena.structure.auth.NonceScope;
import com.bit.arena.structure.notification.AchievementNotifications;
import com.bit.arena.util.ByteUtils;
import com.bit.arena.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class AchievementServiceTest {

    private LedgerFixture fixture;
    private AchievementService achievements;
    private final AccountId user = AccountId.systemAccount("player-1");
    private final Hash32 metadata = Hash32.fromBytes(Sha.applyKeccak256("ipfs://metadata"));

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        achievements = fixture.achievements;
    }

    private Achievement claim(long eventId, int tier) {
        long deadline = fixture.deadline();
        long nonce = fixture.verifier.nonceOf(user, NonceScope.CLAIM);
        byte[] signature = fixture.backendSigner.sign(
                new ClaimAchievementPayload(user, eventId, tier, metadata), nonce, deadline);
        return achievements.claim(user, eventId, tier, metadata, deadline, signature);
    }

    @Test
    void testClaim() {
        Achievement achievement = claim(7, 3);
        assertEquals(user, achievement.getAccount());
        assertEquals(7, achievement.getEventId());
        assertEquals(3, achievement.getTier());
        assertEquals(LedgerFixture.START, achievement.getUnlockedAt());
        assertEquals(metadata, achievement.getMetadataHash());

        assertTrue(achievements.hasAchievement(user, 7));
        assertFalse(achievements.hasAchievement(user, 8));
        assertNull(achievements.getAchievement(user, 8));

        AchievementNotifications.Claimed claimed =
                fixture.notificationsOf(AchievementNotifications.Claimed.class).get(0);
        assertEquals(achievements.achievementKey(user, 7), claimed.getAchievementKey());
        assertEquals(fixture.backend, claimed.getSigner());
    }

    @Test
    void testAchievementKey() {
        Hash32 expected = Hash32.fromBytes(Sha.applyKeccak256(user.toBytes(), ByteUtils.uint256(7)));
        assertEquals(expected, achievements.achievementKey(user, 7));
        assertNotEquals(expected, achievements.achievementKey(user, 8));
    }

    @Test
    void testDuplicateClaimRejected() {
        claim(7, 3);
        StateException e = assertThrows(StateException.class, () -> claim(7, 5));
        assertEquals(ErrorType.ALREADY_HAS_ACHIEVEMENT, e.getErrorType());
        assertFalse(e.getErrorType().isRetryable());
        // 签名已被接受，nonce 不回退
        assertEquals(2, fixture.verifier.nonceOf(user, NonceScope.CLAIM));
        assertEquals(3, achievements.getAchievement(user, 7).getTier());
        assertEquals(1, achievements.countForAccount(user));
    }

    @Test
    void testTierOutOfRange() {
        ValidationException zero = assertThrows(ValidationException.class, () -> claim(1, 0));
        assertEquals(ErrorType.INVALID_TIER, zero.getErrorType());
        ValidationException six = assertThrows(ValidationException.class, () -> claim(1, 6));
        assertEquals(ErrorType.INVALID_TIER, six.getErrorType());
        assertFalse(achievements.hasAchievement(user, 1));
        assertEquals(2, fixture.verifier.nonceOf(user, NonceScope.CLAIM));
    }

    @Test
    void testTierNotEncodableRejectedBeforeVerification() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> achievements.claim(user, 1, 256, metadata, fixture.deadline(), new byte[65]));
        assertEquals(ErrorType.INVALID_TIER, e.getErrorType());
        assertEquals(0, fixture.verifier.nonceOf(user, NonceScope.CLAIM));
    }

    @Test
    void testClaimTamperedMetadata() {
        long deadline = fixture.deadline();
        byte[] signature = fixture.backendSigner.sign(
                new ClaimAchievementPayload(user, 1, 2, metadata), 0, deadline);
        assertThrows(AuthorizationException.class,
                () -> achievements.claim(user, 1, 2, Hash32.ZERO, deadline, signature));
        assertFalse(achievements.hasAchievement(user, 1));
    }

    @Test
    void testListInClaimOrder() {
        claim(30, 1);
        claim(10, 2);
        claim(20, 3);
        List<Achievement> list = achievements.listForAccount(user);
        assertEquals(3, list.size());
        assertEquals(30, list.get(0).getEventId());
        assertEquals(10, list.get(1).getEventId());
        assertEquals(20, list.get(2).getEventId());
        assertThrows(UnsupportedOperationException.class, () -> list.remove(0));
        assertTrue(achievements.listForAccount(AccountId.systemAccount("nobody")).isEmpty());
    }
}
