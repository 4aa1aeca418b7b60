package com.bit.arena.achievement.impl;

import com.bit.arena.achievement.AchievementService;
import com.bit.arena.auth.AuthorizationVerifier;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.common.LedgerSequencer;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.StateException;
import com.bit.arena.exception.ValidationException;
import com.bit.arena.structure.achievement.Achievement;
import com.bit.arena.structure.auth.ClaimAchievementPayload;
import com.bit.arena.structure.notification.AchievementNotifications;
import com.bit.arena.util.ByteUtils;
import com.bit.arena.util.Sha;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class AchievementServiceImpl implements AchievementService {

    public static final int MIN_TIER = 1;
    public static final int MAX_TIER = 5;

    /**
     * 成就记录：keccak(to || eventId) -> 记录，O(1) 判重
     */
    private final Map<Hash32, Achievement> records = new HashMap<>();

    /**
     * 账户 -> 已领取记录的主键，按插入顺序
     */
    private final Map<AccountId, List<Hash32>> byAccount = new HashMap<>();

    private final AuthorizationVerifier verifier;
    private final LedgerSequencer sequencer;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public AchievementServiceImpl(AuthorizationVerifier verifier, LedgerSequencer sequencer,
                                  ApplicationEventPublisher publisher, Clock clock) {
        this.verifier = verifier;
        this.sequencer = sequencer;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public Achievement claim(AccountId to, long eventId, int tier, Hash32 metadataHash, long deadline, byte[] signature) {
        // uint8 / uint256 放不下的值无法构成合法载荷
        if (tier < 0 || tier > 0xFF) {
            throw new ValidationException(ErrorType.INVALID_TIER, "tier=" + tier);
        }
        if (eventId < 0) {
            throw new ValidationException(ErrorType.INVALID_AMOUNT, "eventId=" + eventId);
        }
        return sequencer.write(() -> {
            AccountId signer = verifier.verifyBackendAuthorization(
                    new ClaimAchievementPayload(to, eventId, tier, metadataHash), deadline, signature);
            Hash32 key = achievementKey(to, eventId);
            if (records.containsKey(key)) {
                log.warn("重复领取：{} 活动 {}", to, eventId);
                throw new StateException(ErrorType.ALREADY_HAS_ACHIEVEMENT, to + " 活动 " + eventId);
            }
            if (tier < MIN_TIER || tier > MAX_TIER) {
                throw new ValidationException(ErrorType.INVALID_TIER, "tier=" + tier);
            }
            long now = clock.instant().getEpochSecond();
            Achievement achievement = new Achievement(to, eventId, tier, now, metadataHash);
            records.put(key, achievement);
            byAccount.computeIfAbsent(to, k -> new ArrayList<>()).add(key);
            log.info("成就领取：{} 活动 {} 等级 {}，签名者 {}", to, eventId, tier, signer);
            publisher.publishEvent(new AchievementNotifications.Claimed(to, eventId, tier, metadataHash, key, signer, now));
            return achievement;
        });
    }

    @Override
    public boolean hasAchievement(AccountId account, long eventId) {
        return sequencer.read(() -> records.containsKey(achievementKey(account, eventId)));
    }

    @Override
    public Achievement getAchievement(AccountId account, long eventId) {
        return sequencer.read(() -> records.get(achievementKey(account, eventId)));
    }

    @Override
    public List<Achievement> listForAccount(AccountId account) {
        return sequencer.read(() -> {
            ImmutableList.Builder<Achievement> builder = ImmutableList.builder();
            for (Hash32 key : byAccount.getOrDefault(account, List.of())) {
                builder.add(records.get(key));
            }
            return builder.build();
        });
    }

    @Override
    public long countForAccount(AccountId account) {
        return sequencer.read(() -> (long) byAccount.getOrDefault(account, List.of()).size());
    }

    @Override
    public Hash32 achievementKey(AccountId to, long eventId) {
        return Hash32.fromBytes(Sha.applyKeccak256(to.toBytes(), ByteUtils.uint256(eventId)));
    }
}
