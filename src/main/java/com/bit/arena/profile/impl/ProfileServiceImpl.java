package com.bit.arena.profile.impl;

import com.bit.arena.auth.AuthorizationVerifier;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.LedgerSequencer;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.StateException;
import com.bit.arena.exception.ValidationException;
import com.bit.arena.profile.ProfileService;
import com.bit.arena.structure.auth.RegisterPayload;
import com.bit.arena.structure.auth.StatsUpdatePayload;
import com.bit.arena.structure.notification.ProfileNotifications;
import com.bit.arena.structure.profile.Profile;
import com.bit.arena.structure.profile.ProfileStats;
import com.bit.arena.structure.profile.Tier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
public class ProfileServiceImpl implements ProfileService {

    /**
     * 档案表：账户 -> 档案，只增不删
     */
    private final Map<AccountId, Profile> profiles = new HashMap<>();

    private final AuthorizationVerifier verifier;
    private final LedgerSequencer sequencer;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public ProfileServiceImpl(AuthorizationVerifier verifier, LedgerSequencer sequencer,
                              ApplicationEventPublisher publisher, Clock clock) {
        this.verifier = verifier;
        this.sequencer = sequencer;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public Profile register(AccountId caller) {
        return sequencer.write(() -> create(caller, false));
    }

    @Override
    public Profile registerFor(AccountId account, long deadline, byte[] signature) {
        return sequencer.write(() -> {
            verifier.verifySelfAuthorization(new RegisterPayload(account), deadline, signature);
            return create(account, true);
        });
    }

    private Profile create(AccountId account, boolean relayed) {
        if (profiles.containsKey(account)) {
            throw new StateException(ErrorType.ALREADY_REGISTERED, account.toHex());
        }
        long now = now();
        Profile profile = Profile.registered(account, now);
        profiles.put(account, profile);
        log.info("账户注册：{}{}", account, relayed ? "（中继）" : "");
        publisher.publishEvent(new ProfileNotifications.Registered(account, relayed, now));
        return profile.copy();
    }

    @Override
    public Profile updateStats(AccountId account, ProfileStats stats, long deadline, byte[] signature) {
        // uint256 无法表示负数，这类载荷不可能被签名
        if (stats.getXp() < 0 || stats.getLevel() < 0 || stats.getProgressCount() < 0 || stats.getAchievementCount() < 0) {
            throw new ValidationException(ErrorType.INVALID_AMOUNT, "统计值不能为负");
        }
        return sequencer.write(() -> {
            AccountId signer = verifier.verifyBackendAuthorization(
                    new StatsUpdatePayload(account, stats), deadline, signature);
            Profile profile = profiles.get(account);
            if (profile == null) {
                throw new StateException(ErrorType.NOT_REGISTERED, account.toHex());
            }
            Tier oldTier = profile.getTier();
            long now = now();
            profile.apply(stats, now);
            Tier newTier = profile.getTier();
            log.info("统计更新：{} xp={} level={} 签名者 {}", account, stats.getXp(), stats.getLevel(), signer);
            publisher.publishEvent(new ProfileNotifications.StatsUpdated(account, stats.getXp(), stats.getLevel(),
                    stats.getProgressCount(), stats.getAchievementCount(), signer, now));
            if (newTier.getRank() > oldTier.getRank()) {
                log.info("段位提升：{} {} -> {}", account, oldTier, newTier);
                publisher.publishEvent(new ProfileNotifications.TierUpgraded(account, oldTier, newTier, now));
            }
            return profile.copy();
        });
    }

    @Override
    public Profile getProfile(AccountId account) {
        return sequencer.read(() -> {
            Profile profile = profiles.get(account);
            return profile == null ? null : profile.copy();
        });
    }

    @Override
    public boolean isRegistered(AccountId account) {
        return sequencer.read(() -> profiles.containsKey(account));
    }

    @Override
    public Tier getTier(AccountId account) {
        return sequencer.read(() -> {
            Profile profile = profiles.get(account);
            return profile == null ? null : profile.getTier();
        });
    }

    @Override
    public long registeredCount() {
        return sequencer.read(() -> (long) profiles.size());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
