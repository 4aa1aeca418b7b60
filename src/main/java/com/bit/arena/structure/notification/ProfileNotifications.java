package com.bit.arena.structure.notification;

import com.bit.arena.common.AccountId;
import com.bit.arena.structure.profile.Tier;
import lombok.Value;

public final class ProfileNotifications {

    private ProfileNotifications() {
    }

    @Value
    public static class Registered implements LedgerNotification {
        AccountId account;
        // 是否经由中继提交的自助签名注册
        boolean relayed;
        long occurredAt;
    }

    @Value
    public static class StatsUpdated implements LedgerNotification {
        AccountId account;
        long xp;
        long level;
        long progressCount;
        long achievementCount;
        AccountId signer;
        long occurredAt;
    }

    @Value
    public static class TierUpgraded implements LedgerNotification {
        AccountId account;
        Tier oldTier;
        Tier newTier;
        long occurredAt;
    }
}
