package com.bit.arena.structure.notification;

import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import lombok.Value;

public final class AchievementNotifications {

    private AchievementNotifications() {
    }

    @Value
    public static class Claimed implements LedgerNotification {
        AccountId to;
        long eventId;
        int tier;
        Hash32 metadataHash;
        Hash32 achievementKey;
        AccountId signer;
        long occurredAt;
    }
}
