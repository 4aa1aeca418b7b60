package com.bit.arena.structure.notification;

import com.bit.arena.structure.event.RewardConfig;
import lombok.Value;

public final class EventNotifications {

    private EventNotifications() {
    }

    @Value
    public static class Created implements LedgerNotification {
        long eventId;
        String name;
        long startTime;
        long endTime;
        long maxParticipants;
        boolean hasReward;
        long occurredAt;
    }

    @Value
    public static class Updated implements LedgerNotification {
        long eventId;
        String name;
        long startTime;
        long endTime;
        long maxParticipants;
        boolean active;
        long occurredAt;
    }

    @Value
    public static class RewardSet implements LedgerNotification {
        long eventId;
        RewardConfig reward;
        long occurredAt;
    }

    @Value
    public static class ParticipantAdded implements LedgerNotification {
        long eventId;
        long currentParticipants;
        long occurredAt;
    }
}
