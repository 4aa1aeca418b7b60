package com.bit.arena.structure.notification;

import com.bit.arena.common.AccountId;
import com.bit.arena.structure.access.Role;
import lombok.Value;

public final class AccessNotifications {

    private AccessNotifications() {
    }

    @Value
    public static class RoleGranted implements LedgerNotification {
        Role role;
        AccountId account;
        AccountId sender;
        long occurredAt;
    }

    @Value
    public static class RoleRevoked implements LedgerNotification {
        Role role;
        AccountId account;
        AccountId sender;
        long occurredAt;
    }
}
