package com.bit.arena.structure.notification;

import com.bit.arena.common.AccountId;
import lombok.Value;

public final class BalanceNotifications {

    private BalanceNotifications() {
    }

    @Value
    public static class Deposited implements LedgerNotification {
        AccountId to;
        long amount;
        long balance;
        long occurredAt;
    }
}
