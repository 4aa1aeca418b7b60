package com.bit.arena.structure.notification;

import com.bit.arena.common.AccountId;
import com.bit.arena.structure.cosmetic.CosmeticCategory;
import com.bit.arena.structure.cosmetic.Rarity;
import lombok.Value;

public final class CosmeticNotifications {

    private CosmeticNotifications() {
    }

    @Value
    public static class ItemCreated implements LedgerNotification {
        long itemId;
        String name;
        CosmeticCategory category;
        Rarity rarity;
        long maxSupply;
        int minTier;
        long occurredAt;
    }

    @Value
    public static class ItemMinted implements LedgerNotification {
        AccountId to;
        long itemId;
        long amount;
        long currentSupply;
        long occurredAt;
    }

    @Value
    public static class ItemEquipped implements LedgerNotification {
        AccountId account;
        CosmeticCategory category;
        long itemId;
        long occurredAt;
    }

    @Value
    public static class ItemUnequipped implements LedgerNotification {
        AccountId account;
        CosmeticCategory category;
        long itemId;
        long occurredAt;
    }

    @Value
    public static class ItemTransferred implements LedgerNotification {
        AccountId from;
        AccountId to;
        long itemId;
        long amount;
        long occurredAt;
    }
}
