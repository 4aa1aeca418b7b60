package com.bit.arena.structure.notification;

import com.bit.arena.common.AccountId;
import lombok.Value;

public final class MarketNotifications {

    private MarketNotifications() {
    }

    @Value
    public static class ListingCreated implements LedgerNotification {
        long listingId;
        AccountId seller;
        long itemId;
        long amount;
        long pricePerUnit;
        long occurredAt;
    }

    @Value
    public static class ListingCancelled implements LedgerNotification {
        long listingId;
        AccountId seller;
        long returnedAmount;
        long occurredAt;
    }

    @Value
    public static class ItemSold implements LedgerNotification {
        long listingId;
        AccountId buyer;
        AccountId seller;
        long itemId;
        long amount;
        long totalPrice;
        long fee;
        long remainingAmount;
        long occurredAt;
    }

    @Value
    public static class PlatformFeeUpdated implements LedgerNotification {
        int oldFeeBps;
        int newFeeBps;
        long occurredAt;
    }

    @Value
    public static class FeesWithdrawn implements LedgerNotification {
        AccountId to;
        long amount;
        long occurredAt;
    }
}
