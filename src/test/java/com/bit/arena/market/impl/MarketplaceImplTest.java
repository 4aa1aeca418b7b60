package com.bit.arena.market.impl;

import com.bit.arena.LedgerFixture;
import com.bit.arena.balance.BalanceLedger;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.exception.AccessDeniedException;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.SettlementException;
import com.bit.arena.exception.StateException;
import com.bit.arena.exception.ValidationException;
import com.bit.arena.market.Marketplace;
import com.bit.arena.structure.cosmetic.CosmeticCategory;
import com.bit.arena.structure.cosmetic.Rarity;
import com.bit.arena.structure.market.Listing;
import com.bit.arena.structure.market.ListingStatus;
import com.bit.arena.structure.market.PriceQuote;
import com.bit.arena.structure.notification.MarketNotifications;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class MarketplaceImplTest {

    private static final long ITEM = 11;
    private static final long PRICE = 1_000;

    private final AccountId seller = AccountId.systemAccount("seller");
    private final AccountId buyer = AccountId.systemAccount("buyer");

    private LedgerFixture fixture;
    private Marketplace market;

    private void setUp(LedgerFixture ledgerFixture) {
        fixture = ledgerFixture;
        market = fixture.marketplace;
        fixture.catalog.createItem(fixture.admin, ITEM, "传说之刃皮肤", CosmeticCategory.ACCESSORY.getCode(),
                Rarity.LEGENDARY.getCode(), Hash32.ZERO, 0, 0);
        fixture.catalog.mintItem(fixture.admin, seller, ITEM, 10);
        fixture.balances.deposit(fixture.admin, buyer, 100_000);
        fixture.notifications.clear();
    }

    private long units(AccountId account) {
        return fixture.catalog.balanceOf(account, ITEM);
    }

    private long conservedUnits() {
        return units(seller) + units(buyer) + units(market.escrowAccount());
    }

    private long conservedValue() {
        return fixture.balances.balanceOf(seller) + fixture.balances.balanceOf(buyer)
                + fixture.balances.balanceOf(market.treasuryAccount());
    }

    @Test
    void testPartialPurchase() {
        setUp(new LedgerFixture());
        market.setPlatformFee(fixture.admin, 500);

        Listing listing = market.createListing(seller, ITEM, 5, PRICE);
        assertEquals(1, listing.getId());
        assertEquals(5, units(market.escrowAccount()));
        assertEquals(5, units(seller));

        Listing after = market.buyItem(buyer, listing.getId(), 2, 2 * PRICE);
        long fee = 2 * PRICE * 500 / 10_000;
        assertEquals(ListingStatus.ACTIVE, after.getStatus());
        assertEquals(3, after.getAmount());
        assertEquals(2, units(buyer));
        assertEquals(3, units(market.escrowAccount()));
        assertEquals(2 * PRICE - fee, fixture.balances.balanceOf(seller));
        assertEquals(fee, market.accumulatedFees());
        assertEquals(fee, fixture.balances.balanceOf(market.treasuryAccount()));
        assertEquals(100_000 - 2 * PRICE, fixture.balances.balanceOf(buyer));

        MarketNotifications.ItemSold sold = fixture.notificationsOf(MarketNotifications.ItemSold.class).get(0);
        assertEquals(fee, sold.getFee());
        assertEquals(3, sold.getRemainingAmount());
    }

    @Test
    void testSellOutAndRefund() {
        setUp(new LedgerFixture());
        long unitsBefore = conservedUnits();
        long valueBefore = conservedValue();

        Listing listing = market.createListing(seller, ITEM, 3, PRICE);
        fixture.clock.advance(30);
        Listing after = market.buyItem(buyer, listing.getId(), 3, 5_000);

        assertEquals(ListingStatus.SOLD, after.getStatus());
        assertEquals(0, after.getAmount());
        assertEquals(LedgerFixture.START + 30, after.getSoldAt());
        // 多付 2000 退回
        assertEquals(100_000 - 3 * PRICE, fixture.balances.balanceOf(buyer));
        assertEquals(unitsBefore, conservedUnits());
        assertEquals(valueBefore, conservedValue());
        assertTrue(market.activeListingsByItem(ITEM).isEmpty());
        assertEquals(1, market.listingsByItem(ITEM).size());

        StateException e = assertThrows(StateException.class, () -> market.buyItem(buyer, listing.getId(), 1, PRICE));
        assertEquals(ErrorType.LISTING_NOT_ACTIVE, e.getErrorType());
    }

    @Test
    void testCreateListingValidation() {
        setUp(new LedgerFixture());
        assertEquals(ErrorType.INVALID_AMOUNT, assertThrows(ValidationException.class,
                () -> market.createListing(seller, ITEM, 0, PRICE)).getErrorType());
        assertEquals(ErrorType.INVALID_PRICE, assertThrows(ValidationException.class,
                () -> market.createListing(seller, ITEM, 1, 0)).getErrorType());
        assertEquals(ErrorType.INSUFFICIENT_BALANCE, assertThrows(StateException.class,
                () -> market.createListing(seller, ITEM, 11, PRICE)).getErrorType());
        assertEquals(10, units(seller));
        assertNull(market.getListing(1));

        // 失败的挂单不占用ID
        assertEquals(1, market.createListing(seller, ITEM, 1, PRICE).getId());
        assertEquals(2, market.createListing(seller, ITEM, 1, PRICE).getId());
        assertEquals(2, market.listingsBySeller(seller).size());
    }

    @Test
    void testCancelListing() {
        setUp(new LedgerFixture());
        Listing listing = market.createListing(seller, ITEM, 4, PRICE);
        market.buyItem(buyer, listing.getId(), 1, PRICE);

        assertEquals(ErrorType.NOT_SELLER, assertThrows(AccessDeniedException.class,
                () -> market.cancelListing(buyer, listing.getId())).getErrorType());
        assertEquals(ErrorType.NOT_FOUND, assertThrows(StateException.class,
                () -> market.cancelListing(seller, 99)).getErrorType());

        Listing cancelled = market.cancelListing(seller, listing.getId());
        assertEquals(ListingStatus.CANCELLED, cancelled.getStatus());
        assertEquals(9, units(seller));
        assertEquals(0, units(market.escrowAccount()));
        assertEquals(3, fixture.notificationsOf(MarketNotifications.ListingCancelled.class).get(0).getReturnedAmount());

        assertEquals(ErrorType.LISTING_NOT_ACTIVE, assertThrows(StateException.class,
                () -> market.cancelListing(seller, listing.getId())).getErrorType());
    }

    @Test
    void testBuyValidation() {
        setUp(new LedgerFixture());
        Listing listing = market.createListing(seller, ITEM, 2, PRICE);

        assertEquals(ErrorType.INVALID_AMOUNT, assertThrows(ValidationException.class,
                () -> market.buyItem(buyer, listing.getId(), 3, 10 * PRICE)).getErrorType());
        assertEquals(ErrorType.INVALID_AMOUNT, assertThrows(ValidationException.class,
                () -> market.buyItem(buyer, listing.getId(), 0, PRICE)).getErrorType());
        SettlementException payment = assertThrows(SettlementException.class,
                () -> market.buyItem(buyer, listing.getId(), 2, 2 * PRICE - 1));
        assertEquals(ErrorType.INSUFFICIENT_PAYMENT, payment.getErrorType());
        assertEquals(ErrorType.NOT_FOUND, assertThrows(StateException.class,
                () -> market.buyItem(buyer, 42, 1, PRICE)).getErrorType());
        assertEquals(2, market.getListing(listing.getId()).getAmount());
    }

    @Test
    void testPriceOverflow() {
        setUp(new LedgerFixture());
        Listing listing = market.createListing(seller, ITEM, 2, Long.MAX_VALUE);
        ValidationException e = assertThrows(ValidationException.class,
                () -> market.buyItem(buyer, listing.getId(), 2, Long.MAX_VALUE));
        assertEquals(ErrorType.AMOUNT_OVERFLOW, e.getErrorType());
    }

    @Test
    void testBuyerCannotPay() {
        setUp(new LedgerFixture());
        AccountId poor = AccountId.systemAccount("poor");
        Listing listing = market.createListing(seller, ITEM, 2, PRICE);
        SettlementException e = assertThrows(SettlementException.class,
                () -> market.buyItem(poor, listing.getId(), 1, PRICE));
        assertEquals(ErrorType.TRANSFER_FAILED, e.getErrorType());
        assertEquals(2, market.getListing(listing.getId()).getAmount());
        assertEquals(0, units(poor));
    }

    @Test
    void testFailedPayoutRollsBackEverything() {
        FailingPayoutLedger[] failing = new FailingPayoutLedger[1];
        setUp(new LedgerFixture(ledger -> failing[0] = new FailingPayoutLedger(ledger, seller)));
        Listing listing = market.createListing(seller, ITEM, 5, PRICE);
        long unitsBefore = conservedUnits();
        long buyerBalance = fixture.balances.balanceOf(buyer);

        failing[0].armed = true;
        SettlementException e = assertThrows(SettlementException.class,
                () -> market.buyItem(buyer, listing.getId(), 2, 3 * PRICE));
        assertEquals(ErrorType.TRANSFER_FAILED, e.getErrorType());
        assertTrue(e.getErrorType().isRetryable());

        assertEquals(5, market.getListing(listing.getId()).getAmount());
        assertEquals(ListingStatus.ACTIVE, market.getListing(listing.getId()).getStatus());
        assertEquals(5, units(market.escrowAccount()));
        assertEquals(0, units(buyer));
        assertEquals(unitsBefore, conservedUnits());
        assertEquals(buyerBalance, fixture.balances.balanceOf(buyer));
        assertEquals(0, fixture.balances.balanceOf(seller));
        assertEquals(0, fixture.balances.balanceOf(market.treasuryAccount()));
        assertEquals(0, market.accumulatedFees());
        assertTrue(fixture.notificationsOf(MarketNotifications.ItemSold.class).isEmpty());

        failing[0].armed = false;
        market.buyItem(buyer, listing.getId(), 2, 2 * PRICE);
        assertEquals(3, market.getListing(listing.getId()).getAmount());
    }

    @Test
    void testPlatformFee() {
        setUp(new LedgerFixture());
        assertEquals(250, market.platformFeeBps());
        assertEquals(1000, market.maxPlatformFeeBps());
        assertEquals(ErrorType.INVALID_FEE, assertThrows(ValidationException.class,
                () -> market.setPlatformFee(fixture.admin, 1001)).getErrorType());
        assertEquals(ErrorType.UNAUTHORIZED, assertThrows(AccessDeniedException.class,
                () -> market.setPlatformFee(seller, 0)).getErrorType());
        market.setPlatformFee(fixture.admin, 1000);
        assertEquals(1000, market.platformFeeBps());
        MarketNotifications.PlatformFeeUpdated updated =
                fixture.notificationsOf(MarketNotifications.PlatformFeeUpdated.class).get(0);
        assertEquals(250, updated.getOldFeeBps());
        assertEquals(1000, updated.getNewFeeBps());
    }

    @Test
    void testFeesAccumulateAndWithdraw() {
        setUp(new LedgerFixture());
        Listing listing = market.createListing(seller, ITEM, 10, 333);
        long expectedFees = 0;
        for (int amount = 1; amount <= 4; amount++) {
            PriceQuote quote = market.quote(listing.getId(), amount);
            assertEquals(quote.getTotalPrice() * 250 / 10_000, quote.getFee());
            market.buyItem(buyer, listing.getId(), amount, quote.getTotalPrice());
            expectedFees += quote.getFee();
        }
        assertEquals(expectedFees, market.accumulatedFees());

        AccountId operator = AccountId.systemAccount("operator");
        assertThrows(AccessDeniedException.class, () -> market.withdrawFees(seller, operator));
        assertEquals(expectedFees, market.withdrawFees(fixture.admin, operator));
        assertEquals(expectedFees, fixture.balances.balanceOf(operator));
        assertEquals(0, market.accumulatedFees());
        assertEquals(0, fixture.balances.balanceOf(market.treasuryAccount()));
        assertThrows(ValidationException.class, () -> market.withdrawFees(fixture.admin, operator));
    }

    @Test
    void testSystemAccountsCannotTrade() {
        setUp(new LedgerFixture());
        AccountId escrow = market.escrowAccount();
        AccountId treasury = market.treasuryAccount();
        Listing real = market.createListing(seller, ITEM, 5, PRICE);

        // 托管账户不能自己挂单，否则会卖出其他卖家托管的物品
        assertEquals(ErrorType.INVALID_ACCOUNT, assertThrows(ValidationException.class,
                () -> market.createListing(escrow, ITEM, 5, 1)).getErrorType());
        assertEquals(ErrorType.INVALID_ACCOUNT, assertThrows(ValidationException.class,
                () -> market.createListing(treasury, ITEM, 1, 1)).getErrorType());
        assertEquals(ErrorType.INVALID_ACCOUNT, assertThrows(ValidationException.class,
                () -> market.buyItem(escrow, real.getId(), 1, PRICE)).getErrorType());
        assertEquals(ErrorType.INVALID_ACCOUNT, assertThrows(ValidationException.class,
                () -> market.buyItem(treasury, real.getId(), 1, PRICE)).getErrorType());
        assertEquals(ErrorType.INVALID_ACCOUNT, assertThrows(ValidationException.class,
                () -> market.cancelListing(escrow, real.getId())).getErrorType());

        assertEquals(1, market.listingsByItem(ITEM).size());
        assertEquals(5, units(escrow));
        assertEquals(ListingStatus.CANCELLED, market.cancelListing(seller, real.getId()).getStatus());
        assertEquals(10, units(seller));
        assertEquals(0, units(escrow));
    }

    @Test
    void testWithdrawFeesRejectsSystemRecipient() {
        setUp(new LedgerFixture());
        Listing listing = market.createListing(seller, ITEM, 1, 10_000);
        market.buyItem(buyer, listing.getId(), 1, 10_000);
        assertEquals(250, market.accumulatedFees());

        assertEquals(ErrorType.INVALID_ACCOUNT, assertThrows(ValidationException.class,
                () -> market.withdrawFees(fixture.admin, market.treasuryAccount())).getErrorType());
        assertEquals(ErrorType.INVALID_ACCOUNT, assertThrows(ValidationException.class,
                () -> market.withdrawFees(fixture.admin, market.escrowAccount())).getErrorType());
        assertEquals(ErrorType.INVALID_ACCOUNT, assertThrows(ValidationException.class,
                () -> market.withdrawFees(fixture.admin, null)).getErrorType());
        assertEquals(250, market.accumulatedFees());
        assertTrue(fixture.notificationsOf(MarketNotifications.FeesWithdrawn.class).isEmpty());

        AccountId operator = AccountId.systemAccount("operator");
        assertEquals(250, market.withdrawFees(fixture.admin, operator));
        assertEquals(250, fixture.balances.balanceOf(operator));
        assertEquals(0, fixture.balances.balanceOf(market.treasuryAccount()));
    }

    @Test
    void testFeeOfMatchesFloor() {
        assertEquals(0, MarketplaceImpl.feeOf(39, 250));
        assertEquals(1, MarketplaceImpl.feeOf(40, 250));
        assertEquals(100, MarketplaceImpl.feeOf(2_000, 500));
        assertEquals(Long.MAX_VALUE / 10, MarketplaceImpl.feeOf(Long.MAX_VALUE, 1000));
    }

    /**
     * 给卖家打款时失败，其余转账照常
     */
    private static class FailingPayoutLedger implements BalanceLedger {
        private final BalanceLedger delegate;
        private final AccountId payee;
        private boolean armed;

        FailingPayoutLedger(BalanceLedger delegate, AccountId payee) {
            this.delegate = delegate;
            this.payee = payee;
        }

        @Override
        public long balanceOf(AccountId account) {
            return delegate.balanceOf(account);
        }

        @Override
        public long totalSupply() {
            return delegate.totalSupply();
        }

        @Override
        public long deposit(AccountId caller, AccountId to, long amount) {
            return delegate.deposit(caller, to, amount);
        }

        @Override
        public void transfer(AccountId from, AccountId to, long amount) {
            if (armed && to.equals(payee)) {
                throw new SettlementException(ErrorType.TRANSFER_FAILED, "模拟打款失败");
            }
            delegate.transfer(from, to, amount);
        }
    }
}
