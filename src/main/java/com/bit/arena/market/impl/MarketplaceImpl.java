package com.bit.arena.market.impl;

import com.bit.arena.access.AccessControlService;
import com.bit.arena.balance.BalanceLedger;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.LedgerSequencer;
import com.bit.arena.common.SystemAccounts;
import com.bit.arena.config.LedgerProperties;
import com.bit.arena.cosmetic.CosmeticCatalog;
import com.bit.arena.exception.AccessDeniedException;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.LedgerException;
import com.bit.arena.exception.SettlementException;
import com.bit.arena.exception.StateException;
import com.bit.arena.exception.ValidationException;
import com.bit.arena.market.Marketplace;
import com.bit.arena.structure.access.Role;
import com.bit.arena.structure.market.Listing;
import com.bit.arena.structure.market.ListingStatus;
import com.bit.arena.structure.market.PriceQuote;
import com.bit.arena.structure.notification.MarketNotifications;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

@Slf4j
@Component
public class MarketplaceImpl implements Marketplace {

    public static final int BPS_DENOMINATOR = 10_000;

    public static final AccountId ESCROW = SystemAccounts.ESCROW;

    public static final AccountId TREASURY = SystemAccounts.TREASURY;

    private final Map<Long, Listing> listings = new HashMap<>();

    private final Map<Long, List<Long>> listingsByItem = new HashMap<>();

    private final Map<AccountId, List<Long>> listingsBySeller = new HashMap<>();

    // 挂单ID从1开始单调递增
    private long nextListingId = 1;

    private int feeBps;

    private final int maxFeeBps;

    private long accumulatedFees;

    private final AccessControlService accessControl;
    private final CosmeticCatalog catalog;
    private final BalanceLedger balances;
    private final LedgerSequencer sequencer;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    @Autowired
    public MarketplaceImpl(AccessControlService accessControl, CosmeticCatalog catalog, BalanceLedger balances,
                           LedgerSequencer sequencer, ApplicationEventPublisher publisher, Clock clock,
                           LedgerProperties properties) {
        this(accessControl, catalog, balances, sequencer, publisher, clock,
                properties.getMarketplace().getDefaultFeeBps(), properties.getMarketplace().getMaxFeeBps());
    }

    public MarketplaceImpl(AccessControlService accessControl, CosmeticCatalog catalog, BalanceLedger balances,
                           LedgerSequencer sequencer, ApplicationEventPublisher publisher, Clock clock,
                           int defaultFeeBps, int maxFeeBps) {
        if (maxFeeBps < 0 || maxFeeBps > BPS_DENOMINATOR) {
            throw new IllegalArgumentException("费率上限超出范围：" + maxFeeBps);
        }
        if (defaultFeeBps < 0 || defaultFeeBps > maxFeeBps) {
            throw new IllegalArgumentException("默认费率 " + defaultFeeBps + " 超出上限 " + maxFeeBps);
        }
        this.accessControl = accessControl;
        this.catalog = catalog;
        this.balances = balances;
        this.sequencer = sequencer;
        this.publisher = publisher;
        this.clock = clock;
        this.feeBps = defaultFeeBps;
        this.maxFeeBps = maxFeeBps;
        log.info("市场初始化：平台费率 {} bps，上限 {} bps，托管账户 {}，金库 {}", feeBps, maxFeeBps, ESCROW, TREASURY);
    }

    @Override
    public Listing createListing(AccountId caller, long itemId, long amount, long pricePerUnit) {
        return sequencer.write(() -> {
            SystemAccounts.requireUserAccount(caller, "卖家");
            if (amount <= 0) {
                throw new ValidationException(ErrorType.INVALID_AMOUNT, "挂单数量必须大于0");
            }
            if (pricePerUnit <= 0) {
                throw new ValidationException(ErrorType.INVALID_PRICE, "单价必须大于0");
            }
            // 余额不足由目录抛出 INSUFFICIENT_BALANCE，物品不存在抛出 NOT_FOUND
            catalog.moveUnits(caller, ESCROW, itemId, amount);

            long now = now();
            Listing listing = new Listing();
            listing.setId(nextListingId++);
            listing.setSeller(caller);
            listing.setItemId(itemId);
            listing.setAmount(amount);
            listing.setPricePerUnit(pricePerUnit);
            listing.setStatus(ListingStatus.ACTIVE);
            listing.setCreatedAt(now);
            listings.put(listing.getId(), listing);
            listingsByItem.computeIfAbsent(itemId, k -> new ArrayList<>()).add(listing.getId());
            listingsBySeller.computeIfAbsent(caller, k -> new ArrayList<>()).add(listing.getId());

            log.info("创建挂单 {}：{} 出售物品 {} x{}，单价 {}", listing.getId(), caller, itemId, amount, pricePerUnit);
            publisher.publishEvent(new MarketNotifications.ListingCreated(listing.getId(), caller, itemId, amount,
                    pricePerUnit, now));
            return listing.copy();
        });
    }

    @Override
    public Listing cancelListing(AccountId caller, long listingId) {
        return sequencer.write(() -> {
            SystemAccounts.requireUserAccount(caller, "卖家");
            Listing listing = require(listingId);
            if (!listing.getSeller().equals(caller)) {
                throw new AccessDeniedException(ErrorType.NOT_SELLER, caller + " 不是挂单 " + listingId + " 的卖家");
            }
            if (!listing.isActive()) {
                throw new StateException(ErrorType.LISTING_NOT_ACTIVE, "挂单 " + listingId + " 状态 " + listing.getStatus());
            }
            long returned = listing.getAmount();
            catalog.moveUnits(ESCROW, caller, listing.getItemId(), returned);
            listing.setStatus(ListingStatus.CANCELLED);
            log.info("取消挂单 {}，退回 {} 件", listingId, returned);
            publisher.publishEvent(new MarketNotifications.ListingCancelled(listingId, caller, returned, now()));
            return listing.copy();
        });
    }

    @Override
    public Listing buyItem(AccountId caller, long listingId, long amount, long payment) {
        return sequencer.write(() -> {
            SystemAccounts.requireUserAccount(caller, "买家");
            Listing listing = require(listingId);
            PriceQuote quote = price(listing, amount);
            if (payment < quote.getTotalPrice()) {
                throw new SettlementException(ErrorType.INSUFFICIENT_PAYMENT,
                        "支付 " + payment + "，总价 " + quote.getTotalPrice());
            }
            settle(caller, listing, quote, payment);

            long remaining = listing.getAmount() - amount;
            long now = now();
            listing.setAmount(remaining);
            if (remaining == 0) {
                listing.setStatus(ListingStatus.SOLD);
                listing.setSoldAt(now);
            }
            accumulatedFees += quote.getFee();
            log.info("成交：挂单 {} 买家 {} 数量 {} 总价 {} 手续费 {}，剩余 {}",
                    listingId, caller, amount, quote.getTotalPrice(), quote.getFee(), remaining);
            publisher.publishEvent(new MarketNotifications.ItemSold(listingId, caller, listing.getSeller(),
                    listing.getItemId(), amount, quote.getTotalPrice(), quote.getFee(), remaining, now));
            return listing.copy();
        });
    }

    /**
     * 结算顺序：买家付款进金库 -> 物品出托管 -> 付卖家 -> 退多付部分
     * 任何一步失败，按撤销日志逆序补偿后抛出 TRANSFER_FAILED
     */
    private void settle(AccountId buyer, Listing listing, PriceQuote quote, long payment) {
        SettlementJournal journal = new SettlementJournal(listing.getId());
        long refund = payment - quote.getTotalPrice();
        try {
            balances.transfer(buyer, TREASURY, payment);
            journal.record("退回买家付款", () -> balances.transfer(TREASURY, buyer, payment));

            catalog.moveUnits(ESCROW, buyer, listing.getItemId(), quote.getAmount());
            journal.record("物品退回托管", () -> catalog.moveUnits(buyer, ESCROW, listing.getItemId(), quote.getAmount()));

            balances.transfer(TREASURY, listing.getSeller(), quote.getSellerProceeds());
            journal.record("收回卖家所得",
                    () -> balances.transfer(listing.getSeller(), TREASURY, quote.getSellerProceeds()));

            balances.transfer(TREASURY, buyer, refund);
            journal.record("收回退款", () -> balances.transfer(buyer, TREASURY, refund));
        } catch (LedgerException e) {
            log.warn("挂单 {} 结算失败，回滚 {} 步：{}", listing.getId(), journal.size(), e.getMessage());
            journal.rollback();
            if (e.getErrorType() == ErrorType.TRANSFER_FAILED) {
                throw e;
            }
            throw new SettlementException(ErrorType.TRANSFER_FAILED, e.getMessage(), e);
        }
    }

    @Override
    public void setPlatformFee(AccountId caller, int newFeeBps) {
        sequencer.execute(() -> {
            accessControl.checkRole(Role.ADMIN, caller);
            if (newFeeBps < 0 || newFeeBps > maxFeeBps) {
                throw new ValidationException(ErrorType.INVALID_FEE, newFeeBps + " bps，上限 " + maxFeeBps);
            }
            int old = feeBps;
            feeBps = newFeeBps;
            log.info("平台费率 {} -> {} bps", old, newFeeBps);
            publisher.publishEvent(new MarketNotifications.PlatformFeeUpdated(old, newFeeBps, now()));
        });
    }

    @Override
    public long withdrawFees(AccountId caller, AccountId to) {
        return sequencer.write(() -> {
            accessControl.checkRole(Role.ADMIN, caller);
            // 收款方不能是金库自身
            SystemAccounts.requireUserAccount(to, "收款方");
            long amount = accumulatedFees;
            if (amount == 0) {
                throw new ValidationException(ErrorType.INVALID_AMOUNT, "没有可提取的手续费");
            }
            balances.transfer(TREASURY, to, amount);
            accumulatedFees = 0;
            log.info("提取手续费 {} -> {}", amount, to);
            publisher.publishEvent(new MarketNotifications.FeesWithdrawn(to, amount, now()));
            return amount;
        });
    }

    @Override
    public Listing getListing(long listingId) {
        return sequencer.read(() -> {
            Listing listing = listings.get(listingId);
            return listing == null ? null : listing.copy();
        });
    }

    @Override
    public List<Listing> listingsByItem(long itemId) {
        return sequencer.read(() -> collect(listingsByItem.get(itemId), l -> true));
    }

    @Override
    public List<Listing> listingsBySeller(AccountId seller) {
        return sequencer.read(() -> collect(listingsBySeller.get(seller), l -> true));
    }

    @Override
    public List<Listing> activeListingsByItem(long itemId) {
        return sequencer.read(() -> collect(listingsByItem.get(itemId), Listing::isActive));
    }

    @Override
    public int platformFeeBps() {
        return sequencer.read(() -> feeBps);
    }

    @Override
    public int maxPlatformFeeBps() {
        return maxFeeBps;
    }

    @Override
    public long accumulatedFees() {
        return sequencer.read(() -> accumulatedFees);
    }

    @Override
    public PriceQuote quote(long listingId, long amount) {
        return sequencer.read(() -> price(require(listingId), amount));
    }

    @Override
    public AccountId escrowAccount() {
        return ESCROW;
    }

    @Override
    public AccountId treasuryAccount() {
        return TREASURY;
    }

    private PriceQuote price(Listing listing, long amount) {
        if (!listing.isActive()) {
            throw new StateException(ErrorType.LISTING_NOT_ACTIVE, "挂单 " + listing.getId() + " 状态 " + listing.getStatus());
        }
        if (amount <= 0 || amount > listing.getAmount()) {
            throw new ValidationException(ErrorType.INVALID_AMOUNT,
                    "购买数量 " + amount + "，剩余 " + listing.getAmount());
        }
        long totalPrice;
        try {
            totalPrice = Math.multiplyExact(listing.getPricePerUnit(), amount);
        } catch (ArithmeticException e) {
            throw new ValidationException(ErrorType.AMOUNT_OVERFLOW,
                    "单价 " + listing.getPricePerUnit() + " x 数量 " + amount);
        }
        long fee = feeOf(totalPrice, feeBps);
        return new PriceQuote(listing.getId(), amount, totalPrice, feeBps, fee, totalPrice - fee);
    }

    /**
     * floor(total * bps / 10000)，拆开计算避免乘法溢出
     */
    static long feeOf(long totalPrice, int bps) {
        return (totalPrice / BPS_DENOMINATOR) * bps + (totalPrice % BPS_DENOMINATOR) * bps / BPS_DENOMINATOR;
    }

    private Listing require(long listingId) {
        Listing listing = listings.get(listingId);
        if (listing == null) {
            throw new StateException(ErrorType.NOT_FOUND, "挂单 " + listingId);
        }
        return listing;
    }

    private List<Listing> collect(List<Long> ids, Predicate<Listing> filter) {
        if (ids == null) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<Listing> builder = ImmutableList.builder();
        for (Long id : ids) {
            Listing listing = listings.get(id);
            if (filter.test(listing)) {
                builder.add(listing.copy());
            }
        }
        return builder.build();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
