package com.bit.arena.market;

import com.bit.arena.common.AccountId;
import com.bit.arena.structure.market.Listing;
import com.bit.arena.structure.market.PriceQuote;

import java.util.List;

/**
 * 点对点市场：挂单期间物品由托管账户持有，成交时按平台费率抽成
 */
public interface Marketplace {

    Listing createListing(AccountId caller, long itemId, long amount, long pricePerUnit);

    Listing cancelListing(AccountId caller, long listingId);

    /**
     * @param payment 买家支付的金额，超出总价的部分原路退回
     */
    Listing buyItem(AccountId caller, long listingId, long amount, long payment);

    void setPlatformFee(AccountId caller, int feeBps);

    /**
     * @return 提取的手续费总额
     */
    long withdrawFees(AccountId caller, AccountId to);

    Listing getListing(long listingId);

    List<Listing> listingsByItem(long itemId);

    List<Listing> listingsBySeller(AccountId seller);

    List<Listing> activeListingsByItem(long itemId);

    int platformFeeBps();

    int maxPlatformFeeBps();

    long accumulatedFees();

    /**
     * 不产生副作用的价格拆分
     */
    PriceQuote quote(long listingId, long amount);

    AccountId escrowAccount();

    AccountId treasuryAccount();
}
