package com.bit.arena.structure.market;

import lombok.Value;

/**
 * 购买报价拆分：总价 = 手续费 + 卖家所得
 */
@Value
public class PriceQuote {
    long listingId;
    long amount;
    long totalPrice;
    int feeBps;
    long fee;
    long sellerProceeds;
}
