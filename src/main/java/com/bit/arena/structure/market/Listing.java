package com.bit.arena.structure.market;

import com.bit.arena.common.AccountId;
import lombok.Data;

/**
 * 市场挂单，ACTIVE 状态下剩余 amount 件物品由市场托管
 */
@Data
public class Listing {

    private long id;

    private AccountId seller;

    private long itemId;

    /**
     * 剩余未售数量
     */
    private long amount;

    private long pricePerUnit;

    private ListingStatus status;

    private long createdAt;

    /**
     * 售罄时间，未售罄为 0
     */
    private long soldAt;

    public boolean isActive() {
        return status == ListingStatus.ACTIVE;
    }

    public Listing copy() {
        Listing copy = new Listing();
        copy.setId(id);
        copy.setSeller(seller);
        copy.setItemId(itemId);
        copy.setAmount(amount);
        copy.setPricePerUnit(pricePerUnit);
        copy.setStatus(status);
        copy.setCreatedAt(createdAt);
        copy.setSoldAt(soldAt);
        return copy;
    }
}
