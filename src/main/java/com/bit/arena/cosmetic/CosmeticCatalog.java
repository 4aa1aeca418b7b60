package com.bit.arena.cosmetic;

import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.structure.cosmetic.CosmeticCategory;
import com.bit.arena.structure.cosmetic.CosmeticItem;

import java.util.Map;

/**
 * 装扮目录：物品定义、可替代持有量、每个分类一个装备槽
 */
public interface CosmeticCatalog {

    CosmeticItem createItem(AccountId caller, long id, String name, int categoryCode, int rarityCode,
                            Hash32 imageHash, long maxSupply, int minTier);

    /**
     * @return 铸造后的当前供应量
     */
    long mintItem(AccountId caller, AccountId to, long itemId, long amount);

    void equipItem(AccountId caller, CosmeticCategory category, long itemId);

    void unequipItem(AccountId caller, CosmeticCategory category);

    /**
     * 持有人主动转移
     */
    void transfer(AccountId caller, AccountId to, long itemId, long amount);

    /**
     * 托管原语，供市场在卖家、托管账户、买家之间搬移物品，不对外暴露
     */
    void moveUnits(AccountId from, AccountId to, long itemId, long amount);

    CosmeticItem getItem(long itemId);

    long balanceOf(AccountId account, long itemId);

    /**
     * @return 该槽位未装备时返回 null
     */
    Long getEquipped(AccountId account, CosmeticCategory category);

    Map<CosmeticCategory, Long> getLoadout(AccountId account);

    /**
     * 装备指针不是预留，物品转走后指针仍保留，这里判断它是否仍指向持有中的物品
     */
    boolean isEquipValid(AccountId account, CosmeticCategory category);

    long itemCount();
}
