package com.bit.arena.structure.cosmetic;

import com.bit.arena.common.Hash32;
import lombok.Data;

/**
 * 装扮物品定义，持有量按 (账户, 物品) 记为可替代数量
 */
@Data
public class CosmeticItem {

    private long id;

    private String name;

    private CosmeticCategory category;

    private Rarity rarity;

    private Hash32 imageHash;

    /**
     * 最大供应量，0 表示不限
     */
    private long maxSupply;

    private long currentSupply;

    /**
     * 建议的最低段位（仅元数据，本目录不校验）
     */
    private int minTier;

    public boolean canMint(long amount) {
        return maxSupply == 0 || currentSupply + amount <= maxSupply;
    }

    public CosmeticItem copy() {
        CosmeticItem copy = new CosmeticItem();
        copy.setId(id);
        copy.setName(name);
        copy.setCategory(category);
        copy.setRarity(rarity);
        copy.setImageHash(imageHash);
        copy.setMaxSupply(maxSupply);
        copy.setCurrentSupply(currentSupply);
        copy.setMinTier(minTier);
        return copy;
    }
}
