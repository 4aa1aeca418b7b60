package com.bit.arena.structure.cosmetic;

/**
 * 装扮类别，同时也是装备槽位：每个账户每个类别最多装备一件
 */
public enum CosmeticCategory {
    HEAD(0),
    BODY(1),
    ACCESSORY(2),
    EFFECT(3);

    private final int code;

    CosmeticCategory(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * @return 对应类别；未知编码返回 null
     */
    public static CosmeticCategory fromCode(int code) {
        for (CosmeticCategory category : values()) {
            if (category.code == code) {
                return category;
            }
        }
        return null;
    }
}
