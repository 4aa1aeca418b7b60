package com.bit.arena.structure.cosmetic;

public enum Rarity {
    COMMON(0),
    UNCOMMON(1),
    RARE(2),
    EPIC(3),
    LEGENDARY(4),
    MYTHIC(5);

    private final int code;

    Rarity(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static Rarity fromCode(int code) {
        for (Rarity rarity : values()) {
            if (rarity.code == code) {
                return rarity;
            }
        }
        return null;
    }
}
