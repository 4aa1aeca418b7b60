package com.bit.arena.structure.profile;

/**
 * 段位：等级的纯阶梯函数，阈值升序且单调不减
 */
public enum Tier {
    BRONZE(1, 0),
    SILVER(2, 3),
    GOLD(3, 5),
    PLATINUM(4, 7),
    DIAMOND(5, 9);

    private final int rank;
    // 达到该段位所需的最低等级
    private final long minLevel;

    Tier(int rank, long minLevel) {
        this.rank = rank;
        this.minLevel = minLevel;
    }

    public int getRank() {
        return rank;
    }

    public long getMinLevel() {
        return minLevel;
    }

    public static Tier forLevel(long level) {
        Tier[] tiers = values();
        for (int i = tiers.length - 1; i > 0; i--) {
            if (level >= tiers[i].minLevel) {
                return tiers[i];
            }
        }
        return BRONZE;
    }
}
