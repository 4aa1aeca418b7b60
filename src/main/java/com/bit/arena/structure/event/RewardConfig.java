package com.bit.arena.structure.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 活动奖励配置，与活动主配置分表存放
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RewardConfig {
    public static final int MAX_ACHIEVEMENT_TIER = 5;

    /**
     * 奖励成就等级 0..5，0 表示不发成就
     */
    private int achievementTier;

    private List<Long> cosmeticItemIds = new ArrayList<>();

    private long xpBonus;

    private boolean hasReward;

    public RewardConfig copy() {
        return new RewardConfig(achievementTier,
                cosmeticItemIds == null ? new ArrayList<>() : new ArrayList<>(cosmeticItemIds),
                xpBonus, hasReward);
    }
}
