package com.bit.arena.structure.profile;

import com.bit.arena.common.AccountId;
import lombok.Data;

/**
 * 玩家档案：注册后永久存在，只能被后端签名的统计更新整体覆盖
 */
@Data
public class Profile {

    private AccountId account;

    private long xp;

    private long level;

    private long progressCount;

    private long achievementCount;

    /**
     * 最后一次写入时间（epoch秒）
     */
    private long lastUpdated;

    private boolean exists;

    public static Profile registered(AccountId account, long now) {
        Profile profile = new Profile();
        profile.setAccount(account);
        profile.setLastUpdated(now);
        profile.setExists(true);
        return profile;
    }

    public Tier getTier() {
        return Tier.forLevel(level);
    }

    public void apply(ProfileStats stats, long now) {
        this.xp = stats.getXp();
        this.level = stats.getLevel();
        this.progressCount = stats.getProgressCount();
        this.achievementCount = stats.getAchievementCount();
        this.lastUpdated = now;
    }

    /**
     * 只读副本，避免调用方改动账本内部状态
     */
    public Profile copy() {
        Profile copy = new Profile();
        copy.setAccount(account);
        copy.setXp(xp);
        copy.setLevel(level);
        copy.setProgressCount(progressCount);
        copy.setAchievementCount(achievementCount);
        copy.setLastUpdated(lastUpdated);
        copy.setExists(exists);
        return copy;
    }
}
