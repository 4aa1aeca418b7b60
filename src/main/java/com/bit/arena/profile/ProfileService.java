package com.bit.arena.profile;

import com.bit.arena.common.AccountId;
import com.bit.arena.structure.profile.Profile;
import com.bit.arena.structure.profile.ProfileStats;
import com.bit.arena.structure.profile.Tier;

public interface ProfileService {

    /**
     * 账户自行注册，创建全零档案
     */
    Profile register(AccountId caller);

    /**
     * 中继注册：账户本人对 Register 消息签名，任何人都可以代为提交
     */
    Profile registerFor(AccountId account, long deadline, byte[] signature);

    /**
     * 后端签名的统计更新，整体覆盖 xp/level/progressCount/achievementCount
     * 段位严格上升时发出 TierUpgraded 通知
     */
    Profile updateStats(AccountId account, ProfileStats stats, long deadline, byte[] signature);

    /**
     * @return 未注册时返回 null
     */
    Profile getProfile(AccountId account);

    boolean isRegistered(AccountId account);

    /**
     * 未注册账户返回 null
     */
    Tier getTier(AccountId account);

    long registeredCount();
}
