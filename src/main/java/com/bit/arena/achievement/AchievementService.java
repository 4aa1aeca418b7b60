package com.bit.arena.achievement;

import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.structure.achievement.Achievement;

import java.util.List;

public interface AchievementService {

    /**
     * 后端签名的成就领取，(to, eventId) 只能成功一次
     */
    Achievement claim(AccountId to, long eventId, int tier, Hash32 metadataHash, long deadline, byte[] signature);

    boolean hasAchievement(AccountId account, long eventId);

    /**
     * @return 不存在时返回 null
     */
    Achievement getAchievement(AccountId account, long eventId);

    /**
     * 按领取顺序返回
     */
    List<Achievement> listForAccount(AccountId account);

    long countForAccount(AccountId account);

    /**
     * 记录主键 keccak256(to || uint256(eventId))
     */
    Hash32 achievementKey(AccountId to, long eventId);
}
