package com.bit.arena.structure.auth;

import com.bit.arena.common.AccountId;
import com.bit.arena.structure.profile.ProfileStats;
import com.bit.arena.util.ByteUtils;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 后端签发的统计覆盖写
 */
@Getter
@AllArgsConstructor
public class StatsUpdatePayload implements AuthorizationPayload {
    public static final String TYPE = "StatsUpdate(address account,uint256 xp,uint256 level,uint256 progressCount,"
            + "uint256 achievementCount,uint256 nonce,uint256 deadline)";

    private final AccountId account;
    private final ProfileStats stats;

    @Override
    public String typeSignature() {
        return TYPE;
    }

    @Override
    public AccountId subject() {
        return account;
    }

    @Override
    public NonceScope scope() {
        return NonceScope.STATS_UPDATE;
    }

    @Override
    public List<byte[]> encodeFields() {
        return List.of(
                ByteUtils.leftPad32(account.toBytes()),
                ByteUtils.uint256(stats.getXp()),
                ByteUtils.uint256(stats.getLevel()),
                ByteUtils.uint256(stats.getProgressCount()),
                ByteUtils.uint256(stats.getAchievementCount()));
    }
}
