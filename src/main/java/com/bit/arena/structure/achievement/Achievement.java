package com.bit.arena.structure.achievement;

import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 成就记录：(账户, 活动ID) 唯一，写入后不可变
 */
@Getter
@ToString
@AllArgsConstructor
public class Achievement {

    private final AccountId account;

    private final long eventId;

    /**
     * 成就等级 1..5
     */
    private final int tier;

    /**
     * 解锁时间（epoch秒）
     */
    private final long unlockedAt;

    private final Hash32 metadataHash;
}
