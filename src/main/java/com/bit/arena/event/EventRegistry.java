package com.bit.arena.event;

import com.bit.arena.common.AccountId;
import com.bit.arena.structure.event.GameEvent;
import com.bit.arena.structure.event.RewardConfig;

/**
 * 限时活动登记，所有写操作只允许 EVENT_MANAGER
 */
public interface EventRegistry {

    /**
     * @param reward 可为 null，表示暂不配置奖励
     */
    GameEvent createEvent(AccountId caller, long id, String name, long startTime, long endTime,
                          long maxParticipants, RewardConfig reward);

    /**
     * 覆盖名称、时间窗、人数上限和启用标记，不修改奖励
     */
    GameEvent updateEvent(AccountId caller, long id, String name, long startTime, long endTime,
                          long maxParticipants, boolean active);

    void setEventReward(AccountId caller, long id, RewardConfig reward);

    /**
     * 启用 且 在时间窗内 且 未满员；未知活动视为未激活
     */
    boolean isEventActive(long id);

    /**
     * @return 增加后的参与人数
     */
    long incrementParticipants(AccountId caller, long id);

    GameEvent getEvent(long id);

    RewardConfig getEventReward(long id);

    long eventCount();
}
