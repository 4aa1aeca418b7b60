package com.bit.arena.structure.event;

import lombok.Data;

/**
 * 限时活动（热配置）
 * currentParticipants 在 maxParticipants 非零时永不超过上限
 */
@Data
public class GameEvent {

    private long id;

    private String name;

    /**
     * 开始/结束时间（epoch秒），startTime < endTime
     */
    private long startTime;

    private long endTime;

    /**
     * 人数上限，0 表示不限
     */
    private long maxParticipants;

    private long currentParticipants;

    private boolean active;

    public boolean isUnbounded() {
        return maxParticipants == 0;
    }

    public boolean isFull() {
        return !isUnbounded() && currentParticipants >= maxParticipants;
    }

    public GameEvent copy() {
        GameEvent copy = new GameEvent();
        copy.setId(id);
        copy.setName(name);
        copy.setStartTime(startTime);
        copy.setEndTime(endTime);
        copy.setMaxParticipants(maxParticipants);
        copy.setCurrentParticipants(currentParticipants);
        copy.setActive(active);
        return copy;
    }
}
