package com.bit.arena.event.impl;

import com.bit.arena.access.AccessControlService;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.LedgerSequencer;
import com.bit.arena.event.EventRegistry;
import com.bit.arena.exception.CapacityException;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.StateException;
import com.bit.arena.exception.ValidationException;
import com.bit.arena.structure.access.Role;
import com.bit.arena.structure.event.GameEvent;
import com.bit.arena.structure.event.RewardConfig;
import com.bit.arena.structure.notification.EventNotifications;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
public class EventRegistryImpl implements EventRegistry {

    private final Map<Long, GameEvent> events = new HashMap<>();

    /**
     * 奖励侧表，与活动热配置分开
     */
    private final Map<Long, RewardConfig> rewards = new HashMap<>();

    private final AccessControlService accessControl;
    private final LedgerSequencer sequencer;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public EventRegistryImpl(AccessControlService accessControl, LedgerSequencer sequencer,
                             ApplicationEventPublisher publisher, Clock clock) {
        this.accessControl = accessControl;
        this.sequencer = sequencer;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public GameEvent createEvent(AccountId caller, long id, String name, long startTime, long endTime,
                                 long maxParticipants, RewardConfig reward) {
        return sequencer.write(() -> {
            checkManager(caller);
            if (events.containsKey(id)) {
                throw new StateException(ErrorType.ALREADY_EXISTS, "活动 " + id);
            }
            checkWindow(startTime, endTime);
            checkCapacity(maxParticipants);
            if (reward != null) {
                checkReward(reward);
            }
            GameEvent event = new GameEvent();
            event.setId(id);
            event.setName(name);
            event.setStartTime(startTime);
            event.setEndTime(endTime);
            event.setMaxParticipants(maxParticipants);
            event.setActive(true);
            events.put(id, event);
            if (reward != null) {
                rewards.put(id, reward.copy());
            }
            log.info("创建活动 {}「{}」[{}, {}] 上限 {}", id, name, startTime, endTime, maxParticipants);
            publisher.publishEvent(new EventNotifications.Created(id, name, startTime, endTime, maxParticipants,
                    reward != null && reward.isHasReward(), now()));
            return event.copy();
        });
    }

    @Override
    public GameEvent updateEvent(AccountId caller, long id, String name, long startTime, long endTime,
                                 long maxParticipants, boolean active) {
        return sequencer.write(() -> {
            checkManager(caller);
            GameEvent event = require(id);
            checkWindow(startTime, endTime);
            checkCapacity(maxParticipants);
            if (maxParticipants != 0 && maxParticipants < event.getCurrentParticipants()) {
                throw new ValidationException(ErrorType.INVALID_CAPACITY,
                        "上限 " + maxParticipants + " 低于当前人数 " + event.getCurrentParticipants());
            }
            event.setName(name);
            event.setStartTime(startTime);
            event.setEndTime(endTime);
            event.setMaxParticipants(maxParticipants);
            event.setActive(active);
            log.info("更新活动 {}「{}」[{}, {}] 上限 {} 启用 {}", id, name, startTime, endTime, maxParticipants, active);
            publisher.publishEvent(new EventNotifications.Updated(id, name, startTime, endTime, maxParticipants,
                    active, now()));
            return event.copy();
        });
    }

    @Override
    public void setEventReward(AccountId caller, long id, RewardConfig reward) {
        sequencer.execute(() -> {
            checkManager(caller);
            require(id);
            if (reward == null) {
                throw new ValidationException(ErrorType.INVALID_REWARD_TIER, "奖励配置为空");
            }
            checkReward(reward);
            rewards.put(id, reward.copy());
            log.info("设置活动 {} 奖励：{}", id, reward);
            publisher.publishEvent(new EventNotifications.RewardSet(id, reward.copy(), now()));
        });
    }

    @Override
    public boolean isEventActive(long id) {
        return sequencer.read(() -> {
            GameEvent event = events.get(id);
            if (event == null || !event.isActive()) {
                return false;
            }
            long now = now();
            return event.getStartTime() <= now && now <= event.getEndTime() && !event.isFull();
        });
    }

    @Override
    public long incrementParticipants(AccountId caller, long id) {
        return sequencer.write(() -> {
            checkManager(caller);
            GameEvent event = require(id);
            if (event.isFull()) {
                log.warn("活动 {} 已满员：{}/{}", id, event.getCurrentParticipants(), event.getMaxParticipants());
                throw new CapacityException(ErrorType.EVENT_FULL, "活动 " + id);
            }
            long current = event.getCurrentParticipants() + 1;
            event.setCurrentParticipants(current);
            log.debug("活动 {} 参与人数 {}", id, current);
            publisher.publishEvent(new EventNotifications.ParticipantAdded(id, current, now()));
            return current;
        });
    }

    @Override
    public GameEvent getEvent(long id) {
        return sequencer.read(() -> {
            GameEvent event = events.get(id);
            return event == null ? null : event.copy();
        });
    }

    @Override
    public RewardConfig getEventReward(long id) {
        return sequencer.read(() -> {
            RewardConfig reward = rewards.get(id);
            return reward == null ? null : reward.copy();
        });
    }

    @Override
    public long eventCount() {
        return sequencer.read(() -> (long) events.size());
    }

    private void checkManager(AccountId caller) {
        accessControl.checkRole(Role.EVENT_MANAGER, caller, ErrorType.NOT_EVENT_MANAGER);
    }

    private GameEvent require(long id) {
        GameEvent event = events.get(id);
        if (event == null) {
            throw new StateException(ErrorType.NOT_FOUND, "活动 " + id);
        }
        return event;
    }

    private static void checkWindow(long startTime, long endTime) {
        if (startTime >= endTime) {
            throw new ValidationException(ErrorType.INVALID_TIME_WINDOW, "start=" + startTime + " end=" + endTime);
        }
    }

    private static void checkCapacity(long maxParticipants) {
        if (maxParticipants < 0) {
            throw new ValidationException(ErrorType.INVALID_CAPACITY, "上限不能为负：" + maxParticipants);
        }
    }

    private static void checkReward(RewardConfig reward) {
        if (reward.getAchievementTier() < 0 || reward.getAchievementTier() > RewardConfig.MAX_ACHIEVEMENT_TIER) {
            throw new ValidationException(ErrorType.INVALID_REWARD_TIER, "tier=" + reward.getAchievementTier());
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
