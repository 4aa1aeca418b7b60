package com.bit.arena.api;

import com.bit.arena.common.AccountId;
import com.bit.arena.event.EventRegistry;
import com.bit.arena.result.Result;
import com.bit.arena.structure.dto.CreateEventRequest;
import com.bit.arena.structure.dto.EventRewardRequest;
import com.bit.arena.structure.dto.UpdateEventRequest;
import com.bit.arena.structure.event.GameEvent;
import com.bit.arena.structure.event.RewardConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/event")
public class EventApi {

    @Autowired
    private EventRegistry eventRegistry;

    @PostMapping("/create")
    public Result<GameEvent> createEvent(@RequestHeader("X-Caller") String caller,
                                         @RequestBody CreateEventRequest request) {
        return Result.OK(eventRegistry.createEvent(AccountId.fromHex(caller), request.getId(), request.getName(),
                request.getStartTime(), request.getEndTime(), request.getMaxParticipants(), request.getReward()));
    }

    @PostMapping("/update")
    public Result<GameEvent> updateEvent(@RequestHeader("X-Caller") String caller,
                                         @RequestBody UpdateEventRequest request) {
        return Result.OK(eventRegistry.updateEvent(AccountId.fromHex(caller), request.getId(), request.getName(),
                request.getStartTime(), request.getEndTime(), request.getMaxParticipants(), request.isActive()));
    }

    @PostMapping("/reward")
    public Result<Void> setEventReward(@RequestHeader("X-Caller") String caller,
                                       @RequestBody EventRewardRequest request) {
        eventRegistry.setEventReward(AccountId.fromHex(caller), request.getId(), request.getReward());
        return Result.OK();
    }

    @PostMapping("/participant")
    public Result<Long> incrementParticipants(@RequestHeader("X-Caller") String caller, @RequestParam long id) {
        return Result.OK(eventRegistry.incrementParticipants(AccountId.fromHex(caller), id));
    }

    @GetMapping("/active")
    public Result<Boolean> isEventActive(@RequestParam long id) {
        return Result.OK(eventRegistry.isEventActive(id));
    }

    @GetMapping("/detail")
    public Result<GameEvent> getEvent(@RequestParam long id) {
        return Result.OK(eventRegistry.getEvent(id));
    }

    @GetMapping("/reward")
    public Result<RewardConfig> getEventReward(@RequestParam long id) {
        return Result.OK(eventRegistry.getEventReward(id));
    }

    @GetMapping("/count")
    public Result<Long> eventCount() {
        return Result.OK(eventRegistry.eventCount());
    }
}
