package com.bit.arena.structure.dto;

import com.bit.arena.structure.event.RewardConfig;
import lombok.Data;

@Data
public class CreateEventRequest {
    private long id;
    private String name;
    private long startTime;
    private long endTime;
    private long maxParticipants;
    // 可选
    private RewardConfig reward;
}
