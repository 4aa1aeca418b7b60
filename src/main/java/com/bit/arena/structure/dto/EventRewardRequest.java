package com.bit.arena.structure.dto;

import com.bit.arena.structure.event.RewardConfig;
import lombok.Data;

@Data
public class EventRewardRequest {
    private long id;
    private RewardConfig reward;
}
