package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class StatsUpdateRequest {
    private String account;
    private long xp;
    private long level;
    private long progressCount;
    private long achievementCount;
    private long deadline;
    private String signature;
}
