package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class UpdateEventRequest {
    private long id;
    private String name;
    private long startTime;
    private long endTime;
    private long maxParticipants;
    private boolean active;
}
