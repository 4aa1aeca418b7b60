package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class ClaimRequest {
    private String to;
    private long eventId;
    private int tier;
    private String metadataHash;
    private long deadline;
    private String signature;
}
