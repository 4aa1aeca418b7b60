package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class MintRequest {
    private String to;
    private long itemId;
    private long amount;
}
