package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class TransferItemRequest {
    private String to;
    private long itemId;
    private long amount;
}
