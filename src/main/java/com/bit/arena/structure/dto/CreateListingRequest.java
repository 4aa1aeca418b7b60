package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class CreateListingRequest {
    private long itemId;
    private long amount;
    private long pricePerUnit;
}
