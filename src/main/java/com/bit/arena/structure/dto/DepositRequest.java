package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class DepositRequest {
    private String to;
    private long amount;
}
