package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class FeeRequest {
    private int feeBps;
}
