package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class EquipRequest {
    private String category;
    private long itemId;
}
