package com.bit.arena.structure.dto;

import lombok.Data;

/**
 * category/rarity 使用编码值，未知编码会被拒绝
 */
@Data
public class CreateItemRequest {
    private long id;
    private String name;
    private int category;
    private int rarity;
    private String imageHash;
    private long maxSupply;
    private int minTier;
}
