package com.bit.arena.structure.market;

/**
 * 挂单状态机：ACTIVE -> SOLD | CANCELLED，后两者为终态
 */
public enum ListingStatus {
    ACTIVE,
    SOLD,
    CANCELLED
}
