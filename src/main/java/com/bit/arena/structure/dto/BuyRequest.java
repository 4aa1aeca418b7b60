package com.bit.arena.structure.dto;

import lombok.Data;

@Data
public class BuyRequest {
    private long listingId;
    private long amount;
    // 支付金额，多付部分退回
    private long payment;
}
