package com.bit.arena.structure.dto;

import lombok.Data;

/**
 * 中继注册：账户本人对 Register 消息的签名
 */
@Data
public class RegisterForRequest {
    private String account;
    private long deadline;
    private String signature;
}
