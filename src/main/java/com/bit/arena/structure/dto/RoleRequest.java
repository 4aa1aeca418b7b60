package com.bit.arena.structure.dto;

import lombok.Data;

/**
 * 授予/撤销角色
 */
@Data
public class RoleRequest {
    private String account;
    private String role;
}
