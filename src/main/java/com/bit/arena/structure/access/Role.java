package com.bit.arena.structure.access;

/**
 * 角色：管理员管理所有角色（包括自己）
 */
public enum Role {
    ADMIN,
    BACKEND_SIGNER,  // 受信任的链下签名者，为统计更新/成就领取出具签名
    EVENT_MANAGER;   // 活动创建、更新与参与计数

    /**
     * 授予/撤销该角色所需的管理角色
     */
    public Role adminRole() {
        return ADMIN;
    }
}
