package com.bit.arena.access;

import com.bit.arena.common.AccountId;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.structure.access.Role;

import java.util.Set;

/**
 * 角色表 (角色 × 账户 -> 是否持有)，所有组件的权限检查都经过这里
 */
public interface AccessControlService {

    /**
     * 授予角色，调用者必须持有该角色的管理角色
     */
    void grantRole(AccountId caller, Role role, AccountId account);

    void revokeRole(AccountId caller, Role role, AccountId account);

    /**
     * 放弃自己持有的角色
     */
    void renounceRole(AccountId caller, Role role);

    boolean hasRole(Role role, AccountId account);

    /**
     * 未持有角色时抛出 UNAUTHORIZED
     */
    void checkRole(Role role, AccountId account);

    /**
     * 未持有角色时抛出指定的权限错误（如 NOT_EVENT_MANAGER）
     */
    void checkRole(Role role, AccountId account, ErrorType errorType);

    Set<Role> rolesOf(AccountId account);
}
