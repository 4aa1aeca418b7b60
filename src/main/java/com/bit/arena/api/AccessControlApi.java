package com.bit.arena.api;

import com.bit.arena.access.AccessControlService;
import com.bit.arena.common.AccountId;
import com.bit.arena.result.Result;
import com.bit.arena.structure.access.Role;
import com.bit.arena.structure.dto.RoleRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/access")
public class AccessControlApi {

    @Autowired
    private AccessControlService accessControlService;

    // 授予角色（ADMIN）
    @PostMapping("/grant")
    public Result<Void> grantRole(@RequestHeader("X-Caller") String caller, @RequestBody RoleRequest request) {
        accessControlService.grantRole(AccountId.fromHex(caller), Role.valueOf(request.getRole()),
                AccountId.fromHex(request.getAccount()));
        return Result.OK();
    }

    // 撤销角色（ADMIN）
    @PostMapping("/revoke")
    public Result<Void> revokeRole(@RequestHeader("X-Caller") String caller, @RequestBody RoleRequest request) {
        accessControlService.revokeRole(AccountId.fromHex(caller), Role.valueOf(request.getRole()),
                AccountId.fromHex(request.getAccount()));
        return Result.OK();
    }

    @PostMapping("/renounce")
    public Result<Void> renounceRole(@RequestHeader("X-Caller") String caller, @RequestParam String role) {
        accessControlService.renounceRole(AccountId.fromHex(caller), Role.valueOf(role));
        return Result.OK();
    }

    @GetMapping("/hasRole")
    public Result<Boolean> hasRole(@RequestParam String role, @RequestParam String account) {
        return Result.OK(accessControlService.hasRole(Role.valueOf(role), AccountId.fromHex(account)));
    }

    @GetMapping("/roles")
    public Result<Set<Role>> rolesOf(@RequestParam String account) {
        return Result.OK(accessControlService.rolesOf(AccountId.fromHex(account)));
    }
}
