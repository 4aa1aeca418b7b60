package com.bit.arena.access.impl;

import com.bit.arena.access.AccessControlService;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.LedgerSequencer;
import com.bit.arena.config.LedgerProperties;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.LedgerException;
import com.bit.arena.structure.access.Role;
import com.bit.arena.structure.notification.AccessNotifications;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
public class AccessControlServiceImpl implements AccessControlService {

    private final Map<Role, Set<AccountId>> members = new EnumMap<>(Role.class);

    private final LedgerSequencer sequencer;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    @Autowired
    public AccessControlServiceImpl(LedgerSequencer sequencer, ApplicationEventPublisher publisher,
                                    Clock clock, LedgerProperties properties) {
        this(sequencer, publisher, clock, bootstrapAdmin(properties));
    }

    public AccessControlServiceImpl(LedgerSequencer sequencer, ApplicationEventPublisher publisher,
                                    Clock clock, AccountId bootstrapAdmin) {
        this.sequencer = sequencer;
        this.publisher = publisher;
        this.clock = clock;
        for (Role role : Role.values()) {
            members.put(role, new HashSet<>());
        }
        if (bootstrapAdmin != null) {
            members.get(Role.ADMIN).add(bootstrapAdmin);
            log.info("初始管理员：{}", bootstrapAdmin);
        } else {
            log.warn("未配置 ledger.bootstrap.admin，当前没有任何账户可以授予角色");
        }
    }

    private static AccountId bootstrapAdmin(LedgerProperties properties) {
        String admin = properties.getBootstrap().getAdmin();
        return admin == null || admin.isBlank() ? null : AccountId.fromHex(admin);
    }

    @Override
    public void grantRole(AccountId caller, Role role, AccountId account) {
        sequencer.execute(() -> {
            checkRole(role.adminRole(), caller);
            if (members.get(role).add(account)) {
                log.info("授予角色 {} -> {}，操作者 {}", role, account, caller);
                publisher.publishEvent(new AccessNotifications.RoleGranted(role, account, caller, now()));
            }
        });
    }

    @Override
    public void revokeRole(AccountId caller, Role role, AccountId account) {
        sequencer.execute(() -> {
            checkRole(role.adminRole(), caller);
            revoke(role, account, caller);
        });
    }

    @Override
    public void renounceRole(AccountId caller, Role role) {
        sequencer.execute(() -> revoke(role, caller, caller));
    }

    private void revoke(Role role, AccountId account, AccountId sender) {
        if (members.get(role).remove(account)) {
            log.info("撤销角色 {} <- {}，操作者 {}", role, account, sender);
            publisher.publishEvent(new AccessNotifications.RoleRevoked(role, account, sender, now()));
        }
    }

    @Override
    public boolean hasRole(Role role, AccountId account) {
        return sequencer.read(() -> account != null && members.get(role).contains(account));
    }

    @Override
    public void checkRole(Role role, AccountId account) {
        checkRole(role, account, ErrorType.UNAUTHORIZED);
    }

    @Override
    public void checkRole(Role role, AccountId account, ErrorType errorType) {
        if (!hasRole(role, account)) {
            log.debug("权限检查失败：{} 未持有 {}", account, role);
            throw LedgerException.of(errorType, account + " 缺少角色 " + role);
        }
    }

    @Override
    public Set<Role> rolesOf(AccountId account) {
        return sequencer.read(() -> {
            Set<Role> roles = EnumSet.noneOf(Role.class);
            for (Map.Entry<Role, Set<AccountId>> entry : members.entrySet()) {
                if (entry.getValue().contains(account)) {
                    roles.add(entry.getKey());
                }
            }
            return roles;
        });
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
