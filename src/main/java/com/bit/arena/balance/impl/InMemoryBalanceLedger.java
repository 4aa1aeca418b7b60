package com.bit.arena.balance.impl;

import com.bit.arena.access.AccessControlService;
import com.bit.arena.balance.BalanceLedger;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.LedgerSequencer;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.SettlementException;
import com.bit.arena.exception.ValidationException;
import com.bit.arena.structure.access.Role;
import com.bit.arena.structure.notification.BalanceNotifications;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
public class InMemoryBalanceLedger implements BalanceLedger {

    /**
     * 账户 -> 余额，余额为 0 的账户不保留
     */
    private final Map<AccountId, Long> balances = new HashMap<>();

    private long totalSupply;

    private final AccessControlService accessControl;
    private final LedgerSequencer sequencer;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public InMemoryBalanceLedger(AccessControlService accessControl, LedgerSequencer sequencer,
                                 ApplicationEventPublisher publisher, Clock clock) {
        this.accessControl = accessControl;
        this.sequencer = sequencer;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public long balanceOf(AccountId account) {
        return sequencer.read(() -> balances.getOrDefault(account, 0L));
    }

    @Override
    public long totalSupply() {
        return sequencer.read(() -> totalSupply);
    }

    @Override
    public long deposit(AccountId caller, AccountId to, long amount) {
        return sequencer.write(() -> {
            accessControl.checkRole(Role.ADMIN, caller);
            if (amount <= 0) {
                throw new ValidationException(ErrorType.INVALID_AMOUNT, "入金数量必须大于0");
            }
            long balance;
            long supply;
            try {
                balance = Math.addExact(balances.getOrDefault(to, 0L), amount);
                supply = Math.addExact(totalSupply, amount);
            } catch (ArithmeticException e) {
                throw new ValidationException(ErrorType.AMOUNT_OVERFLOW, "入金后余额溢出");
            }
            balances.put(to, balance);
            totalSupply = supply;
            log.info("入金 {} lamports -> {}，余额 {}", amount, to, balance);
            publisher.publishEvent(new BalanceNotifications.Deposited(to, amount, balance,
                    clock.instant().getEpochSecond()));
            return balance;
        });
    }

    @Override
    public void transfer(AccountId from, AccountId to, long amount) {
        sequencer.execute(() -> {
            if (amount < 0) {
                throw new SettlementException(ErrorType.TRANSFER_FAILED, "转账数量为负");
            }
            if (amount == 0 || from.equals(to)) {
                return;
            }
            long fromBalance = balances.getOrDefault(from, 0L);
            if (fromBalance < amount) {
                log.debug("转账失败：{} 余额 {} 不足 {}", from, fromBalance, amount);
                throw new SettlementException(ErrorType.TRANSFER_FAILED,
                        from + " 余额不足，需要 " + amount + "，实际 " + fromBalance);
            }
            long toBalance;
            try {
                toBalance = Math.addExact(balances.getOrDefault(to, 0L), amount);
            } catch (ArithmeticException e) {
                throw new SettlementException(ErrorType.TRANSFER_FAILED, to + " 余额溢出", e);
            }
            put(from, fromBalance - amount);
            put(to, toBalance);
            log.debug("转账 {} -> {}：{} lamports", from, to, amount);
        });
    }

    private void put(AccountId account, long balance) {
        if (balance == 0) {
            balances.remove(account);
        } else {
            balances.put(account, balance);
        }
    }
}
