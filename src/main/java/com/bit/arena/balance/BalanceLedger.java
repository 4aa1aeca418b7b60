package com.bit.arena.balance;

import com.bit.arena.common.AccountId;

/**
 * 原生价值账本（lamport 单位），市场购买的付款与手续费都在这里结算
 */
public interface BalanceLedger {

    long balanceOf(AccountId account);

    long totalSupply();

    /**
     * 管理员入金（充值/跨链桥的替身）
     * @return 入金后的余额
     */
    long deposit(AccountId caller, AccountId to, long amount);

    /**
     * 内部转账，余额不足或溢出时抛出 TRANSFER_FAILED，不做任何修改
     */
    void transfer(AccountId from, AccountId to, long amount);
}
