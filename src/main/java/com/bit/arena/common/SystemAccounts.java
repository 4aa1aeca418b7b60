package com.bit.arena.common;

import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.ValidationException;

/**
 * 市场使用的系统账户，地址由固定标签派生，任何人都能算出
 * 它们只能被账本内部划转使用，不能作为调用者或转账对手方
 */
public final class SystemAccounts {

    /**
     * 托管账户：持有所有 ACTIVE 挂单的剩余物品
     */
    public static final AccountId ESCROW = AccountId.systemAccount("arena.market.escrow");

    /**
     * 金库账户：收款、付款、留存手续费
     */
    public static final AccountId TREASURY = AccountId.systemAccount("arena.market.treasury");

    private SystemAccounts() {
    }

    public static boolean isReserved(AccountId account) {
        return ESCROW.equals(account) || TREASURY.equals(account);
    }

    /**
     * 账户为空或为系统账户时抛出 INVALID_ACCOUNT
     * @param role 出错时写进消息里的角色名（卖家、买家、收款方...）
     */
    public static AccountId requireUserAccount(AccountId account, String role) {
        if (account == null) {
            throw new ValidationException(ErrorType.INVALID_ACCOUNT, role + "为空");
        }
        if (isReserved(account)) {
            throw new ValidationException(ErrorType.INVALID_ACCOUNT, role + " " + account + " 是系统账户");
        }
        return account;
    }
}
