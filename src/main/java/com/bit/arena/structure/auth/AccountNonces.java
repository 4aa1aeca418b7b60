package com.bit.arena.structure.auth;

/**
 * 单个账户在各命名空间下的 nonce 计数器
 * 只增不减，每个被接受的签名恰好 +1
 */
public class AccountNonces {

    private final long[] counters = new long[NonceScope.values().length];

    public long current(NonceScope scope) {
        return counters[scope.ordinal()];
    }

    /**
     * 消费当前 nonce
     * @return 消费后的新值
     */
    public long consume(NonceScope scope) {
        return ++counters[scope.ordinal()];
    }
}
