package com.bit.arena.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.bit.arena.util.ByteUtils;
import com.bit.arena.util.Sha;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 账户地址封装（20字节），所有账本的主键
 * 由 secp256k1 非压缩公钥（去掉0x04前缀）做 Keccak-256 后取末20字节得到
 */
public final class AccountId implements Serializable, Comparable<AccountId> {
    public static final int LENGTH = 20;

    // 全零地址，仅用于占位，不能持有任何状态
    public static final AccountId ZERO = new AccountId(new byte[LENGTH]);

    private final byte[] value;
    // 缓存十六进制字符串（避免重复计算）
    private final String hexValue;

    private AccountId(byte[] value) {
        if (value == null) {
            throw new NullPointerException("地址不能为空");
        }
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为20字节，当前长度：" + value.length);
        }
        this.value = Arrays.copyOf(value, LENGTH); // 防御性拷贝
        this.hexValue = "0x" + ByteUtils.bytesToHex(this.value);
    }

    public static AccountId fromBytes(byte[] bytes) {
        return new AccountId(bytes);
    }

    @JsonCreator
    public static AccountId fromHex(String hex) {
        return new AccountId(ByteUtils.hexToBytes(hex));
    }

    /**
     * 由64字节裸公钥（x||y）派生地址
     */
    public static AccountId fromPublicKey(byte[] rawPublicKey) {
        if (rawPublicKey.length != 64) {
            throw new IllegalArgumentException("裸公钥必须为64字节（x||y），当前长度：" + rawPublicKey.length);
        }
        byte[] hash = Sha.applyKeccak256(rawPublicKey);
        return new AccountId(Arrays.copyOfRange(hash, hash.length - LENGTH, hash.length));
    }

    /**
     * 由标签派生的系统账户（托管、金库），没有对应私钥
     */
    public static AccountId systemAccount(String label) {
        byte[] hash = Sha.applyKeccak256(label);
        return new AccountId(Arrays.copyOfRange(hash, hash.length - LENGTH, hash.length));
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    @JsonValue
    public String toHex() {
        return hexValue;
    }

    @Override
    public int compareTo(AccountId other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccountId)) {
            return false;
        }
        return Arrays.equals(value, ((AccountId) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return hexValue;
    }
}
