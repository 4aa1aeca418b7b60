package com.bit.arena.common;

import com.bit.arena.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 32字节哈希（元数据哈希、图片哈希、成就键），不可变
 */
public final class Hash32 implements Serializable {
    public static final int HASH_LENGTH = 32;

    public static final Hash32 ZERO = new Hash32(new byte[HASH_LENGTH]);

    // 存储32字节哈希数据（私有且不可变）
    private final byte[] value;
    // 缓存十六进制字符串（避免重复计算）
    private final String hexValue;

    private Hash32(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be " + HASH_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH); // 防御性拷贝
        this.hexValue = "0x" + ByteUtils.bytesToHex(this.value);
    }

    public static Hash32 fromBytes(byte[] bytes) {
        return new Hash32(bytes);
    }

    /**
     * 从十六进制字符串解析（大小写均可，允许0x前缀）
     */
    @JsonCreator
    public static Hash32 fromHex(String hex) {
        return new Hash32(ByteUtils.hexToBytes(hex));
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] toBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    @JsonValue
    public String toHex() {
        return hexValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hash32)) {
            return false;
        }
        return Arrays.equals(value, ((Hash32) o).value);
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
