package com.bit.arena.util;

import java.math.BigInteger;

public class ByteUtils {

    /**
     * ABI 编码的字长：所有字段统一占 32 字节
     */
    public static final int WORD_LENGTH = 32;

    /**
     * 无符号 long 左补零成 32 字节大端（uint256）
     */
    public static byte[] uint256(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("uint256 不能为负数: " + value);
        }
        byte[] word = new byte[WORD_LENGTH];
        for (int i = 0; i < 8; i++) {
            word[WORD_LENGTH - 1 - i] = (byte) (value >>> (8 * i)); // 大端（高位在前）
        }
        return word;
    }

    /**
     * 任意长度不超过32字节的数据左补零（address 20字节 -> 32字节）
     */
    public static byte[] leftPad32(byte[] value) {
        if (value.length > WORD_LENGTH) {
            throw new IllegalArgumentException("数据超过32字节: " + value.length);
        }
        byte[] word = new byte[WORD_LENGTH];
        System.arraycopy(value, 0, word, WORD_LENGTH - value.length, value.length);
        return word;
    }

    /**
     * BigInteger 转 32 字节大端无符号（签名 r/s）
     */
    public static byte[] bigIntegerToBytes32(BigInteger value) {
        byte[] raw = value.toByteArray();
        if (raw.length == WORD_LENGTH) {
            return raw;
        }
        if (raw.length == WORD_LENGTH + 1 && raw[0] == 0) {
            byte[] trimmed = new byte[WORD_LENGTH];
            System.arraycopy(raw, 1, trimmed, 0, WORD_LENGTH);
            return trimmed;
        }
        return leftPad32(raw);
    }

    /**
     * 字节数组转十六进制字符串
     */
    public static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    /**
     * 十六进制字符串转字节数组（允许 0x 前缀）
     */
    public static byte[] hexToBytes(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("十六进制字符串不能为空");
        }
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        int len = hex.length();
        if (len % 2 != 0) {
            throw new IllegalArgumentException("十六进制字符串长度必须为偶数: " + len);
        }
        byte[] data = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int high = Character.digit(hex.charAt(i), 16);
            int low = Character.digit(hex.charAt(i + 1), 16);
            if (high == -1 || low == -1) {
                throw new IllegalArgumentException("非法的十六进制字符: " + hex);
            }
            data[i / 2] = (byte) ((high << 4) + low);
        }
        return data;
    }
}
