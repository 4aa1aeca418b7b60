package com.bit.arena.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.nio.charset.StandardCharsets;
import java.security.Security;

@Slf4j
public class Sha {
    // ThreadLocal存储每个线程独立的Keccak-256实例（签名摘要、地址派生都用它）
    private static final ThreadLocal<Keccak.Digest256> KECCAK256_THREAD_LOCAL = ThreadLocal.withInitial(Keccak.Digest256::new);

    // 静态代码块：确保BouncyCastle先注册
    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    /**
     * 线程安全的Keccak-256计算（以太坊风格，非NIST SHA3）
     */
    public static byte[] applyKeccak256(byte[] data) {
        // 允许空数组（哈希计算空数组是合法的）
        data = data == null ? new byte[0] : data;
        Keccak.Digest256 digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * 多段拼接后计算Keccak-256，避免调用方先拼数组
     */
    public static byte[] applyKeccak256(byte[]... parts) {
        Keccak.Digest256 digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        for (byte[] part : parts) {
            if (part != null) {
                digest.update(part);
            }
        }
        return digest.digest();
    }

    public static byte[] applyKeccak256(String text) {
        return applyKeccak256(text.getBytes(StandardCharsets.UTF_8));
    }
}
