package com.bit.arena.util;

import com.bit.arena.common.AccountId;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * secp256k1 可恢复签名（r||s||v，65字节）
 * 摘要由调用方构造好（32字节），这里不再做二次哈希
 */
@Slf4j
public class Secp256k1Signer {

    // ------------------------------ 常量定义 ------------------------------
    public static final int PRIVATE_KEY_CORE_LENGTH = 32;
    public static final int DIGEST_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 65;
    // v 的以太坊偏移（27/28），同时兼容 0/1
    private static final int RECOVERY_ID_OFFSET = 27;

    // ------------------------------ 基础密钥操作 ------------------------------
    /**
     * 生成 secp256k1 密钥（SecureRandom）
     */
    public static ECKey generateKey() {
        return new ECKey();
    }

    /**
     * 从32字节核心私钥恢复密钥
     */
    public static ECKey fromPrivateKey(byte[] corePrivateKey) {
        if (corePrivateKey == null || corePrivateKey.length != PRIVATE_KEY_CORE_LENGTH) {
            throw new IllegalArgumentException("私钥必须为32字节");
        }
        BigInteger privKeyInt = new BigInteger(1, corePrivateKey);
        BigInteger curveOrder = ECKey.CURVE.getN();
        if (privKeyInt.compareTo(BigInteger.ONE) < 0 || privKeyInt.compareTo(curveOrder) >= 0) {
            throw new IllegalArgumentException("核心私钥超出secp256k1有效范围");
        }
        return ECKey.fromPrivate(privKeyInt, false);
    }

    /**
     * 由密钥派生账户地址
     */
    public static AccountId addressOf(ECKey key) {
        byte[] uncompressed = key.getPubKeyPoint().getEncoded(false); // 0x04 || x || y
        return AccountId.fromPublicKey(Arrays.copyOfRange(uncompressed, 1, uncompressed.length));
    }

    // ------------------------------ 签名 / 恢复 ------------------------------
    /**
     * 对32字节摘要签名，返回 r(32) || s(32) || v(1)，s 已规范化为低位
     */
    public static byte[] signDigest(ECKey key, byte[] digest) {
        if (digest == null || digest.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException("摘要必须为32字节");
        }
        Sha256Hash hash = Sha256Hash.wrap(digest);
        ECKey.ECDSASignature sig = key.sign(hash);
        byte[] expectedPub = key.getPubKeyPoint().getEncoded(false);

        int recId = -1;
        for (int i = 0; i < 4; i++) {
            ECKey candidate = ECKey.recoverFromSignature(i, sig, hash, false);
            if (candidate != null && Arrays.equals(candidate.getPubKeyPoint().getEncoded(false), expectedPub)) {
                recId = i;
                break;
            }
        }
        if (recId == -1) {
            throw new IllegalStateException("无法计算签名的恢复ID");
        }

        byte[] signature = new byte[SIGNATURE_LENGTH];
        System.arraycopy(ByteUtils.bigIntegerToBytes32(sig.r), 0, signature, 0, 32);
        System.arraycopy(ByteUtils.bigIntegerToBytes32(sig.s), 0, signature, 32, 32);
        signature[64] = (byte) (recId + RECOVERY_ID_OFFSET);
        return signature;
    }

    /**
     * 从签名恢复签名者地址
     * @return 恢复出的地址；签名格式非法、高位s或无法恢复时返回null
     */
    public static AccountId recoverAddress(byte[] digest, byte[] signature) {
        if (digest == null || digest.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException("摘要必须为32字节");
        }
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            log.debug("签名长度非法：{}", signature == null ? null : signature.length);
            return null;
        }
        int v = signature[64] & 0xFF;
        int recId = v >= RECOVERY_ID_OFFSET ? v - RECOVERY_ID_OFFSET : v;
        if (recId != 0 && recId != 1) {
            log.debug("签名v值非法：{}", v);
            return null;
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        BigInteger n = ECKey.CURVE.getN();
        if (r.signum() == 0 || s.signum() == 0 || r.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            log.debug("签名r/s超出曲线阶范围");
            return null;
        }
        ECKey.ECDSASignature sig = new ECKey.ECDSASignature(r, s);
        // 拒绝高位s，防止签名延展性（同一消息两种签名）
        if (!sig.isCanonical()) {
            log.debug("签名s值未规范化（高位s）");
            return null;
        }
        try {
            ECKey recovered = ECKey.recoverFromSignature(recId, sig, Sha256Hash.wrap(digest), false);
            if (recovered == null) {
                return null;
            }
            return addressOf(recovered);
        } catch (IllegalArgumentException e) {
            log.debug("secp256k1 公钥恢复失败", e);
            return null;
        }
    }
}
