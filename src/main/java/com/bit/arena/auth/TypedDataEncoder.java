package com.bit.arena.auth;

import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.structure.auth.AuthorizationPayload;
import com.bit.arena.util.ByteUtils;
import com.bit.arena.util.Sha;

import java.io.ByteArrayOutputStream;

/**
 * 结构化签名摘要构造（EIP-712 布局）
 * 摘要 = keccak256(0x19 || 0x01 || 域分隔符 || structHash)
 * 域分隔符绑定 {协议名, 版本, 网络标识, 验证端点}，不同部署之间的签名不能互用
 */
public class TypedDataEncoder {

    public static final String DOMAIN_TYPE =
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";

    private static final byte[] DIGEST_PREFIX = new byte[]{0x19, 0x01};

    private final byte[] domainSeparator;

    public TypedDataEncoder(String name, String version, long chainId, AccountId verifyingEndpoint) {
        this.domainSeparator = Sha.applyKeccak256(
                Sha.applyKeccak256(DOMAIN_TYPE),
                Sha.applyKeccak256(name),
                Sha.applyKeccak256(version),
                ByteUtils.uint256(chainId),
                ByteUtils.leftPad32(verifyingEndpoint.toBytes()));
    }

    public Hash32 getDomainSeparator() {
        return Hash32.fromBytes(domainSeparator);
    }

    /**
     * structHash = keccak256(typeHash || 字段... || nonce || deadline)
     * typeHash 由类型签名算出，所以一种消息的载荷永远不会与另一种消息的摘要碰撞
     */
    public byte[] structHash(AuthorizationPayload payload, long nonce, long deadline) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(Sha.applyKeccak256(payload.typeSignature()));
        for (byte[] field : payload.encodeFields()) {
            if (field.length != ByteUtils.WORD_LENGTH) {
                throw new IllegalArgumentException("字段必须按32字节编码，当前长度：" + field.length);
            }
            out.writeBytes(field);
        }
        out.writeBytes(ByteUtils.uint256(nonce));
        out.writeBytes(ByteUtils.uint256(deadline));
        return Sha.applyKeccak256(out.toByteArray());
    }

    /**
     * 最终待签名摘要（32字节）
     */
    public byte[] digest(AuthorizationPayload payload, long nonce, long deadline) {
        return Sha.applyKeccak256(DIGEST_PREFIX, domainSeparator, structHash(payload, nonce, deadline));
    }
}
