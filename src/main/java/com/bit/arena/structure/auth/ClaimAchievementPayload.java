package com.bit.arena.structure.auth;

import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.util.ByteUtils;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 后端签发的成就领取授权
 * tier 按 uint8 编码，超出 0..255 的值在验签之前就会被拒绝
 */
@Getter
@AllArgsConstructor
public class ClaimAchievementPayload implements AuthorizationPayload {
    public static final String TYPE = "ClaimAchievement(address to,uint256 eventId,uint8 tier,bytes32 metadataHash,"
            + "uint256 nonce,uint256 deadline)";

    private final AccountId to;
    private final long eventId;
    private final int tier;
    private final Hash32 metadataHash;

    @Override
    public String typeSignature() {
        return TYPE;
    }

    @Override
    public AccountId subject() {
        return to;
    }

    @Override
    public NonceScope scope() {
        return NonceScope.CLAIM;
    }

    @Override
    public List<byte[]> encodeFields() {
        return List.of(
                ByteUtils.leftPad32(to.toBytes()),
                ByteUtils.uint256(eventId),
                ByteUtils.uint256(tier),
                metadataHash.toBytes());
    }
}
