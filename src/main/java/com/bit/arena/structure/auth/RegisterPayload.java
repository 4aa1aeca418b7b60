package com.bit.arena.structure.auth;

import com.bit.arena.common.AccountId;
import com.bit.arena.util.ByteUtils;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 自助注册（可由任意中继提交，签名者必须是账户本人）
 */
@Getter
@AllArgsConstructor
public class RegisterPayload implements AuthorizationPayload {
    public static final String TYPE = "Register(address account,uint256 nonce,uint256 deadline)";

    private final AccountId account;

    @Override
    public String typeSignature() {
        return TYPE;
    }

    @Override
    public AccountId subject() {
        return account;
    }

    @Override
    public NonceScope scope() {
        return NonceScope.REGISTER;
    }

    @Override
    public List<byte[]> encodeFields() {
        return List.of(ByteUtils.leftPad32(account.toBytes()));
    }
}
