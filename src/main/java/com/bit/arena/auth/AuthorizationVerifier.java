package com.bit.arena.auth;

import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.structure.auth.AuthorizationPayload;
import com.bit.arena.structure.auth.NonceScope;

/**
 * 所有签名操作共用的验证流程：
 * 截止时间 -> 摘要（含当前nonce）-> 恢复签名者 -> 身份/角色校验 -> nonce +1
 * nonce 在任何业务规则检查之前消费，业务拒绝也不会让签名再次可用
 */
public interface AuthorizationVerifier {

    /**
     * 后端授权：恢复出的签名者必须持有 BACKEND_SIGNER
     * @return 签名者地址
     */
    AccountId verifyBackendAuthorization(AuthorizationPayload payload, long deadline, byte[] signature);

    /**
     * 自助授权：恢复出的签名者必须就是载荷的主体账户
     */
    AccountId verifySelfAuthorization(AuthorizationPayload payload, long deadline, byte[] signature);

    long nonceOf(AccountId account, NonceScope scope);

    Hash32 domainSeparator();

    /**
     * 按账户当前 nonce 计算待签名摘要（签名端预览用）
     */
    Hash32 digest(AuthorizationPayload payload, long deadline);
}
