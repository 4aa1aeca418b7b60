package com.bit.arena.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 账本配置（application.yml 中 ledger 前缀）
 */
@Data
@Component
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Domain domain = new Domain();

    private Bootstrap bootstrap = new Bootstrap();

    private Marketplace marketplace = new Marketplace();

    /**
     * 签名者恢复缓存最大条数
     */
    private long signatureCacheSize = 100_000;

    /**
     * 签名域：协议名、版本、网络标识、验证端点，决定域分隔符
     */
    @Data
    public static class Domain {
        private String name = "ArenaLedger";
        private String version = "1";
        private long chainId = 1;
        // 验证端点地址（20字节hex）
        private String verifyingEndpoint = "0x0000000000000000000000000000000000000000";
    }

    @Data
    public static class Bootstrap {
        // 启动时持有 ADMIN 的账户
        private String admin;
    }

    @Data
    public static class Marketplace {
        // 默认平台费率（基点）
        private int defaultFeeBps = 250;
        // 费率上限（基点），10000 = 100%
        private int maxFeeBps = 1000;
    }
}
