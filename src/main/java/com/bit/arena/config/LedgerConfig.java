package com.bit.arena.config;

import com.bit.arena.auth.TypedDataEncoder;
import com.bit.arena.common.AccountId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.SimpleApplicationEventMulticaster;
import org.springframework.context.support.AbstractApplicationContext;

import java.time.Clock;

@Slf4j
@Configuration
public class LedgerConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TypedDataEncoder typedDataEncoder(LedgerProperties properties) {
        LedgerProperties.Domain domain = properties.getDomain();
        TypedDataEncoder encoder = new TypedDataEncoder(domain.getName(), domain.getVersion(),
                domain.getChainId(), AccountId.fromHex(domain.getVerifyingEndpoint()));
        log.info("签名域初始化完成 name={} version={} chainId={} 域分隔符={}",
                domain.getName(), domain.getVersion(), domain.getChainId(), encoder.getDomainSeparator());
        return encoder;
    }

    /**
     * 通知在写锁内、状态变更之后同步投递
     * 监听器（索引/镜像服务）抛出的异常只记录日志，不会让已提交的操作对调用者表现为失败
     */
    @Bean(name = AbstractApplicationContext.APPLICATION_EVENT_MULTICASTER_BEAN_NAME)
    public SimpleApplicationEventMulticaster applicationEventMulticaster() {
        SimpleApplicationEventMulticaster multicaster = new SimpleApplicationEventMulticaster();
        multicaster.setErrorHandler(t -> log.error("通知监听器处理失败，账本状态已提交", t));
        return multicaster;
    }
}
