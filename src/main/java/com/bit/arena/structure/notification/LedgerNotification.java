package com.bit.arena.structure.notification;

/**
 * 状态变更通知：每次状态迁移发布一条，字段足够索引服务在不回读全量状态的情况下重建变更
 * 通过 Spring ApplicationEventPublisher 发布
 */
public interface LedgerNotification {

    /**
     * 发生时间（epoch秒）
     */
    long getOccurredAt();
}
