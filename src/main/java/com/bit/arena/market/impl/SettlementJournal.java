package com.bit.arena.market.impl;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 结算撤销日志：每完成一步记录一条补偿动作，失败时逆序执行
 */
@Slf4j
class SettlementJournal {

    private final long listingId;

    private final Deque<Step> steps = new ArrayDeque<>();

    SettlementJournal(long listingId) {
        this.listingId = listingId;
    }

    void record(String description, Runnable undo) {
        steps.push(new Step(description, undo));
    }

    int size() {
        return steps.size();
    }

    /**
     * 逆序执行补偿动作
     * 补偿的是已经成功的转移，再失败说明账本状态已经不一致，直接抛出
     */
    void rollback() {
        while (!steps.isEmpty()) {
            Step step = steps.pop();
            try {
                step.undo.run();
                log.debug("挂单 {} 回滚：{}", listingId, step.description);
            } catch (RuntimeException e) {
                log.error("挂单 {} 回滚失败：{}，剩余 {} 步未回滚", listingId, step.description, steps.size(), e);
                throw new IllegalStateException("结算回滚失败：" + step.description, e);
            }
        }
    }

    private static class Step {
        private final String description;
        private final Runnable undo;

        private Step(String description, Runnable undo) {
            this.description = description;
            this.undo = undo;
        }
    }
}
