package com.bit.arena.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 全局事务序列器：所有写操作串行执行，读操作只能看到已提交的状态
 * 可重入：市场结算内部调用目录、余额账本时复用同一把写锁
 */
@Slf4j
@Component
public class LedgerSequencer {

    // 公平锁，按提交顺序排队
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public <T> T write(Supplier<T> operation) {
        lock.writeLock().lock();
        try {
            return operation.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void execute(Runnable operation) {
        write(() -> {
            operation.run();
            return null;
        });
    }

    public <T> T read(Supplier<T> query) {
        // 持有写锁的线程可以直接读（写锁降级语义）
        if (lock.isWriteLockedByCurrentThread()) {
            return query.get();
        }
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
