package com.plant.hierarchy.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One read/write lock per plant. Writers of a plant are mutually exclusive and
 * readers see either the state before or after a write, never a partial one.
 */
@Component
public class TenantLockRegistry {

    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public <T> T withReadLock(String tenantId, Supplier<T> action) {
        return locked(lockFor(tenantId).readLock(), action);
    }

    public <T> T withWriteLock(String tenantId, Supplier<T> action) {
        return locked(lockFor(tenantId).writeLock(), action);
    }

    private ReentrantReadWriteLock lockFor(String tenantId) {
        return locks.computeIfAbsent(tenantId, id -> new ReentrantReadWriteLock(true));
    }

    private <T> T locked(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
