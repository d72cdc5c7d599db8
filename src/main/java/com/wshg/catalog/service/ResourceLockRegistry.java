package com.wshg.catalog.service;

import com.wshg.catalog.error.OperationTimeoutException;
import com.wshg.catalog.model.Deadline;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped per-resource write locks. All mutations of one resource id, and therefore all appends
 * to its audit chain, go through the same lock. Different ids usually map to different stripes.
 */
@Component
public class ResourceLockRegistry {

    private static final int STRIPES = 1024;

    private final ReentrantLock[] locks;

    public ResourceLockRegistry() {
        locks = new ReentrantLock[STRIPES];
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Acquires the lock for {@code resourceId}, waiting no longer than the deadline allows.
     *
     * @throws OperationTimeoutException if the lock is not obtained in time
     */
    public ReentrantLock acquire(String resourceId, Deadline deadline, String operation) {
        ReentrantLock lock = lockFor(resourceId);
        boolean acquired;
        try {
            acquired = lock.tryLock(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException(operation, ex);
        }
        if (!acquired) {
            deadline.check(operation);
            // clock granularity: tryLock gave up a moment before expiry
            throw new OperationTimeoutException(operation, Duration.ZERO);
        }
        return lock;
    }

    ReentrantLock lockFor(String resourceId) {
        return locks[Math.floorMod(resourceId.hashCode(), STRIPES)];
    }
}
