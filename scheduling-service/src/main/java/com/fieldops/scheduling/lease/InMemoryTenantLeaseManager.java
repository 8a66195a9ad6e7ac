package com.fieldops.scheduling.lease;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-instance leases: one {@link Semaphore} with one permit per tenant. Unlike a lock, a
 * semaphore permit may be released from another thread, which the preemption path relies on.
 */
@Slf4j
public class InMemoryTenantLeaseManager implements TenantLeaseManager {

    private final ConcurrentHashMap<String, Semaphore> permits = new ConcurrentHashMap<>();

    @Override
    public Optional<TenantLease> tryAcquire(String tenantId, Duration wait) {
        Semaphore semaphore = permits.computeIfAbsent(tenantId, k -> new Semaphore(1));
        try {
            boolean acquired = wait.isZero()
                    ? semaphore.tryAcquire()
                    : semaphore.tryAcquire(wait.toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.debug("Lease for tenant {} is busy", tenantId);
                return Optional.empty();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the lease of tenant {}", tenantId);
            return Optional.empty();
        }
        return Optional.of(new SemaphoreLease(tenantId, semaphore));
    }

    private static final class SemaphoreLease implements TenantLease {

        private final String tenantId;
        private final Semaphore semaphore;
        private final AtomicBoolean released = new AtomicBoolean();

        SemaphoreLease(String tenantId, Semaphore semaphore) {
            this.tenantId = tenantId;
            this.semaphore = semaphore;
        }

        @Override
        public String tenantId() {
            return tenantId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        }
    }
}
