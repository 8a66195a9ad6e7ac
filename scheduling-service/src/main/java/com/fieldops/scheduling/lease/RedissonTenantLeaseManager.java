package com.fieldops.scheduling.lease;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Cluster-wide leases on Redisson locks, key {@code lock:schedule:{tenantId}}.
 *
 * The lock auto-expires after {@code leaseTime} so a crashed holder cannot block a tenant forever.
 * Redisson locks are owned by the acquiring thread, so the lease must be closed on that thread.
 */
@Slf4j
public class RedissonTenantLeaseManager implements TenantLeaseManager {

    static final String LOCK_PREFIX = "lock:schedule:";

    private final RedissonClient redissonClient;
    private final Duration leaseTime;

    public RedissonTenantLeaseManager(RedissonClient redissonClient, Duration leaseTime) {
        this.redissonClient = redissonClient;
        this.leaseTime = leaseTime;
    }

    @Override
    public Optional<TenantLease> tryAcquire(String tenantId, Duration wait) {
        RLock lock = redissonClient.getLock(LOCK_PREFIX + tenantId);
        try {
            boolean acquired = lock.tryLock(wait.toMillis(), leaseTime.toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.debug("Lease for tenant {} is held elsewhere", tenantId);
                return Optional.empty();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while acquiring schedule lock for tenant {}", tenantId);
            return Optional.empty();
        }
        return Optional.of(new TenantLease() {
            @Override
            public String tenantId() {
                return tenantId;
            }

            @Override
            public void close() {
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                }
            }
        });
    }
}
