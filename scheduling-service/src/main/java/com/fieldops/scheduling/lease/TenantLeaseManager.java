package com.fieldops.scheduling.lease;

import java.time.Duration;
import java.util.Optional;

/**
 * At most one schedule-mutating operation (optimization or adaptation) per tenant at a time.
 */
public interface TenantLeaseManager {

    /**
     * @param wait how long to wait for a busy lease; zero fails immediately
     * @return the lease, or empty when it could not be obtained within {@code wait}
     */
    Optional<TenantLease> tryAcquire(String tenantId, Duration wait);
}
