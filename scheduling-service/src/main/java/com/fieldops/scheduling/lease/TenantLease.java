package com.fieldops.scheduling.lease;

/**
 * Exclusive right to mutate one tenant's committed schedule. Closing releases it; closing twice
 * is harmless.
 */
public interface TenantLease extends AutoCloseable {

    String tenantId();

    @Override
    void close();
}
