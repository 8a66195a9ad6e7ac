package com.fieldops.scheduling.lease;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTenantLeaseManagerTest {

    private final InMemoryTenantLeaseManager manager = new InMemoryTenantLeaseManager();

    @Test
    @DisplayName("Only one lease per tenant is handed out at a time")
    void exclusivePerTenant() {
        Optional<TenantLease> first = manager.tryAcquire("acme", Duration.ZERO);

        assertThat(first).isPresent();
        assertThat(first.get().tenantId()).isEqualTo("acme");
        assertThat(manager.tryAcquire("acme", Duration.ZERO)).isEmpty();
        assertThat(manager.tryAcquire("globex", Duration.ZERO)).isPresent();
    }

    @Test
    @DisplayName("Closing a lease twice releases it only once")
    void doubleCloseIsHarmless() {
        TenantLease lease = manager.tryAcquire("acme", Duration.ZERO).orElseThrow();
        lease.close();
        lease.close();

        TenantLease next = manager.tryAcquire("acme", Duration.ZERO).orElseThrow();
        assertThat(manager.tryAcquire("acme", Duration.ZERO)).isEmpty();
        next.close();
    }

    @Test
    @DisplayName("A waiting caller gets the lease once the holder releases it from another thread")
    void waiterAcquiresAfterRelease() {
        TenantLease held = manager.tryAcquire("acme", Duration.ZERO).orElseThrow();

        CompletableFuture<Optional<TenantLease>> waiter =
                CompletableFuture.supplyAsync(() -> manager.tryAcquire("acme", Duration.ofSeconds(5)));
        CompletableFuture.runAsync(held::close).join();

        assertThat(waiter.join()).isPresent();
    }

    @Test
    @DisplayName("A bounded wait gives up while the lease stays held")
    void boundedWaitTimesOut() {
        manager.tryAcquire("acme", Duration.ZERO).orElseThrow();

        assertThat(manager.tryAcquire("acme", Duration.ofMillis(50))).isEmpty();
    }
}
