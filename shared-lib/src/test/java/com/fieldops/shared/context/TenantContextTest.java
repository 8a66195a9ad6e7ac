package com.fieldops.shared.context;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TenantContextTest {

    @AfterEach
    void tearDown() {
        TenantContext.clear();
    }

    @Test
    @DisplayName("Blank tenant header resolves to the default tenant")
    void blankResolvesToDefault() {
        TenantContext.set("  ");
        assertThat(TenantContext.get()).isEqualTo(TenantContext.DEFAULT_TENANT);
    }

    @Test
    @DisplayName("Tenant value is kept per thread and cleared afterwards")
    void setAndClear() throws InterruptedException {
        TenantContext.set("acme");
        String[] seenByOtherThread = new String[1];
        Thread other = new Thread(() -> seenByOtherThread[0] = TenantContext.get());
        other.start();
        other.join();

        assertThat(TenantContext.get()).isEqualTo("acme");
        assertThat(seenByOtherThread[0]).isEqualTo(TenantContext.DEFAULT_TENANT);

        TenantContext.clear();
        assertThat(TenantContext.get()).isEqualTo(TenantContext.DEFAULT_TENANT);
    }
}
