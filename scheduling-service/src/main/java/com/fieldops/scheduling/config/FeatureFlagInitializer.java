package com.fieldops.scheduling.config;

import com.fieldops.shared.context.TenantContext;
import com.fieldops.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds default feature flags for the default tenant on startup.
 * Flags already set in Redis are NOT overwritten.
 *
 * Runtime toggles:
 *   redis-cli HSET feature-flags:default scheduling_kill_switch true
 *   redis-cli HSET feature-flags:default local_search_enabled false
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedFeatureFlags() {
        return args -> {
            featureFlagService.initDefaults(TenantContext.DEFAULT_TENANT);
            log.info("Feature flags initialised for tenant={}", TenantContext.DEFAULT_TENANT);
        };
    }
}
