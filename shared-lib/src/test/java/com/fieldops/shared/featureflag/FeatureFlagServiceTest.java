package com.fieldops.shared.featureflag;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeatureFlagServiceTest {

    @Mock private RedisTemplate<String, String> redisTemplate;
    @Mock private HashOperations<String, Object, Object> hashOperations;

    private FeatureFlagService service;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        service = new FeatureFlagService(redisTemplate);
    }

    @Test
    @DisplayName("Tenant-level flag wins over the global override")
    void tenantFlagWins() {
        when(hashOperations.get("feature-flags:acme", FeatureFlagService.SCHEDULING_KILL_SWITCH)).thenReturn("true");

        assertThat(service.isEnabled("acme", FeatureFlagService.SCHEDULING_KILL_SWITCH, false)).isTrue();
    }

    @Test
    @DisplayName("Global override is used when the tenant has no value")
    void globalOverrideUsed() {
        when(hashOperations.get("feature-flags:acme", FeatureFlagService.LOCAL_SEARCH_ENABLED)).thenReturn(null);
        when(hashOperations.get("feature-flags:global", FeatureFlagService.LOCAL_SEARCH_ENABLED)).thenReturn("false");

        assertThat(service.isEnabled("acme", FeatureFlagService.LOCAL_SEARCH_ENABLED, true)).isFalse();
    }

    @Test
    @DisplayName("Redis outage falls back to the supplied default")
    void redisOutageUsesDefault() {
        when(hashOperations.get("feature-flags:acme", FeatureFlagService.WEATHER_SIGNAL_ENABLED))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThat(service.isEnabled("acme", FeatureFlagService.WEATHER_SIGNAL_ENABLED, true)).isTrue();
    }

    @Test
    @DisplayName("initDefaults only fills flags that are absent")
    void initDefaultsUsesPutIfAbsent() {
        service.initDefaults("default");

        verify(hashOperations).putIfAbsent("feature-flags:default", FeatureFlagService.SCHEDULING_KILL_SWITCH, "false");
        verify(hashOperations).putIfAbsent("feature-flags:default", FeatureFlagService.WEATHER_SIGNAL_ENABLED, "true");
        verify(hashOperations).putIfAbsent("feature-flags:default", FeatureFlagService.LOCAL_SEARCH_ENABLED, "true");
    }
}
