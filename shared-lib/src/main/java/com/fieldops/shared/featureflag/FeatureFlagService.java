package com.fieldops.shared.featureflag;

import com.fieldops.shared.context.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{tenantId}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Registered via FeatureFlagAutoConfiguration (Spring Boot auto-config).
 * Set a flag via Redis CLI:
 *   HSET feature-flags:default scheduling_kill_switch true
 *   HSET feature-flags:acme weather_signal_enabled false
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_TENANT   = "global";

    public static final String SCHEDULING_KILL_SWITCH  = "scheduling_kill_switch";
    public static final String WEATHER_SIGNAL_ENABLED  = "weather_signal_enabled";
    public static final String LOCAL_SEARCH_ENABLED    = "local_search_enabled";

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Returns the flag for the tenant, then the global override, then the default.
     * An unreachable Redis yields the default so flags never block scheduling.
     */
    public boolean isEnabled(String tenantId, String flagName, boolean defaultValue) {
        try {
            Object tenantVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + tenantId, flagName);
            if (tenantVal != null) {
                return Boolean.parseBoolean(tenantVal.toString());
            }

            Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_TENANT, flagName);
            if (globalVal != null) {
                return Boolean.parseBoolean(globalVal.toString());
            }
        } catch (DataAccessException e) {
            log.warn("Feature flag lookup failed for '{}' tenant='{}', using default={}: {}",
                    flagName, tenantId, defaultValue, e.getMessage());
            return defaultValue;
        }

        log.debug("Feature flag '{}' not found for tenant='{}', using default={}", flagName, tenantId, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(TenantContext.DEFAULT_TENANT, flagName, defaultValue);
    }

    public void setFlag(String tenantId, String flagName, boolean value) {
        redisTemplate.opsForHash().put(FLAG_KEY_PREFIX + tenantId, flagName, String.valueOf(value));
        log.info("Feature flag set: tenant={} flag={} value={}", tenantId, flagName, value);
    }

    /**
     * Initialise default flags if they are not yet set (called at startup).
     */
    public void initDefaults(String tenantId) {
        String key = FLAG_KEY_PREFIX + tenantId;
        setIfAbsent(key, SCHEDULING_KILL_SWITCH, "false");
        setIfAbsent(key, WEATHER_SIGNAL_ENABLED, "true");
        setIfAbsent(key, LOCAL_SEARCH_ENABLED,   "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }

    private void setIfAbsent(String key, String field, String value) {
        redisTemplate.opsForHash().putIfAbsent(key, field, value);
    }
}
