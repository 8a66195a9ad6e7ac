package com.fieldops.scheduling.analytics;

import com.fieldops.scheduling.config.SchedulingProperties;
import com.fieldops.scheduling.entity.JobOutcomeEntity;
import com.fieldops.scheduling.repository.JobOutcomeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Historical on-time rate per technician, read from job outcomes of the last 30 days and cached
 * per tenant for {@code scheduling.analytics.performance-cache-ttl}. Technicians without rated
 * outcomes are absent, so the engine falls back to its default rate.
 */
@Slf4j
@Component
public class TechnicianPerformanceCache {

    static final Duration LOOKBACK = Duration.ofDays(30);

    private record Entry(Map<String, Double> rates, Instant expiresAt) {
    }

    private final JobOutcomeRepository outcomeRepository;
    private final Clock clock;
    private final Duration ttl;
    private final Duration grace;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public TechnicianPerformanceCache(JobOutcomeRepository outcomeRepository, Clock clock,
                                      SchedulingProperties properties) {
        this.outcomeRepository = outcomeRepository;
        this.clock = clock;
        this.ttl = properties.getAnalytics().getPerformanceCacheTtl();
        this.grace = properties.getAnalytics().getOnTimeGrace();
    }

    public Map<String, Double> onTimeRates(String tenantId) {
        Instant now = clock.instant();
        Entry entry = entries.get(tenantId);
        if (entry != null && now.isBefore(entry.expiresAt())) {
            return entry.rates();
        }
        Map<String, Double> rates;
        try {
            rates = load(tenantId, now);
        } catch (DataAccessException e) {
            log.warn("On-time rates for tenant {} unavailable, using defaults: {}", tenantId, e.getMessage());
            return entry != null ? entry.rates() : Map.of();
        }
        entries.put(tenantId, new Entry(rates, now.plus(ttl)));
        return rates;
    }

    public void invalidate(String tenantId) {
        entries.remove(tenantId);
    }

    private Map<String, Double> load(String tenantId, Instant now) {
        Map<String, int[]> counts = new HashMap<>();
        for (JobOutcomeEntity outcome : outcomeRepository.findByTenantIdAndScheduledStartBetween(
                tenantId, now.minus(LOOKBACK), now)) {
            if (outcome.getTechnicianId() == null || !JobOutcomes.isRated(outcome)) {
                continue;
            }
            int[] c = counts.computeIfAbsent(outcome.getTechnicianId(), k -> new int[2]);
            c[1]++;
            if (JobOutcomes.isOnTime(outcome, grace)) {
                c[0]++;
            }
        }
        Map<String, Double> rates = new HashMap<>();
        counts.forEach((technicianId, c) -> rates.put(technicianId, (double) c[0] / c[1]));
        log.debug("Loaded on-time rates for {} technician(s) of tenant {}", rates.size(), tenantId);
        return Map.copyOf(rates);
    }
}
