package com.fieldops.scheduling.travel;

import com.fieldops.scheduling.domain.GeoPoint;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Time-bounded access to the travel-time provider.
 *
 * The provider call runs on a dedicated executor guarded by a Resilience4j TimeLimiter
 * (batch timeout, default 5s) and a CircuitBreaker. Any failure, timeout, open circuit or
 * malformed answer is logged and the whole batch is answered by the great-circle estimator
 * with {@code degraded = true}. Callers are never blocked beyond the timeout.
 */
@Slf4j
public class ResilientTravelTimeService {

    private final TravelTimeProvider provider;
    private final HaversineTravelTimeEstimator fallback;
    private final TimeLimiter timeLimiter;
    private final CircuitBreaker circuitBreaker;
    private final Executor executor;

    /**
     * @param provider primary source, or null to use the estimator as the primary source
     */
    public ResilientTravelTimeService(TravelTimeProvider provider,
                                      HaversineTravelTimeEstimator fallback,
                                      TimeLimiter timeLimiter,
                                      CircuitBreaker circuitBreaker,
                                      Executor executor) {
        this.provider = provider;
        this.fallback = fallback;
        this.timeLimiter = timeLimiter;
        this.circuitBreaker = circuitBreaker;
        this.executor = executor;
    }

    public TravelTimeBatch travelTimes(List<TravelLeg> legs) {
        if (legs.isEmpty()) {
            return new TravelTimeBatch(List.of(), false, fallback.name());
        }
        if (provider == null) {
            return new TravelTimeBatch(fallback.travelTimes(legs), false, fallback.name());
        }

        try {
            List<Duration> durations = circuitBreaker.executeCallable(() ->
                    timeLimiter.executeFutureSupplier(() ->
                            CompletableFuture.supplyAsync(() -> checked(provider.travelTimes(legs), legs.size()), executor)));
            return new TravelTimeBatch(durations, false, provider.name());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Travel-time provider '{}' unavailable for {} leg(s), using {} estimate: {}",
                    provider.name(), legs.size(), fallback.name(), describe(e));
            return new TravelTimeBatch(fallback.travelTimes(legs), true, fallback.name());
        }
    }

    /**
     * Builds the full node matrix in a single batch. Identical points cost nothing and are not sent.
     */
    public TravelTimeMatrix buildMatrix(List<GeoPoint> nodes) {
        int n = nodes.size();
        long[][] seconds = new long[n][n];
        Map<TravelLeg, List<int[]>> legCells = new LinkedHashMap<>();

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i == j || nodes.get(i).equals(nodes.get(j))) {
                    continue;
                }
                legCells.computeIfAbsent(TravelLeg.of(nodes.get(i), nodes.get(j)), k -> new ArrayList<>())
                        .add(new int[]{i, j});
            }
        }

        List<TravelLeg> legs = new ArrayList<>(legCells.keySet());
        TravelTimeBatch batch = travelTimes(legs);
        for (int k = 0; k < legs.size(); k++) {
            long value = batch.getDurations().get(k).getSeconds();
            for (int[] cell : legCells.get(legs.get(k))) {
                seconds[cell[0]][cell[1]] = value;
            }
        }

        log.debug("Built {}x{} travel matrix from {} unique legs via {} (degraded={})",
                n, n, legs.size(), batch.getSource(), batch.isDegraded());
        return new TravelTimeMatrix(seconds, batch.isDegraded());
    }

    private static List<Duration> checked(List<Duration> durations, int expected) {
        if (durations == null || durations.size() != expected) {
            throw new TravelTimeProviderException("Expected " + expected + " durations, got "
                    + (durations == null ? "null" : durations.size()));
        }
        for (Duration d : durations) {
            if (d == null || d.isNegative()) {
                throw new TravelTimeProviderException("Provider returned an invalid duration: " + d);
            }
        }
        return List.copyOf(durations);
    }

    private static String describe(Exception e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? " - " + cause.getMessage() : "");
    }
}
