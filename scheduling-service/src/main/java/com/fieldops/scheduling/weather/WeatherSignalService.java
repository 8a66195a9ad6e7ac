package com.fieldops.scheduling.weather;

import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.shared.featureflag.FeatureFlagService;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Optional weather signal. Any failure, timeout or missing provider degrades to
 * {@link WeatherImpact#none()}, i.e. "no adverse weather".
 */
@Slf4j
public class WeatherSignalService {

    private final WeatherSignalProvider provider;
    private final TimeLimiter timeLimiter;
    private final Executor executor;
    private final FeatureFlagService featureFlagService;

    public WeatherSignalService(WeatherSignalProvider provider, TimeLimiter timeLimiter,
                                Executor executor, FeatureFlagService featureFlagService) {
        this.provider = provider;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
        this.featureFlagService = featureFlagService;
    }

    public WeatherImpact impactAt(String tenantId, GeoPoint location, Instant at) {
        if (provider == null || location == null
                || !featureFlagService.isEnabled(tenantId, FeatureFlagService.WEATHER_SIGNAL_ENABLED, true)) {
            return WeatherImpact.none();
        }
        try {
            WeatherObservation obs = timeLimiter.executeFutureSupplier(() ->
                    CompletableFuture.supplyAsync(() -> provider.observe(location, at), executor));
            if (obs == null) {
                return WeatherImpact.none();
            }
            WeatherImpact impact = WeatherImpact.assess(obs);
            log.debug("Weather at ({},{}): {} -> {} (+{} min)", location.getLatitude(), location.getLongitude(),
                    obs.getCondition(), impact.getLevel(), impact.getScheduleAdjustment().toMinutes());
            return impact;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Weather signal unavailable, assuming no adverse weather: {}", e.getMessage());
            return WeatherImpact.none();
        }
    }
}
