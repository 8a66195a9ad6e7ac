package com.fieldops.scheduling.travel;

import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.shared.util.GeoUtil;

import java.time.Duration;
import java.util.List;

/**
 * Distance-based estimate: great-circle distance divided by an assumed average speed,
 * rounded up to whole seconds. Pure and deterministic.
 */
public class HaversineTravelTimeEstimator implements TravelTimeProvider {

    public static final double DEFAULT_SPEED_KMH = 30.0;

    private final double averageSpeedKmh;

    public HaversineTravelTimeEstimator(double averageSpeedKmh) {
        if (averageSpeedKmh <= 0 || Double.isNaN(averageSpeedKmh)) {
            throw new IllegalArgumentException("averageSpeedKmh must be positive, got " + averageSpeedKmh);
        }
        this.averageSpeedKmh = averageSpeedKmh;
    }

    public HaversineTravelTimeEstimator() {
        this(DEFAULT_SPEED_KMH);
    }

    @Override
    public List<Duration> travelTimes(List<TravelLeg> legs) {
        return legs.stream()
                .map(leg -> estimate(leg.getOrigin(), leg.getDestination()))
                .toList();
    }

    public Duration estimate(GeoPoint origin, GeoPoint destination) {
        if (origin.equals(destination)) {
            return Duration.ZERO;
        }
        double km = GeoUtil.distanceKm(origin.getLatitude(), origin.getLongitude(),
                destination.getLatitude(), destination.getLongitude());
        long seconds = (long) Math.ceil(km / averageSpeedKmh * 3600.0);
        return Duration.ofSeconds(Math.max(0L, seconds));
    }

    @Override
    public String name() {
        return "great-circle@" + averageSpeedKmh + "kmh";
    }
}
