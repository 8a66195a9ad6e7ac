package com.fieldops.scheduling.travel;

import java.time.Duration;
import java.util.List;

/**
 * External travel-time source.
 *
 * Contract: one non-negative duration per leg, in the order the legs were given.
 * Implementations may throw {@link TravelTimeProviderException}; callers are expected
 * to wrap them with a timeout and a fallback (see {@link ResilientTravelTimeService}).
 */
public interface TravelTimeProvider {

    List<Duration> travelTimes(List<TravelLeg> legs);

    String name();
}
