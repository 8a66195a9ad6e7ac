package com.fieldops.scheduling.weather;

import com.fieldops.scheduling.domain.GeoPoint;

import java.time.Instant;

public interface WeatherSignalProvider {

    WeatherObservation observe(GeoPoint location, Instant at);
}
