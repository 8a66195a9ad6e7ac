package com.fieldops.scheduling.weather;

public enum WeatherImpactLevel {
    NONE,
    LOW,
    MODERATE,
    HIGH,
    SEVERE;

    public WeatherImpactLevel atLeast(WeatherImpactLevel other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
