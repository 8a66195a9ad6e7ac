package com.fieldops.scheduling.weather;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class WeatherImpact {

    WeatherCondition condition;
    WeatherImpactLevel level;
    Duration scheduleAdjustment;

    @Builder.Default
    List<String> concerns = List.of();

    /** Default assumption when no signal is available. */
    public static WeatherImpact none() {
        return WeatherImpact.builder()
                .condition(WeatherCondition.CLEAR)
                .level(WeatherImpactLevel.NONE)
                .scheduleAdjustment(Duration.ZERO)
                .build();
    }

    /**
     * Scores an observation. Adjustments accumulate:
     * extreme cold +30, extreme heat +15, heavy rain +45, light rain +15, snow +60,
     * storm +120, wind above 50 km/h +30, visibility below 1 km +20.
     */
    public static WeatherImpact assess(WeatherObservation obs) {
        WeatherImpactLevel level = WeatherImpactLevel.NONE;
        long minutes = 0;
        List<String> concerns = new ArrayList<>();

        if (obs.getTemperatureCelsius() < -10) {
            level = level.atLeast(WeatherImpactLevel.HIGH);
            minutes += 30;
            concerns.add("Extreme cold conditions");
        } else if (obs.getTemperatureCelsius() > 35) {
            level = level.atLeast(WeatherImpactLevel.MODERATE);
            minutes += 15;
            concerns.add("High temperature");
        }

        WeatherCondition condition = obs.getCondition() != null ? obs.getCondition() : WeatherCondition.CLEAR;
        switch (condition) {
            case HEAVY_RAIN -> {
                level = level.atLeast(WeatherImpactLevel.HIGH);
                minutes += 45;
                concerns.add("Heavy rain");
            }
            case LIGHT_RAIN -> {
                level = level.atLeast(WeatherImpactLevel.LOW);
                minutes += 15;
            }
            case SNOW -> {
                level = level.atLeast(WeatherImpactLevel.HIGH);
                minutes += 60;
                concerns.add("Slippery conditions");
            }
            case STORM -> {
                level = WeatherImpactLevel.SEVERE;
                minutes += 120;
                concerns.add("Dangerous weather conditions");
            }
            default -> {
                // no precipitation adjustment
            }
        }

        if (obs.getWindSpeedKmh() > 50) {
            level = level.atLeast(WeatherImpactLevel.HIGH);
            minutes += 30;
            concerns.add("High wind conditions");
        }
        if (obs.getVisibilityKm() < 1) {
            level = level.atLeast(WeatherImpactLevel.MODERATE);
            minutes += 20;
            concerns.add("Poor visibility");
        }

        return WeatherImpact.builder()
                .condition(condition)
                .level(level)
                .scheduleAdjustment(Duration.ofMinutes(minutes))
                .concerns(List.copyOf(concerns))
                .build();
    }
}
