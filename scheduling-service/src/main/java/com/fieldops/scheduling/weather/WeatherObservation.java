package com.fieldops.scheduling.weather;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherObservation {

    private WeatherCondition condition;
    private double temperatureCelsius;
    private double windSpeedKmh;
    private double visibilityKm;
}
