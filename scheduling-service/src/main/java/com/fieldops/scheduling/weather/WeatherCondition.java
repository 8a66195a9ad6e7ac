package com.fieldops.scheduling.weather;

public enum WeatherCondition {
    CLEAR,
    CLOUDY,
    LIGHT_RAIN,
    HEAVY_RAIN,
    SNOW,
    STORM,
    FOG,
    EXTREME_HEAT,
    EXTREME_COLD
}
