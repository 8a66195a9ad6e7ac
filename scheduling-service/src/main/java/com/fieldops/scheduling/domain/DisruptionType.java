package com.fieldops.scheduling.domain;

public enum DisruptionType {
    TRAFFIC_DELAY,
    WEATHER,
    EMERGENCY_INSERTION,
    RESOURCE_UNAVAILABLE,
    CUSTOMER_RESCHEDULE,
    EQUIPMENT_FAILURE
}
