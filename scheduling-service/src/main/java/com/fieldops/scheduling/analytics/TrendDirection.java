package com.fieldops.scheduling.analytics;

public enum TrendDirection {
    UP,
    DOWN,
    STABLE
}
