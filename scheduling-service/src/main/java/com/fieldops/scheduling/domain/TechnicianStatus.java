package com.fieldops.scheduling.domain;

public enum TechnicianStatus {
    AVAILABLE,
    TRAVELING,
    ON_JOB,
    BREAK,
    UNAVAILABLE
}
