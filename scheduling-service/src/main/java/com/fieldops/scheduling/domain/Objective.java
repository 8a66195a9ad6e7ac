package com.fieldops.scheduling.domain;

public enum Objective {
    MINIMIZE_TRAVEL_TIME,
    MAXIMIZE_UTILIZATION,
    BALANCE_WORKLOAD,
    MINIMIZE_SKILL_MISMATCH,
    MAXIMIZE_CUSTOMER_SATISFACTION
}
