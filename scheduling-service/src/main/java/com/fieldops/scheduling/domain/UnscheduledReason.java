package com.fieldops.scheduling.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UnscheduledReason {
    NO_CANDIDATE("no_candidate"),
    NO_SLOT("no_slot"),
    TRAVEL_TIME_EXCEEDED("travel_time_exceeded");

    private final String code;

    UnscheduledReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
