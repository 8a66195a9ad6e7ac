package com.fieldops.scheduling.domain;

public enum JobPriority {
    EMERGENCY(100),
    URGENT(80),
    HIGH(60),
    MEDIUM(40),
    LOW(20);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
