package com.fieldops.scheduling.domain;

public enum RunType {
    OPTIMIZATION,
    ADAPTATION
}
