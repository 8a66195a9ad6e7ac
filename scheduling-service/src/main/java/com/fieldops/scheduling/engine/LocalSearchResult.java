package com.fieldops.scheduling.engine;

public record LocalSearchResult(Solution solution, int iterations, boolean timedOut, boolean cancelled) {
}
