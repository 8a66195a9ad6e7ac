package com.fieldops.scheduling.model;

/**
 * Acknowledges a cancel request; the run itself finishes as CANCELLED once the engine notices.
 */
public record RunCancellation(String runId, boolean cancellationRequested) {
}
