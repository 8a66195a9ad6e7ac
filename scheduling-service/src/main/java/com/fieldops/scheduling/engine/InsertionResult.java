package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.UnscheduledJob;

import java.util.List;

/**
 * @param cancelled the token stopped insertion before every job was tried; jobs not yet tried are
 *                  neither placed nor listed as unscheduled
 */
public record InsertionResult(Solution solution, List<UnscheduledJob> unscheduled, boolean cancelled) {
}
