package com.fieldops.scheduling.exception;

import com.fieldops.scheduling.constraint.FieldViolation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Carries every violated field of a constraint or preference payload, collected in one pass.
 */
public class ConstraintValidationException extends SchedulingException {

    public static final String CODE = "VALIDATION_ERROR";

    private final List<FieldViolation> violations;

    public ConstraintValidationException(List<FieldViolation> violations) {
        super(CODE, violations.stream()
                .map(FieldViolation::toString)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
