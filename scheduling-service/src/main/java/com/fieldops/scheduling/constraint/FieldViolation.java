package com.fieldops.scheduling.constraint;

import lombok.Value;

@Value
public class FieldViolation {

    String field;
    String message;

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
