package com.fieldops.scheduling.exception;

public class SchedulingException extends RuntimeException {

    public static final String RUN_NOT_FOUND          = "RUN_NOT_FOUND";
    public static final String NO_COMMITTED_SCHEDULE  = "NO_COMMITTED_SCHEDULE";
    public static final String SERVICE_UNAVAILABLE    = "SERVICE_UNAVAILABLE";
    public static final String INVALID_STATE          = "INVALID_STATE";
    public static final String INVALID_REQUEST        = "INVALID_REQUEST";
    public static final String JOB_NOT_FOUND          = "JOB_NOT_FOUND";

    private final String code;

    public SchedulingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SchedulingException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return false;
    }
}
