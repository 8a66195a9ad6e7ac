package com.fieldops.scheduling.exception;

/**
 * Another schedule-mutating operation holds the tenant lease. Callers should retry later.
 */
public class ScheduleBusyException extends SchedulingException {

    public static final String CODE = "SCHEDULE_BUSY";

    private final String tenantId;

    public ScheduleBusyException(String tenantId) {
        super(CODE, "Another optimization or adaptation is in progress for tenant " + tenantId
                + ". Retry once it completes.");
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
