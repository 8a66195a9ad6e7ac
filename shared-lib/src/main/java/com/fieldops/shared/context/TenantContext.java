package com.fieldops.shared.context;

/**
 * Holds the current tenant (business) identifier for the duration of a request thread.
 *
 * Populated from the X-Tenant-ID header by the scheduling service's servlet filter and
 * mirrored into the logging MDC under {@link #MDC_TENANT_KEY}. Every committed schedule,
 * lease and run record is keyed by this value, so one business never observes another's data.
 */
public final class TenantContext {

    public static final String HEADER_TENANT_ID    = "X-Tenant-ID";
    public static final String KAFKA_HEADER_TENANT = "tenant_id";
    public static final String MDC_TENANT_KEY      = "tenantId";
    public static final String DEFAULT_TENANT      = "default";

    private static final ThreadLocal<String> TENANT = ThreadLocal.withInitial(() -> DEFAULT_TENANT);

    private TenantContext() {}

    public static void set(String tenantId) {
        TENANT.set(resolve(tenantId));
    }

    public static String get() {
        return TENANT.get();
    }

    public static void clear() {
        TENANT.remove();
    }

    /**
     * Normalises a raw tenant value: blank or missing maps to {@link #DEFAULT_TENANT}.
     */
    public static String resolve(String tenantId) {
        return tenantId == null || tenantId.isBlank() ? DEFAULT_TENANT : tenantId.trim();
    }
}
