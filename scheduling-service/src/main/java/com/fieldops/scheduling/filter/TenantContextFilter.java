package com.fieldops.scheduling.filter;

import com.fieldops.shared.context.TenantContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Binds the X-Tenant-ID header (default tenant when absent) to {@link TenantContext} and puts the
 * tenant and an X-Request-ID trace id into the MDC for the duration of the request.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TenantContextFilter extends OncePerRequestFilter {

    public static final String HEADER_REQUEST_ID = "X-Request-ID";
    public static final String MDC_REQUEST_KEY   = "requestId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String tenantId = TenantContext.resolve(request.getHeader(TenantContext.HEADER_TENANT_ID));
        String requestId = request.getHeader(HEADER_REQUEST_ID);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        TenantContext.set(tenantId);
        MDC.put(TenantContext.MDC_TENANT_KEY, tenantId);
        MDC.put(MDC_REQUEST_KEY, requestId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        try {
            log.debug("-> {} {}", request.getMethod(), request.getRequestURI());
            chain.doFilter(request, response);
            log.debug("<- {} {} status={}", request.getMethod(), request.getRequestURI(), response.getStatus());
        } finally {
            MDC.remove(MDC_REQUEST_KEY);
            MDC.remove(TenantContext.MDC_TENANT_KEY);
            TenantContext.clear();
        }
    }
}
