package com.fieldops.scheduling.run;

import com.fieldops.scheduling.engine.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Optimizations currently running on this instance, with the tokens that stop them.
 */
@Slf4j
@Component
public class ActiveRunRegistry {

    public record ActiveRun(String runId, String tenantId, CancellationToken token) {
    }

    private final Map<String, ActiveRun> byRunId = new ConcurrentHashMap<>();
    private final Map<String, String> runIdByTenant = new ConcurrentHashMap<>();

    public CancellationToken register(String tenantId, String runId) {
        CancellationToken token = new CancellationToken();
        byRunId.put(runId, new ActiveRun(runId, tenantId, token));
        runIdByTenant.put(tenantId, runId);
        return token;
    }

    public void unregister(String runId) {
        ActiveRun run = byRunId.remove(runId);
        if (run != null) {
            runIdByTenant.remove(run.tenantId(), runId);
        }
    }

    /** Flips the token of a running run; false when the run is not active here. */
    public boolean cancel(String tenantId, String runId) {
        ActiveRun run = byRunId.get(runId);
        if (run == null || !run.tenantId().equals(tenantId)) {
            return false;
        }
        run.token().cancel();
        log.info("Cancellation requested for run {} of tenant {}", runId, tenantId);
        return true;
    }

    /** Cancels whatever optimization is running for the tenant and returns its id. */
    public Optional<String> cancelTenant(String tenantId) {
        String runId = runIdByTenant.get(tenantId);
        if (runId != null && cancel(tenantId, runId)) {
            return Optional.of(runId);
        }
        return Optional.empty();
    }

    public int activeCount() {
        return byRunId.size();
    }
}
