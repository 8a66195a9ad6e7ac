package com.fieldops.scheduling.controller;

import com.fieldops.scheduling.analytics.AnalyticsAggregator;
import com.fieldops.scheduling.analytics.AnalyticsFilter;
import com.fieldops.scheduling.analytics.AnalyticsReport;
import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.JobOutcome;
import com.fieldops.scheduling.domain.OptimizationRun;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.location.TechnicianLocationService;
import com.fieldops.scheduling.model.AdaptRequest;
import com.fieldops.scheduling.model.AdaptResponse;
import com.fieldops.scheduling.model.JobOutcomeRequest;
import com.fieldops.scheduling.model.LocationUpdateRequest;
import com.fieldops.scheduling.model.OptimizeRequest;
import com.fieldops.scheduling.model.OptimizeResponse;
import com.fieldops.scheduling.model.RunCancellation;
import com.fieldops.scheduling.service.JobOutcomeService;
import com.fieldops.scheduling.service.SchedulingOrchestrator;
import com.fieldops.shared.context.TenantContext;
import com.fieldops.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/scheduling")
@RequiredArgsConstructor
public class SchedulingController {

    private final SchedulingOrchestrator orchestrator;
    private final TechnicianLocationService locationService;
    private final AnalyticsAggregator analyticsAggregator;
    private final JobOutcomeService jobOutcomeService;

    @PostMapping("/optimize")
    public ResponseEntity<ApiResponse<OptimizeResponse>> optimize(@Valid @RequestBody OptimizeRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.optimize(TenantContext.get(), request)));
    }

    @PostMapping("/adapt")
    public ResponseEntity<ApiResponse<AdaptResponse>> adapt(@Valid @RequestBody AdaptRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.adapt(TenantContext.get(), request)));
    }

    /**
     * Technician position update, called every few seconds per active technician.
     * Returns before the write lands; last write wins.
     */
    @PostMapping("/technicians/{technicianId}/location")
    public ResponseEntity<Void> updateLocation(
            @PathVariable("technicianId") String technicianId,
            @Valid @RequestBody LocationUpdateRequest request) {

        locationService.updateLocation(TenantContext.get(), technicianId,
                GeoPoint.of(request.getLatitude(), request.getLongitude()), request.getStatus());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/analytics")
    public ResponseEntity<ApiResponse<AnalyticsReport>> analytics(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "technicianId", required = false) String technicianId,
            @RequestParam(value = "skill", required = false) String skill) {

        return ResponseEntity.ok(ApiResponse.ok(analyticsAggregator.getAnalytics(TenantContext.get(), from, to,
                new AnalyticsFilter(technicianId, skill))));
    }

    @DeleteMapping("/runs/{runId}")
    public ResponseEntity<ApiResponse<RunCancellation>> cancelRun(@PathVariable("runId") String runId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.ok(orchestrator.cancelRun(TenantContext.get(), runId)));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<ApiResponse<OptimizationRun>> getRun(@PathVariable("runId") String runId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.getRun(TenantContext.get(), runId)));
    }

    @GetMapping("/runs")
    public ResponseEntity<ApiResponse<List<OptimizationRun>>> history(
            @RequestParam(value = "days", defaultValue = "30") int days,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.history(TenantContext.get(), days, limit)));
    }

    @GetMapping("/schedule")
    public ResponseEntity<ApiResponse<ScheduleSnapshot>> currentSchedule() {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.currentSchedule(TenantContext.get())));
    }

    @PostMapping("/jobs/{jobId}/outcome")
    public ResponseEntity<ApiResponse<JobOutcome>> recordOutcome(
            @PathVariable("jobId") String jobId,
            @Valid @RequestBody JobOutcomeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(jobOutcomeService.record(TenantContext.get(), jobId, request)));
    }
}
