package com.fieldops.scheduling.analytics;

import com.fieldops.scheduling.config.SchedulingProperties;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.JobStatus;
import com.fieldops.scheduling.domain.OptimizationMetrics;
import com.fieldops.scheduling.domain.OptimizationRun;
import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.domain.RunType;
import com.fieldops.scheduling.entity.JobOutcomeEntity;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.scheduling.repository.JobOutcomeRepository;
import com.fieldops.scheduling.store.OptimizationRunStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Read-only KPIs over run history and job outcomes. Never touches the committed schedule.
 *
 * Run-level KPIs (utilization, savings, success rate) come from completed optimization runs;
 * outcome KPIs (on-time rate, jobs per technician-day) from reported job outcomes. The technician
 * filter also narrows travel to that technician's assignments; the skill filter narrows outcomes
 * and the demand forecast.
 */
@Slf4j
@Service
public class AnalyticsAggregator {

    static final Duration MAX_PERIOD = Duration.ofDays(366);
    static final double STABLE_BAND_PERCENT = 2.0;

    static final double LOW_UTILIZATION = 0.6;
    static final double HIGH_UTILIZATION = 0.9;
    static final double LOW_ON_TIME = 0.85;
    static final double LOW_SUCCESS = 0.9;
    static final double HIGH_TRAVEL_MINUTES = 30.0;

    private final OptimizationRunStore runStore;
    private final JobOutcomeRepository outcomeRepository;
    private final DemandForecaster forecaster;
    private final Duration grace;
    private final int forecastWindowDays;

    public AnalyticsAggregator(OptimizationRunStore runStore,
                               JobOutcomeRepository outcomeRepository,
                               DemandForecaster forecaster,
                               SchedulingProperties properties) {
        this.runStore = runStore;
        this.outcomeRepository = outcomeRepository;
        this.forecaster = forecaster;
        this.grace = properties.getAnalytics().getOnTimeGrace();
        this.forecastWindowDays = properties.getAnalytics().getForecastWindowDays();
    }

    public AnalyticsReport getAnalytics(String tenantId, Instant from, Instant to, AnalyticsFilter filter) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new SchedulingException(SchedulingException.INVALID_REQUEST, "Analytics period must have from < to");
        }
        if (Duration.between(from, to).compareTo(MAX_PERIOD) > 0) {
            throw new SchedulingException(SchedulingException.INVALID_REQUEST,
                    "Analytics period must not exceed " + MAX_PERIOD.toDays() + " days");
        }
        AnalyticsFilter f = filter != null ? filter : AnalyticsFilter.none();

        List<OptimizationRun> runs = runStore.runsBetween(tenantId, from, to);
        List<JobOutcomeEntity> outcomes = outcomeRepository.findByTenantIdAndScheduledStartBetween(tenantId, from, to)
                .stream()
                .filter(o -> matches(o, f))
                .toList();

        SchedulingKpis kpis = kpis(runs, outcomes, f);

        Instant middle = from.plus(Duration.between(from, to).dividedBy(2));
        SchedulingKpis first = kpis(
                runs.stream().filter(r -> r.getStartedAt().isBefore(middle)).toList(),
                outcomes.stream().filter(o -> o.getScheduledStart().isBefore(middle)).toList(), f);
        SchedulingKpis second = kpis(
                runs.stream().filter(r -> !r.getStartedAt().isBefore(middle)).toList(),
                outcomes.stream().filter(o -> !o.getScheduledStart().isBefore(middle)).toList(), f);

        List<KpiTrend> trends = new ArrayList<>();
        trends.add(trend("utilizationRate", first, second, SchedulingKpis::getUtilizationRate));
        trends.add(trend("onTimeRate", first, second, SchedulingKpis::getOnTimeRate));
        trends.add(trend("averageTravelMinutes", first, second, SchedulingKpis::getAverageTravelMinutes));
        trends.add(trend("travelSavingsPercent", first, second, SchedulingKpis::getTravelSavingsPercent));
        trends.add(trend("schedulingSuccessRate", first, second, SchedulingKpis::getSchedulingSuccessRate));
        trends.add(trend("averageJobsPerTechnicianPerDay", first, second,
                SchedulingKpis::getAverageJobsPerTechnicianPerDay));

        List<OptimizationRun> window = runStore.runsBetween(tenantId,
                to.minus(Duration.ofDays(forecastWindowDays)), to);
        List<DemandForecast> predictions = forecaster.forecast(window,
                LocalDate.ofInstant(to, ZoneOffset.UTC), f.skill());

        log.debug("Analytics for tenant {}: {} run(s), {} outcome(s)", tenantId, runs.size(), outcomes.size());
        return AnalyticsReport.builder()
                .tenantId(tenantId)
                .from(from)
                .to(to)
                .kpis(kpis)
                .trendAnalysis(trends)
                .predictions(predictions)
                .recommendations(recommendations(kpis))
                .build();
    }

    SchedulingKpis kpis(List<OptimizationRun> runs, List<JobOutcomeEntity> outcomes, AnalyticsFilter filter) {
        List<OptimizationMetrics> optimizations = new ArrayList<>();
        List<Assignment> assignments = new ArrayList<>();
        List<OptimizationMetrics> adaptations = new ArrayList<>();
        for (OptimizationRun run : runs) {
            if (run.getStatus() != RunStatus.COMPLETED || run.getMetrics() == null) {
                continue;
            }
            if (run.getRunType() == RunType.ADAPTATION) {
                adaptations.add(run.getMetrics());
            } else {
                optimizations.add(run.getMetrics());
                assignments.addAll(run.getAssignments());
            }
        }

        double travel;
        if (filter.technicianId() != null) {
            travel = assignments.stream()
                    .filter(a -> filter.technicianId().equals(a.getTechnicianId()))
                    .mapToDouble(a -> a.getTravelTimeFromPrevious().getSeconds() / 60.0)
                    .average().orElse(0.0);
        } else {
            travel = optimizations.stream().mapToDouble(OptimizationMetrics::getAverageTravelMinutes).average().orElse(0.0);
        }

        int total = optimizations.stream().mapToInt(OptimizationMetrics::getTotalJobs).sum();
        int scheduled = optimizations.stream().mapToInt(OptimizationMetrics::getScheduledJobs).sum();

        int rated = 0;
        int onTime = 0;
        int completed = 0;
        Set<String> technicianDays = new HashSet<>();
        for (JobOutcomeEntity outcome : outcomes) {
            if (JobOutcomes.isRated(outcome)) {
                rated++;
                if (JobOutcomes.isOnTime(outcome, grace)) {
                    onTime++;
                }
            }
            if (outcome.getStatus() == JobStatus.COMPLETED && outcome.getTechnicianId() != null) {
                completed++;
                technicianDays.add(outcome.getTechnicianId() + "@"
                        + LocalDate.ofInstant(outcome.getScheduledStart(), ZoneOffset.UTC));
            }
        }

        return SchedulingKpis.builder()
                .utilizationRate(round(optimizations.stream()
                        .mapToDouble(OptimizationMetrics::getUtilizationRate).average().orElse(0.0)))
                .onTimeRate(rated > 0 ? round((double) onTime / rated) : 0.0)
                .averageTravelMinutes(round(travel))
                .travelSavingsPercent(round(optimizations.stream()
                        .mapToDouble(OptimizationMetrics::getTravelSavingsPercent).average().orElse(0.0)))
                .schedulingSuccessRate(total > 0 ? round((double) scheduled / total) : 0.0)
                .averageJobsPerTechnicianPerDay(technicianDays.isEmpty() ? 0.0
                        : round((double) completed / technicianDays.size()))
                .runsAnalysed(optimizations.size())
                .adaptationCount(adaptations.size())
                .averageAdaptationImpact(round(adaptations.stream()
                        .mapToDouble(OptimizationMetrics::getAverageImpactScore).average().orElse(0.0)))
                .outcomesAnalysed(outcomes.size())
                .build();
    }

    static KpiTrend trend(String kpi, SchedulingKpis first, SchedulingKpis second, ToDoubleFunction<SchedulingKpis> value) {
        double before = value.applyAsDouble(first);
        double after = value.applyAsDouble(second);
        double change;
        if (before == 0.0) {
            change = after == 0.0 ? 0.0 : 100.0 * Math.signum(after);
        } else {
            change = (after - before) / Math.abs(before) * 100.0;
        }
        TrendDirection direction = Math.abs(change) <= STABLE_BAND_PERCENT
                ? TrendDirection.STABLE
                : change > 0 ? TrendDirection.UP : TrendDirection.DOWN;
        return KpiTrend.builder()
                .kpi(kpi)
                .firstHalf(before)
                .secondHalf(after)
                .changePercent(round(change))
                .direction(direction)
                .significance(TrendSignificance.of(change))
                .build();
    }

    static List<String> recommendations(SchedulingKpis kpis) {
        List<String> out = new ArrayList<>();
        if (kpis.getRunsAnalysed() > 0) {
            if (kpis.getUtilizationRate() < LOW_UTILIZATION) {
                out.add(String.format("Utilization is %.0f%%; consolidate routes or reduce rostered technicians on low-demand days",
                        kpis.getUtilizationRate() * 100));
            } else if (kpis.getUtilizationRate() > HIGH_UTILIZATION) {
                out.add(String.format("Utilization is %.0f%%; add capacity to absorb disruptions without overtime",
                        kpis.getUtilizationRate() * 100));
            }
            if (kpis.getSchedulingSuccessRate() < LOW_SUCCESS) {
                out.add(String.format("Only %.0f%% of jobs were scheduled; widen time windows or add technicians with the missing skills",
                        kpis.getSchedulingSuccessRate() * 100));
            }
            if (kpis.getAverageTravelMinutes() > HIGH_TRAVEL_MINUTES) {
                out.add(String.format("Average travel is %.1f minutes per job; group jobs by service area",
                        kpis.getAverageTravelMinutes()));
            }
            if (kpis.getAdaptationCount() > kpis.getRunsAnalysed()) {
                out.add("Disruptions outnumber planning runs; leave more slack between jobs");
            }
        }
        if (kpis.getOutcomesAnalysed() > 0 && kpis.getOnTimeRate() < LOW_ON_TIME) {
            out.add(String.format("On-time arrival is %.0f%%; review duration estimates and travel buffers",
                    kpis.getOnTimeRate() * 100));
        }
        return out;
    }

    private static boolean matches(JobOutcomeEntity outcome, AnalyticsFilter filter) {
        if (outcome.getScheduledStart() == null) {
            return false;
        }
        if (filter.technicianId() != null && !filter.technicianId().equals(outcome.getTechnicianId())) {
            return false;
        }
        return filter.skill() == null || JobOutcomes.skills(outcome).contains(filter.skill());
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
