package com.fieldops.scheduling.analytics;

import com.fieldops.scheduling.config.SchedulingProperties;
import com.fieldops.scheduling.domain.OptimizationRun;
import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.domain.RunType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per-skill daily demand forecast by simple exponential smoothing.
 *
 * The daily count of a skill is the demand recorded by the last completed optimization of that
 * day (UTC); days without a run are not observations. The forecast is flat over the horizon and
 * its 95 % interval is the forecast plus or minus 1.96 standard deviations of the one-step-ahead
 * residuals, floored at zero.
 */
@Component
public class DemandForecaster {

    static final double Z_95 = 1.96;

    private final double alpha;
    private final int horizonDays;

    public DemandForecaster(SchedulingProperties properties) {
        this.alpha = properties.getAnalytics().getSmoothingAlpha();
        this.horizonDays = properties.getAnalytics().getForecastHorizonDays();
    }

    /**
     * @param runs runs of the rolling window, any order and type
     * @param skillFilter when non-null, only this skill is forecast
     */
    public List<DemandForecast> forecast(List<OptimizationRun> runs, LocalDate lastDay, String skillFilter) {
        TreeMap<LocalDate, OptimizationRun> lastRunOfDay = new TreeMap<>();
        for (OptimizationRun run : runs) {
            if (run.getRunType() != RunType.OPTIMIZATION || run.getStatus() != RunStatus.COMPLETED
                    || run.getMetrics() == null || run.getStartedAt() == null) {
                continue;
            }
            LocalDate day = LocalDate.ofInstant(run.getStartedAt(), ZoneOffset.UTC);
            OptimizationRun current = lastRunOfDay.get(day);
            if (current == null || run.getStartedAt().isAfter(current.getStartedAt())) {
                lastRunOfDay.put(day, run);
            }
        }

        TreeSet<String> skills = new TreeSet<>();
        lastRunOfDay.values().forEach(r -> skills.addAll(r.getMetrics().getDemandBySkill().keySet()));
        if (skillFilter != null) {
            skills.retainAll(List.of(skillFilter));
        }

        List<DemandForecast> forecasts = new ArrayList<>();
        for (String skill : skills) {
            double[] series = lastRunOfDay.values().stream()
                    .mapToDouble(r -> r.getMetrics().getDemandBySkill().getOrDefault(skill, 0))
                    .toArray();
            Smoothed fit = smooth(series, alpha);
            double lower = Math.max(0.0, fit.level() - Z_95 * fit.residualStdDev());
            double upper = fit.level() + Z_95 * fit.residualStdDev();

            List<ForecastPoint> points = new ArrayList<>(horizonDays);
            for (int d = 1; d <= horizonDays; d++) {
                points.add(ForecastPoint.builder()
                        .date(lastDay.plusDays(d))
                        .expectedJobs(round(fit.level()))
                        .lowerBound(round(lower))
                        .upperBound(round(upper))
                        .build());
            }
            forecasts.add(DemandForecast.builder()
                    .skill(skill)
                    .observedDays(series.length)
                    .points(points)
                    .build());
        }
        return forecasts;
    }

    record Smoothed(double level, double residualStdDev) {
    }

    /** Level after smoothing {@code series}, and the RMS of its one-step residuals. */
    static Smoothed smooth(double[] series, double alpha) {
        if (series.length == 0) {
            return new Smoothed(0.0, 0.0);
        }
        double level = series[0];
        double squared = 0.0;
        for (int i = 1; i < series.length; i++) {
            double residual = series[i] - level;
            squared += residual * residual;
            level = alpha * series[i] + (1 - alpha) * level;
        }
        double sigma = series.length > 1 ? Math.sqrt(squared / (series.length - 1)) : 0.0;
        return new Smoothed(level, sigma);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
