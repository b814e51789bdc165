package com.vigil.service.core.config;

import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.model.Sensitivity;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, fully-materialized view of the detection configuration. Built once at start-up from
 * {@link VigilProperties} and handed to the pipeline; nothing reads the mutable properties after that.
 */
public record DetectionSettings(
        PipelineSettings pipeline,
        GroupingSettings grouping,
        PrioritySettings priority,
        Map<String, Map<Sensitivity, Double>> sensitivityOverrides,
        Map<String, Map<String, Double>> detectorOptions,
        Set<String> disabledDetectors) {

    public DetectionSettings {
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(grouping, "grouping");
        Objects.requireNonNull(priority, "priority");
        sensitivityOverrides = copyNested(sensitivityOverrides);
        detectorOptions = copyNested(detectorOptions);
        disabledDetectors = Set.copyOf(disabledDetectors == null ? Set.of() : disabledDetectors);
    }

    public static DetectionSettings defaults() {
        return from(new VigilProperties());
    }

    public static DetectionSettings from(VigilProperties properties) {
        VigilProperties.Pipeline p = properties.getPipeline();
        PipelineSettings pipeline = new PipelineSettings(p.getWorkers(), p.getDeadline(), p.getMaxSeries());

        VigilProperties.Grouping g = properties.getGrouping();
        GroupingSettings grouping =
                new GroupingSettings(g.getMaxGap(), g.getGapIntervals(), g.getFallbackMaxGap(), g.getRetention());

        VigilProperties.Priority pr = properties.getPriority();
        PrioritySettings priority = new PrioritySettings(
                pr.getWeights().getPeak(),
                pr.getWeights().getDuration(),
                pr.getWeights().getPoints(),
                pr.getDurationHorizon(),
                pr.getPointsHorizon(),
                pr.getMinSupport(),
                pr.getLowSupportFactor(),
                pr.getHistoryBoost(),
                pr.getHistoryCap(),
                pr.getHistoryLookback(),
                pr.getCutPoints().getCritical(),
                pr.getCutPoints().getHigh(),
                pr.getCutPoints().getMedium(),
                pr.getResourceCriticality());

        Map<String, Map<Sensitivity, Double>> overrides = new LinkedHashMap<>();
        properties.getSensitivity().forEach((method, levels) -> {
            EnumMap<Sensitivity, Double> parsed = new EnumMap<>(Sensitivity.class);
            levels.forEach((level, value) -> parsed.put(Sensitivity.fromValue(level), value));
            overrides.put(normalizeMethod(method), parsed);
        });

        Map<String, Map<String, Double>> options = new LinkedHashMap<>();
        properties.getDetectors().getOptions().forEach((method, values) -> options.put(normalizeMethod(method), values));

        Set<String> disabled = new LinkedHashSet<>();
        properties.getDetectors().getDisabled().forEach(method -> disabled.add(normalizeMethod(method)));

        return new DetectionSettings(pipeline, grouping, priority, overrides, options, disabled);
    }

    public DetectionSettings withPipeline(PipelineSettings next) {
        return new DetectionSettings(
                next, grouping, priority, sensitivityOverrides, detectorOptions, disabledDetectors);
    }

    public DetectionSettings withGrouping(GroupingSettings next) {
        return new DetectionSettings(
                pipeline, next, priority, sensitivityOverrides, detectorOptions, disabledDetectors);
    }

    public DetectionSettings withPriority(PrioritySettings next) {
        return new DetectionSettings(
                pipeline, grouping, next, sensitivityOverrides, detectorOptions, disabledDetectors);
    }

    public DetectionSettings withDisabledDetectors(Set<String> next) {
        return new DetectionSettings(pipeline, grouping, priority, sensitivityOverrides, detectorOptions, next);
    }

    public Map<String, Double> optionsFor(String method) {
        return detectorOptions.getOrDefault(method, Map.of());
    }

    public static String normalizeMethod(String method) {
        return method == null ? "" : method.trim().toLowerCase(Locale.ROOT);
    }

    private static <K, V> Map<String, Map<K, V>> copyNested(Map<String, ? extends Map<K, V>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Map<K, V>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, Map.copyOf(value)));
        return Map.copyOf(copy);
    }

    public record PipelineSettings(int workers, Duration deadline, int maxSeries) {
        public PipelineSettings {
            if (workers < 1) {
                throw new IllegalArgumentException("vigil.pipeline.workers must be >= 1");
            }
            if (deadline == null || deadline.isNegative() || deadline.isZero()) {
                throw new IllegalArgumentException("vigil.pipeline.deadline must be positive");
            }
            if (maxSeries < 1) {
                throw new IllegalArgumentException("vigil.pipeline.max-series must be >= 1");
            }
        }
    }

    public record GroupingSettings(Duration maxGap, int gapIntervals, Duration fallbackMaxGap, Duration retention) {
        public GroupingSettings {
            if (maxGap != null && maxGap.isNegative()) {
                throw new IllegalArgumentException("vigil.grouping.max-gap must not be negative");
            }
            if (gapIntervals < 1) {
                throw new IllegalArgumentException("vigil.grouping.gap-intervals must be >= 1");
            }
            Objects.requireNonNull(fallbackMaxGap, "fallbackMaxGap");
            Objects.requireNonNull(retention, "retention");
        }

        public static GroupingSettings fixedGap(Duration maxGap) {
            return new GroupingSettings(maxGap, 5, Duration.ofMinutes(5), Duration.ofHours(1));
        }

        /** Configured gap, or {@code gapIntervals} sampling intervals of the given series. */
        public Duration maxGapFor(MetricSeries series) {
            if (maxGap != null) {
                return maxGap;
            }
            Duration interval = series.medianInterval();
            if (interval.isZero()) {
                return fallbackMaxGap;
            }
            return interval.multipliedBy(gapIntervals);
        }
    }

    public record PrioritySettings(
            double peakWeight,
            double durationWeight,
            double pointsWeight,
            Duration durationHorizon,
            int pointsHorizon,
            int minSupport,
            double lowSupportFactor,
            double historyBoost,
            int historyCap,
            Duration historyLookback,
            double criticalCut,
            double highCut,
            double mediumCut,
            Map<String, Double> resourceCriticality) {

        public PrioritySettings {
            if (peakWeight < 0 || durationWeight < 0 || pointsWeight < 0) {
                throw new IllegalArgumentException("vigil.priority.weights must not be negative");
            }
            if (peakWeight + durationWeight + pointsWeight <= 0) {
                throw new IllegalArgumentException("vigil.priority.weights must not all be zero");
            }
            if (durationHorizon == null || durationHorizon.isZero() || durationHorizon.isNegative()) {
                throw new IllegalArgumentException("vigil.priority.duration-horizon must be positive");
            }
            if (pointsHorizon < 1) {
                throw new IllegalArgumentException("vigil.priority.points-horizon must be >= 1");
            }
            if (lowSupportFactor < 0 || lowSupportFactor > 1) {
                throw new IllegalArgumentException("vigil.priority.low-support-factor must be within [0, 1]");
            }
            if (historyBoost < 0 || historyCap < 0) {
                throw new IllegalArgumentException("vigil.priority.history-boost/history-cap must not be negative");
            }
            Objects.requireNonNull(historyLookback, "historyLookback");
            if (!(mediumCut > 0 && mediumCut < highCut && highCut < criticalCut && criticalCut <= 1)) {
                throw new IllegalArgumentException(String.format(
                        "vigil.priority.cut-points must satisfy 0 < medium < high < critical <= 1 (got %s/%s/%s)",
                        mediumCut, highCut, criticalCut));
            }
            resourceCriticality = Map.copyOf(resourceCriticality == null ? Map.of() : resourceCriticality);
        }

        public double criticalityOf(String resourceId) {
            return resourceCriticality.getOrDefault(resourceId, 1.0);
        }

        public PrioritySettings withResourceCriticality(Map<String, Double> next) {
            return new PrioritySettings(
                    peakWeight,
                    durationWeight,
                    pointsWeight,
                    durationHorizon,
                    pointsHorizon,
                    minSupport,
                    lowSupportFactor,
                    historyBoost,
                    historyCap,
                    historyLookback,
                    criticalCut,
                    highCut,
                    mediumCut,
                    next);
        }
    }
}
