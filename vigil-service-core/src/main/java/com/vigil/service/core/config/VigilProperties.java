package com.vigil.service.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "vigil")
public class VigilProperties {
    private Pipeline pipeline = new Pipeline();
    private Grouping grouping = new Grouping();
    private Priority priority = new Priority();
    private Detectors detectors = new Detectors();
    private Persistence persistence = new Persistence();

    /** method -> (low|medium|high -> knob value). Entries here replace the detector's defaults. */
    private Map<String, Map<String, Double>> sensitivity = new LinkedHashMap<>();

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Grouping getGrouping() {
        return grouping;
    }

    public void setGrouping(Grouping grouping) {
        this.grouping = grouping;
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        this.priority = priority;
    }

    public Detectors getDetectors() {
        return detectors;
    }

    public void setDetectors(Detectors detectors) {
        this.detectors = detectors;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Map<String, Map<String, Double>> getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(Map<String, Map<String, Double>> sensitivity) {
        this.sensitivity = sensitivity;
    }

    public static class Pipeline {
        private int workers = 4;
        private Duration deadline = Duration.ofSeconds(30);
        private int maxSeries = 10;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public Duration getDeadline() {
            return deadline;
        }

        public void setDeadline(Duration deadline) {
            this.deadline = deadline;
        }

        public int getMaxSeries() {
            return maxSeries;
        }

        public void setMaxSeries(int maxSeries) {
            this.maxSeries = maxSeries;
        }
    }

    public static class Grouping {
        /** Fixed gap; when unset the gap is derived from the series' sampling interval. */
        private Duration maxGap;

        private int gapIntervals = 5;
        private Duration fallbackMaxGap = Duration.ofMinutes(5);
        private Duration retention = Duration.ofHours(1);

        public Duration getMaxGap() {
            return maxGap;
        }

        public void setMaxGap(Duration maxGap) {
            this.maxGap = maxGap;
        }

        public int getGapIntervals() {
            return gapIntervals;
        }

        public void setGapIntervals(int gapIntervals) {
            this.gapIntervals = gapIntervals;
        }

        public Duration getFallbackMaxGap() {
            return fallbackMaxGap;
        }

        public void setFallbackMaxGap(Duration fallbackMaxGap) {
            this.fallbackMaxGap = fallbackMaxGap;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Priority {
        private Weights weights = new Weights();
        private CutPoints cutPoints = new CutPoints();
        private Duration durationHorizon = Duration.ofMinutes(10);
        private int pointsHorizon = 10;
        private int minSupport = 2;
        private double lowSupportFactor = 0.5;
        private double historyBoost = 0.05;
        private int historyCap = 10;
        private Duration historyLookback = Duration.ofHours(24);
        private Map<String, Double> resourceCriticality = new LinkedHashMap<>();

        public Weights getWeights() {
            return weights;
        }

        public void setWeights(Weights weights) {
            this.weights = weights;
        }

        public CutPoints getCutPoints() {
            return cutPoints;
        }

        public void setCutPoints(CutPoints cutPoints) {
            this.cutPoints = cutPoints;
        }

        public Duration getDurationHorizon() {
            return durationHorizon;
        }

        public void setDurationHorizon(Duration durationHorizon) {
            this.durationHorizon = durationHorizon;
        }

        public int getPointsHorizon() {
            return pointsHorizon;
        }

        public void setPointsHorizon(int pointsHorizon) {
            this.pointsHorizon = pointsHorizon;
        }

        public int getMinSupport() {
            return minSupport;
        }

        public void setMinSupport(int minSupport) {
            this.minSupport = minSupport;
        }

        public double getLowSupportFactor() {
            return lowSupportFactor;
        }

        public void setLowSupportFactor(double lowSupportFactor) {
            this.lowSupportFactor = lowSupportFactor;
        }

        public double getHistoryBoost() {
            return historyBoost;
        }

        public void setHistoryBoost(double historyBoost) {
            this.historyBoost = historyBoost;
        }

        public int getHistoryCap() {
            return historyCap;
        }

        public void setHistoryCap(int historyCap) {
            this.historyCap = historyCap;
        }

        public Duration getHistoryLookback() {
            return historyLookback;
        }

        public void setHistoryLookback(Duration historyLookback) {
            this.historyLookback = historyLookback;
        }

        public Map<String, Double> getResourceCriticality() {
            return resourceCriticality;
        }

        public void setResourceCriticality(Map<String, Double> resourceCriticality) {
            this.resourceCriticality = resourceCriticality;
        }
    }

    public static class Weights {
        private double peak = 0.5;
        private double duration = 0.2;
        private double points = 0.3;

        public double getPeak() {
            return peak;
        }

        public void setPeak(double peak) {
            this.peak = peak;
        }

        public double getDuration() {
            return duration;
        }

        public void setDuration(double duration) {
            this.duration = duration;
        }

        public double getPoints() {
            return points;
        }

        public void setPoints(double points) {
            this.points = points;
        }
    }

    public static class CutPoints {
        private double critical = 0.8;
        private double high = 0.6;
        private double medium = 0.3;

        public double getCritical() {
            return critical;
        }

        public void setCritical(double critical) {
            this.critical = critical;
        }

        public double getHigh() {
            return high;
        }

        public void setHigh(double high) {
            this.high = high;
        }

        public double getMedium() {
            return medium;
        }

        public void setMedium(double medium) {
            this.medium = medium;
        }
    }

    public static class Detectors {
        private List<String> disabled = new ArrayList<>();

        /** method -> option name -> value, merged over each detector's defaults. */
        private Map<String, Map<String, Double>> options = new LinkedHashMap<>();

        public List<String> getDisabled() {
            return disabled;
        }

        public void setDisabled(List<String> disabled) {
            this.disabled = disabled;
        }

        public Map<String, Map<String, Double>> getOptions() {
            return options;
        }

        public void setOptions(Map<String, Map<String, Double>> options) {
            this.options = options;
        }
    }

    public static class Persistence {
        private String mode = "memory";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }
}
