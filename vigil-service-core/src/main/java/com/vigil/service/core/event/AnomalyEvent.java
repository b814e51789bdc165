package com.vigil.service.core.event;

import com.vigil.metric.model.StreamKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A run of anomalous points on one stream, close enough in time to be treated as one incident.
 *
 * <p>Instances are immutable; {@link #extend}, {@link #replay} and {@link #withPriority} return a
 * copy with the same id. The id is a name-based UUID of (resource, metric, start time), so the
 * same input always produces the same event.
 */
public final class AnomalyEvent {

    private final UUID id;
    private final String resourceId;
    private final String metricName;
    private final Instant startTime;
    private final Instant endTime;
    private final double peakScore;
    private final Instant peakTime;
    private final double peakValue;
    private final double averageScore;
    private final int pointCount;
    private final String contributingMethod;

    // Priority (absent until scored)
    private final Double priorityScore;
    private final Priority priority;

    private AnomalyEvent(Builder b) {
        this.resourceId = Objects.requireNonNull(b.resourceId, "resourceId");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName");
        this.startTime = Objects.requireNonNull(b.startTime, "startTime");
        this.endTime = Objects.requireNonNull(b.endTime, "endTime");
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime " + endTime + " is before startTime " + startTime);
        }
        if (b.pointCount < 1) {
            throw new IllegalArgumentException("an event holds at least one point");
        }
        this.id = b.id != null ? b.id : idFor(resourceId, metricName, startTime);
        this.peakScore = b.peakScore;
        this.peakTime = Objects.requireNonNull(b.peakTime, "peakTime");
        this.peakValue = b.peakValue;
        this.averageScore = b.averageScore;
        this.pointCount = b.pointCount;
        this.contributingMethod = Objects.requireNonNull(b.contributingMethod, "contributingMethod");
        this.priorityScore = b.priorityScore;
        this.priority = b.priority;
    }

    public static UUID idFor(String resourceId, String metricName, Instant startTime) {
        String name = resourceId + '\u0000' + metricName + '\u0000' + startTime;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    /** A fresh single-point event. */
    public static AnomalyEvent open(StreamKey key, String method, FlaggedPoint point) {
        return builder()
                .resourceId(key.resourceId())
                .metricName(key.metricName())
                .startTime(point.timestamp())
                .endTime(point.timestamp())
                .peakScore(point.score())
                .peakTime(point.timestamp())
                .peakValue(point.value())
                .averageScore(point.score())
                .pointCount(1)
                .contributingMethod(method)
                .build();
    }

    /** Appends a point after {@link #getEndTime()}; the priority is cleared and must be recomputed. */
    public AnomalyEvent extend(FlaggedPoint point) {
        if (!point.timestamp().isAfter(endTime)) {
            throw new IllegalArgumentException(
                    "point " + point.timestamp() + " does not follow event end " + endTime);
        }
        Builder b = toBuilder()
                .endTime(point.timestamp())
                .pointCount(pointCount + 1)
                .averageScore((averageScore * pointCount + point.score()) / (pointCount + 1))
                .priorityScore(null)
                .priority(null);
        if (point.score() > peakScore) {
            b.peakScore(point.score()).peakTime(point.timestamp()).peakValue(point.value());
        }
        return b.build();
    }

    /**
     * Re-observation of a point already inside the event's range. Only the peak can move; counts
     * and averages are untouched so re-ingesting the same data is idempotent.
     */
    public AnomalyEvent replay(FlaggedPoint point) {
        if (point.score() <= peakScore) {
            return this;
        }
        return toBuilder()
                .peakScore(point.score())
                .peakTime(point.timestamp())
                .peakValue(point.value())
                .priorityScore(null)
                .priority(null)
                .build();
    }

    public AnomalyEvent withPriority(double score, Priority bucket) {
        return toBuilder().priorityScore(score).priority(bucket).build();
    }

    public boolean covers(Instant timestamp) {
        return !timestamp.isBefore(startTime) && !timestamp.isAfter(endTime);
    }

    public StreamKey streamKey() {
        return new StreamKey(resourceId, metricName);
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    public UUID getId() {
        return id;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getMetricName() {
        return metricName;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public double getPeakScore() {
        return peakScore;
    }

    public Instant getPeakTime() {
        return peakTime;
    }

    public double getPeakValue() {
        return peakValue;
    }

    public double getAverageScore() {
        return averageScore;
    }

    public int getPointCount() {
        return pointCount;
    }

    public String getContributingMethod() {
        return contributingMethod;
    }

    public Double getPriorityScore() {
        return priorityScore;
    }

    public Priority getPriority() {
        return priority;
    }

    public boolean isScored() {
        return priority != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnomalyEvent that)) return false;
        return Double.compare(that.peakScore, peakScore) == 0
                && Double.compare(that.peakValue, peakValue) == 0
                && Double.compare(that.averageScore, averageScore) == 0
                && pointCount == that.pointCount
                && id.equals(that.id)
                && startTime.equals(that.startTime)
                && endTime.equals(that.endTime)
                && peakTime.equals(that.peakTime)
                && contributingMethod.equals(that.contributingMethod)
                && Objects.equals(priorityScore, that.priorityScore)
                && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, startTime, endTime, peakScore, pointCount, priority);
    }

    @Override
    public String toString() {
        return "AnomalyEvent{"
                + "id=" + id
                + ", stream=" + resourceId + "/" + metricName
                + ", start=" + startTime
                + ", end=" + endTime
                + ", points=" + pointCount
                + ", peak=" + peakScore
                + ", priority=" + priority
                + '}';
    }

    // ---------- Builder

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .resourceId(resourceId)
                .metricName(metricName)
                .startTime(startTime)
                .endTime(endTime)
                .peakScore(peakScore)
                .peakTime(peakTime)
                .peakValue(peakValue)
                .averageScore(averageScore)
                .pointCount(pointCount)
                .contributingMethod(contributingMethod)
                .priorityScore(priorityScore)
                .priority(priority);
    }

    public static final class Builder {
        private UUID id;
        private String resourceId;
        private String metricName;
        private Instant startTime;
        private Instant endTime;
        private double peakScore;
        private Instant peakTime;
        private double peakValue;
        private double averageScore;
        private int pointCount;
        private String contributingMethod;
        private Double priorityScore;
        private Priority priority;

        private Builder() {}

        /** Leave unset to derive the id from (resource, metric, start time). */
        public Builder id(UUID v) {
            this.id = v;
            return this;
        }

        public Builder resourceId(String v) {
            this.resourceId = v;
            return this;
        }

        public Builder metricName(String v) {
            this.metricName = v;
            return this;
        }

        public Builder startTime(Instant v) {
            this.startTime = v;
            return this;
        }

        public Builder endTime(Instant v) {
            this.endTime = v;
            return this;
        }

        public Builder peakScore(double v) {
            this.peakScore = v;
            return this;
        }

        public Builder peakTime(Instant v) {
            this.peakTime = v;
            return this;
        }

        public Builder peakValue(double v) {
            this.peakValue = v;
            return this;
        }

        public Builder averageScore(double v) {
            this.averageScore = v;
            return this;
        }

        public Builder pointCount(int v) {
            this.pointCount = v;
            return this;
        }

        public Builder contributingMethod(String v) {
            this.contributingMethod = v;
            return this;
        }

        public Builder priorityScore(Double v) {
            this.priorityScore = v;
            return this;
        }

        public Builder priority(Priority v) {
            this.priority = v;
            return this;
        }

        public AnomalyEvent build() {
            return new AnomalyEvent(this);
        }
    }
}
