package com.vigil.service.core.priority;

import com.vigil.service.core.config.DetectionSettings;
import com.vigil.service.core.config.DetectionSettings.PrioritySettings;
import com.vigil.service.core.event.AnomalyEvent;
import com.vigil.service.core.event.Priority;
import com.vigil.service.core.repo.AnomalyEventRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assigns each event a composite priority in [0, 1] and a {@link Priority} bucket.
 *
 * <pre>
 * base      = (wPeak * peak + wDur * min(1, duration / durationHorizon) + wPts * min(1, points / pointsHorizon))
 *             / (wPeak + wDur + wPts)
 * composite = clamp(criticality * (1 + boost * min(prior, cap)) * support * base)
 * </pre>
 *
 * {@code support} is {@code lowSupportFactor} for events with fewer than {@code minSupport} points.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PriorityScorer {

    /** Composite desc, then peak desc, then duration desc, then start asc. */
    public static final Comparator<AnomalyEvent> RANKING = Comparator.<AnomalyEvent>comparingDouble(PriorityScorer::compositeOf)
            .reversed()
            .thenComparing(Comparator.<AnomalyEvent>comparingDouble(AnomalyEvent::getPeakScore).reversed())
            .thenComparing(Comparator.<AnomalyEvent, Duration>comparing(AnomalyEvent::getDuration).reversed())
            .thenComparing(AnomalyEvent::getStartTime);

    private final AnomalyEventRepository repository;
    private final DetectionSettings settings;

    /**
     * Scores the events produced by one grouping pass over a single stream. Earlier events of the
     * same pass count towards the history of later ones, in addition to what the repository holds.
     */
    public List<AnomalyEvent> score(List<AnomalyEvent> events) {
        PrioritySettings p = settings.priority();
        List<AnomalyEvent> scored = new ArrayList<>(events.size());
        for (AnomalyEvent event : events) {
            Instant from = event.getStartTime().minus(p.historyLookback());
            Set<UUID> prior = new HashSet<>(
                    repository.findIdsStartedBetween(event.streamKey(), from, event.getStartTime()));
            for (AnomalyEvent other : events) {
                if (!other.getStartTime().isBefore(from) && other.getStartTime().isBefore(event.getStartTime())) {
                    prior.add(other.getId());
                }
            }
            prior.remove(event.getId());

            double composite = composite(event, prior.size());
            Priority bucket = bucket(composite);
            scored.add(event.withPriority(composite, bucket));
            log.debug(
                    "Scored event id={} stream={} points={} peak={} prior={} composite={} priority={}",
                    event.getId(),
                    event.streamKey(),
                    event.getPointCount(),
                    event.getPeakScore(),
                    prior.size(),
                    composite,
                    bucket);
        }
        return scored;
    }

    public double composite(AnomalyEvent event, int priorEvents) {
        PrioritySettings p = settings.priority();
        double duration = Math.min(1.0, (double) event.getDuration().toMillis() / p.durationHorizon().toMillis());
        double points = Math.min(1.0, (double) event.getPointCount() / p.pointsHorizon());
        double peak = clamp(event.getPeakScore());
        double weightSum = p.peakWeight() + p.durationWeight() + p.pointsWeight();
        double base = (p.peakWeight() * peak + p.durationWeight() * duration + p.pointsWeight() * points) / weightSum;

        double criticality = p.criticalityOf(event.getResourceId());
        double history = 1.0 + p.historyBoost() * Math.min(priorEvents, p.historyCap());
        double support = event.getPointCount() < p.minSupport() ? p.lowSupportFactor() : 1.0;
        return clamp(criticality * history * support * base);
    }

    public Priority bucket(double composite) {
        PrioritySettings p = settings.priority();
        if (composite >= p.criticalCut()) {
            return Priority.CRITICAL;
        }
        if (composite >= p.highCut()) {
            return Priority.HIGH;
        }
        if (composite >= p.mediumCut()) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }

    /** A new list in {@link #RANKING} order. */
    public static List<AnomalyEvent> rank(Collection<AnomalyEvent> events) {
        List<AnomalyEvent> ranked = new ArrayList<>(events);
        ranked.sort(RANKING);
        return ranked;
    }

    private static double compositeOf(AnomalyEvent event) {
        Double score = event.getPriorityScore();
        return score == null ? 0.0 : score;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
