package com.vigil.service.core.event;

import com.vigil.metric.model.StreamKey;
import com.vigil.service.core.config.DetectionSettings;
import com.vigil.service.core.detect.DetectionResult;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns per-point anomaly flags into events. Consecutive flagged points whose spacing does not
 * exceed {@code max_gap} share one event; a larger gap closes it.
 *
 * <p>The stream's most recent event lives in the {@link OpenEventStore}. A new ingestion extends it
 * when its first later point is within {@code max_gap} of the stored end; points inside the stored
 * range only refresh the peak; points before the stored start are grouped on their own and closed
 * before the stored event is touched. All of this runs under the stream's lock.
 *
 * <p>The store only moves forward once the caller has committed the grouped events. If the commit
 * throws, the stored event stays as it was and the next ingestion regroups from there.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventGrouper {

    private final OpenEventStore store;
    private final DetectionSettings settings;

    /**
     * Groups the flagged points of {@code result} and hands the events created or touched by this
     * ingestion, ordered by start time and without priorities, to {@code commit}. Whatever
     * {@code commit} returns is returned; the stream's stored event is updated after it returns.
     */
    public List<AnomalyEvent> group(DetectionResult result, UnaryOperator<List<AnomalyEvent>> commit) {
        List<FlaggedPoint> points = FlaggedPoint.from(result);
        if (points.isEmpty()) {
            return commit.apply(List.of());
        }
        StreamKey key = result.series().streamKey();
        Duration maxGap = settings.grouping().maxGapFor(result.series());
        return store.withLock(key, () -> {
            Merge merge = merge(key, result.method(), points, maxGap);
            List<AnomalyEvent> committed = commit.apply(merge.events());
            if (merge.latest() != null) {
                store.put(key, merge.latest());
            }
            return committed;
        });
    }

    private Merge merge(StreamKey key, String method, List<FlaggedPoint> points, Duration maxGap) {
        Optional<AnomalyEvent> latest = store.latest(key);
        AnomalyEvent stored = latest.orElse(null);
        boolean reachedStored = stored == null;

        List<AnomalyEvent> events = new ArrayList<>();
        AnomalyEvent current = null;
        boolean storedTouched = false;
        int replays = 0;
        for (FlaggedPoint point : points) {
            Instant ts = point.timestamp();
            if (!reachedStored && !ts.isBefore(stored.getStartTime())) {
                if (current != null) {
                    events.add(current);
                }
                current = stored;
                reachedStored = true;
            }
            if (current != null && current.covers(ts)) {
                current = current.replay(point);
                storedTouched = true;
                replays++;
                continue;
            }
            if (current == null || exceeds(current.getEndTime(), ts, maxGap)) {
                if (current != null && (current != stored || storedTouched)) {
                    events.add(current);
                }
                current = AnomalyEvent.open(key, method, point);
            } else {
                if (current == stored) {
                    storedTouched = true;
                }
                current = current.extend(point);
            }
        }
        if (current != stored || storedTouched) {
            events.add(current);
        }

        log.debug(
                "Grouped stream={} points={} events={} replays={} maxGap={} storedTouched={}",
                key,
                points.size(),
                events.size(),
                replays,
                maxGap,
                storedTouched);
        return new Merge(events, reachedStored ? current : null);
    }

    /** {@code latest} is the stream's new stored event, or null when the stored one is untouched. */
    private record Merge(List<AnomalyEvent> events, AnomalyEvent latest) {}

    static boolean exceeds(Instant end, Instant next, Duration maxGap) {
        return Duration.between(end, next).compareTo(maxGap) > 0;
    }
}
