package com.vigil.service.core.repo;

import com.vigil.metric.model.StreamKey;
import com.vigil.service.core.event.AnomalyEvent;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/** Durable store of scored anomaly events. */
public interface AnomalyEventRepository {

    /** Inserts the event or replaces the stored event with the same id. */
    void save(AnomalyEvent event);

    /** Number of the stream's events starting at or after {@code since}. */
    long countSince(StreamKey key, Instant since);

    /** Ids of the stream's events whose start lies in {@code [from, to)}. */
    Set<UUID> findIdsStartedBetween(StreamKey key, Instant from, Instant to);

    /** The stream's events ordered by start time. */
    List<AnomalyEvent> findByStream(StreamKey key);
}
