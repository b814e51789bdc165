package com.vigil.service.core.repo;

import com.vigil.metric.model.StreamKey;
import com.vigil.service.core.event.AnomalyEvent;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/** Process-local event store; contents are lost on restart. */
public class InMemoryAnomalyEventRepository implements AnomalyEventRepository {

    private final Map<UUID, AnomalyEvent> events = new ConcurrentHashMap<>();

    @Override
    public void save(AnomalyEvent event) {
        events.put(event.getId(), event);
    }

    @Override
    public long countSince(StreamKey key, Instant since) {
        return events.values().stream()
                .filter(e -> e.streamKey().equals(key))
                .filter(e -> !e.getStartTime().isBefore(since))
                .count();
    }

    @Override
    public Set<UUID> findIdsStartedBetween(StreamKey key, Instant from, Instant to) {
        return events.values().stream()
                .filter(e -> e.streamKey().equals(key))
                .filter(e -> !e.getStartTime().isBefore(from) && e.getStartTime().isBefore(to))
                .map(AnomalyEvent::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public List<AnomalyEvent> findByStream(StreamKey key) {
        return events.values().stream()
                .filter(e -> e.streamKey().equals(key))
                .sorted(Comparator.comparing(AnomalyEvent::getStartTime))
                .collect(Collectors.toList());
    }
}
