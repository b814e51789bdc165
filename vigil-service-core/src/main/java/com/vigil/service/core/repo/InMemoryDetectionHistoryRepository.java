package com.vigil.service.core.repo;

import com.vigil.metric.model.StreamKey;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryDetectionHistoryRepository implements DetectionHistoryRepository {

    private final List<DetectionHistoryEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void record(DetectionHistoryEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<DetectionHistoryEntry> findRecent(StreamKey key, int limit) {
        List<DetectionHistoryEntry> matches = new ArrayList<>();
        for (int i = entries.size() - 1; i >= 0 && matches.size() < limit; i--) {
            DetectionHistoryEntry entry = entries.get(i);
            if (entry.resourceId().equals(key.resourceId()) && entry.metricName().equals(key.metricName())) {
                matches.add(entry);
            }
        }
        return matches;
    }
}
