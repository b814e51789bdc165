package com.vigil.service.core.repo;

import com.vigil.metric.model.StreamKey;
import java.util.List;

public interface DetectionHistoryRepository {

    void record(DetectionHistoryEntry entry);

    /** Most recent runs first. */
    List<DetectionHistoryEntry> findRecent(StreamKey key, int limit);
}
