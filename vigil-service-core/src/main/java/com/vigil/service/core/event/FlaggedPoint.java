package com.vigil.service.core.event;

import com.vigil.service.core.detect.DetectionResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One anomalous observation handed to the grouper. */
public record FlaggedPoint(Instant timestamp, double value, double score) {

    public FlaggedPoint {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /** Flagged points of a result, in series (ascending time) order. */
    public static List<FlaggedPoint> from(DetectionResult result) {
        List<FlaggedPoint> points = new ArrayList<>(result.anomalyCount());
        for (int i : result.anomalyIndices()) {
            points.add(new FlaggedPoint(result.series().timestamp(i), result.series().value(i), result.score(i)));
        }
        return points;
    }
}
