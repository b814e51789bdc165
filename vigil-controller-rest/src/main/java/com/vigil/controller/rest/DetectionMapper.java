package com.vigil.controller.rest;

import com.vigil.api.dto.DetectionRequest;
import com.vigil.api.dto.DetectionRequest.PointInput;
import com.vigil.api.dto.DetectionRequest.SeriesInput;
import com.vigil.api.dto.DetectionResponse;
import com.vigil.api.dto.DetectionResponse.EventResult;
import com.vigil.api.dto.DetectionResponse.PointResult;
import com.vigil.api.dto.DetectionResponse.SeriesResult;
import com.vigil.api.dto.HistoryEntryInfo;
import com.vigil.api.dto.MethodInfo;
import com.vigil.metric.model.MetricPoint;
import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.detect.DetectionResult;
import com.vigil.service.core.detect.DetectorDescriptor;
import com.vigil.service.core.error.InvalidInputException;
import com.vigil.service.core.event.AnomalyEvent;
import com.vigil.service.core.pipeline.BatchDetectionResult;
import com.vigil.service.core.pipeline.DetectionBatch;
import com.vigil.service.core.pipeline.SeriesDetection;
import com.vigil.service.core.repo.DetectionHistoryEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Translates between the wire DTOs and the detection pipeline's types. */
final class DetectionMapper {

    private DetectionMapper() {}

    static DetectionBatch toBatch(DetectionRequest request) {
        if (request == null) {
            throw new InvalidInputException("request body is required");
        }
        if (request.series() == null || request.series().isEmpty()) {
            throw new InvalidInputException("series must contain at least one entry");
        }
        Sensitivity sensitivity;
        try {
            sensitivity = Sensitivity.fromValue(request.sensitivity());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(e.getMessage() + " (expected low, medium or high)", e);
        }
        List<MetricSeries> series = new ArrayList<>(request.series().size());
        for (int i = 0; i < request.series().size(); i++) {
            series.add(toSeries(request.series().get(i), i));
        }
        return new DetectionBatch(series, request.method(), sensitivity);
    }

    private static MetricSeries toSeries(SeriesInput input, int index) {
        if (input == null) {
            throw new InvalidInputException(String.format("series[%d] is null", index));
        }
        if (input.resourceId() == null || input.metricName() == null) {
            throw new InvalidInputException(String.format("series[%d]: resource_id and metric_name are required", index));
        }
        if (input.data() == null) {
            throw new InvalidInputException(String.format("series[%d]: data is required", index));
        }
        List<MetricPoint> points = new ArrayList<>(input.data().size());
        for (int j = 0; j < input.data().size(); j++) {
            PointInput point = input.data().get(j);
            if (point == null || point.timestamp() == null || point.value() == null) {
                throw new InvalidInputException(
                        String.format("series[%d].data[%d]: timestamp and value are required", index, j));
            }
            points.add(MetricPoint.of(point.timestamp(), point.value()));
        }
        return new MetricSeries(input.resourceId(), input.metricName(), points);
    }

    static DetectionResponse toResponse(BatchDetectionResult result) {
        List<SeriesResult> results = result.results().stream().map(DetectionMapper::toSeriesResult).toList();
        List<EventResult> ranked = result.rankedEvents().stream().map(DetectionMapper::toEventResult).toList();
        return new DetectionResponse(
                result.method(),
                result.sensitivity().configValue(),
                result.totalSeries(),
                result.totalAnomalies(),
                result.totalEvents(),
                results,
                ranked);
    }

    private static SeriesResult toSeriesResult(SeriesDetection detection) {
        MetricSeries series = detection.series();
        List<PointResult> points = null;
        if (detection.result() != null) {
            DetectionResult r = detection.result();
            points = new ArrayList<>(r.size());
            for (int i = 0; i < r.size(); i++) {
                points.add(new PointResult(series.timestamp(i), series.value(i), r.score(i), r.isAnomaly(i), r.reason(i)));
            }
        }
        return new SeriesResult(
                series.resourceId(),
                series.metricName(),
                detection.status().name().toLowerCase(Locale.ROOT),
                detection.errorCode(),
                detection.error(),
                detection.anomalyCount(),
                series.size(),
                detection.anomalyPercentage(),
                detection.detectionTimeMs(),
                points,
                detection.events().stream().map(DetectionMapper::toEventResult).toList());
    }

    static EventResult toEventResult(AnomalyEvent event) {
        return new EventResult(
                event.getId(),
                event.getResourceId(),
                event.getMetricName(),
                event.getStartTime(),
                event.getEndTime(),
                event.getDuration().toMillis() / 1000.0,
                event.getPeakScore(),
                event.getPeakTime(),
                event.getPeakValue(),
                event.getAverageScore(),
                event.getPointCount(),
                event.getContributingMethod(),
                event.getPriority() == null ? null : event.getPriority().name().toLowerCase(Locale.ROOT),
                event.getPriorityScore());
    }

    static MethodInfo toMethodInfo(DetectorDescriptor descriptor) {
        return new MethodInfo(
                descriptor.name(),
                descriptor.category().label(),
                descriptor.description(),
                descriptor.bestFor(),
                descriptor.minimumPoints(),
                descriptor.available(),
                descriptor.unavailableReason());
    }

    static HistoryEntryInfo toHistoryEntry(DetectionHistoryEntry entry) {
        return new HistoryEntryInfo(
                entry.resourceId(),
                entry.metricName(),
                entry.method(),
                entry.sensitivity().configValue(),
                entry.totalPoints(),
                entry.anomalyCount(),
                entry.anomalyPercentage(),
                entry.detectionTimeMs(),
                entry.createdAt());
    }
}
