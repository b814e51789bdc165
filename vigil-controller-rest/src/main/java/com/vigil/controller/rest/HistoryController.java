package com.vigil.controller.rest;

import com.vigil.api.dto.HistoryEntryInfo;
import com.vigil.metric.model.StreamKey;
import com.vigil.service.core.error.InvalidInputException;
import com.vigil.service.core.repo.DetectionHistoryRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class HistoryController {

    static final int MAX_LIMIT = 100;

    private final DetectionHistoryRepository historyRepository;

    /** Recent detection runs over one stream, newest first. */
    @GetMapping("/history")
    public List<HistoryEntryInfo> recent(
            @RequestParam("resource_id") String resourceId,
            @RequestParam("metric_name") String metricName,
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidInputException("limit must be between 1 and " + MAX_LIMIT + " (got " + limit + ")");
        }
        if (resourceId.isBlank() || metricName.isBlank()) {
            throw new InvalidInputException("resource_id and metric_name must not be blank");
        }
        return historyRepository.findRecent(new StreamKey(resourceId, metricName), limit).stream()
                .map(DetectionMapper::toHistoryEntry)
                .toList();
    }
}
