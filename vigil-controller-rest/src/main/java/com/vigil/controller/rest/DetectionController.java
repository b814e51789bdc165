package com.vigil.controller.rest;

import com.vigil.api.dto.DetectionRequest;
import com.vigil.api.dto.DetectionResponse;
import com.vigil.service.core.pipeline.BatchDetectionResult;
import com.vigil.service.core.pipeline.DetectionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
public class DetectionController {

    private final DetectionPipeline pipeline;

    @PostMapping(path = "/detect", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DetectionResponse detect(@RequestBody DetectionRequest request) {
        BatchDetectionResult result = pipeline.detect(DetectionMapper.toBatch(request));
        log.debug("Detect request served method={} series={} events={}", result.method(), result.totalSeries(), result.totalEvents());
        return DetectionMapper.toResponse(result);
    }
}
