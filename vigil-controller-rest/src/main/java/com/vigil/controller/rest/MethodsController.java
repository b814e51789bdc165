package com.vigil.controller.rest;

import com.vigil.api.dto.MethodInfo;
import com.vigil.service.core.detect.DetectorRegistry;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class MethodsController {

    private final DetectorRegistry registry;

    public MethodsController(DetectorRegistry registry) {
        this.registry = registry;
    }

    /** Every registered method, including unavailable ones with their reason. */
    @GetMapping("/methods")
    public List<MethodInfo> listMethods() {
        return registry.descriptors().stream().map(DetectionMapper::toMethodInfo).toList();
    }
}
