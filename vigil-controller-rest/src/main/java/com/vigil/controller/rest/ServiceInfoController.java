package com.vigil.controller.rest;

import com.vigil.api.dto.HealthResponse;
import com.vigil.api.dto.ServiceInfo;
import com.vigil.service.core.health.HealthReport;
import com.vigil.service.core.health.ServiceHealth;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ServiceInfoController {

    private final ServiceHealth health;
    private final String serviceName;
    private final String version;

    public ServiceInfoController(
            ServiceHealth health,
            @Value("${spring.application.name:vigil}") String serviceName,
            @Value("${vigil.version:0.1.0}") String version) {
        this.health = health;
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping(path = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public ServiceInfo root() {
        return new ServiceInfo(serviceName, version, "/health", "/api/methods", "/api/detect");
    }

    /** Always 200 while the process serves requests; an unreachable database reports {@code degraded}. */
    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public HealthResponse health() {
        HealthReport report = health.report();
        double uptimeSeconds = Math.round(report.uptime().toMillis() / 10.0) / 100.0;
        return new HealthResponse(
                report.status().wireValue(), version, uptimeSeconds, report.storage(), report.databaseConnected());
    }
}
