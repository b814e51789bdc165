package com.vigil.service.core.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Liveness summary for the service: uptime since this bean was created and whether storage answers.
 * An unreachable database degrades the service rather than failing it; detection still runs.
 */
@Service
@Slf4j
public class ServiceHealth {

    private final StorageCheck storage;
    private final Clock clock;
    private final Instant startedAt;

    public ServiceHealth(StorageCheck storage, Clock clock) {
        this.storage = storage;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public HealthReport report() {
        boolean reachable = storage.isReachable();
        HealthStatus status = reachable ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
        if (status == HealthStatus.DEGRADED) {
            log.warn("Service degraded storage={}", storage.mode());
        }
        return new HealthReport(
                status,
                Duration.between(startedAt, clock.instant()),
                storage.mode(),
                storage.usesDatabase() ? reachable : null);
    }
}
