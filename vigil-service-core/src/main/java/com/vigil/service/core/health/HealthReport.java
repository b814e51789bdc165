package com.vigil.service.core.health;

import java.time.Duration;

/** {@code databaseConnected} is null when no database is configured. */
public record HealthReport(HealthStatus status, Duration uptime, String storage, Boolean databaseConnected) {}
