package com.vigil.service.core.health;

import java.util.Locale;

public enum HealthStatus {
    HEALTHY,
    DEGRADED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
