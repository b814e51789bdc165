package com.vigil.service.core.event;

/** Ordinal alerting bucket; declaration order is ascending urgency. */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
