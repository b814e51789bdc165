package com.vigil.service.core.health;

/** Reachability of whatever backs the event and history repositories. */
public interface StorageCheck {

    /** {@code memory} or {@code jdbc}, as configured by {@code vigil.persistence.mode}. */
    String mode();

    boolean usesDatabase();

    boolean isReachable();
}
