package com.vigil.service.core.event;

import com.vigil.metric.model.StreamKey;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Most recent event per stream, kept for a bounded retention so later ingestions can extend it.
 * Mutations for one key must happen inside {@link #withLock}.
 */
public interface OpenEventStore {

    Optional<AnomalyEvent> latest(StreamKey key);

    void put(StreamKey key, AnomalyEvent event);

    /** Runs {@code work} while holding the key's writer lock; other keys proceed in parallel. */
    <T> T withLock(StreamKey key, Supplier<T> work);
}
