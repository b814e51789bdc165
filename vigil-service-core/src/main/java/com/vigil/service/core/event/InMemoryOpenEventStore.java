package com.vigil.service.core.event;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.vigil.metric.model.StreamKey;
import com.vigil.service.core.config.DetectionSettings;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Caffeine-backed open-event store. Entries expire {@code vigil.grouping.retention} after their last
 * write. Each stream key gets its own {@link ReentrantLock}, which only exists while some thread holds
 * or waits for it.
 */
@Component
@Slf4j
public class InMemoryOpenEventStore implements OpenEventStore {

    private final Cache<StreamKey, AnomalyEvent> recent;
    private final ConcurrentMap<StreamKey, StreamLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public InMemoryOpenEventStore(DetectionSettings settings) {
        this(settings.grouping().retention(), Ticker.systemTicker());
    }

    InMemoryOpenEventStore(Duration retention, Ticker ticker) {
        this.recent = Caffeine.newBuilder().expireAfterWrite(retention).ticker(ticker).build();
        log.info("Open event store initialized retention={}", retention);
    }

    @Override
    public Optional<AnomalyEvent> latest(StreamKey key) {
        return Optional.ofNullable(recent.getIfPresent(key));
    }

    @Override
    public void put(StreamKey key, AnomalyEvent event) {
        if (!key.equals(event.streamKey())) {
            throw new IllegalArgumentException("event " + event.getId() + " does not belong to stream " + key);
        }
        recent.put(key, event);
    }

    @Override
    public <T> T withLock(StreamKey key, Supplier<T> work) {
        StreamLock held = locks.compute(key, (k, existing) -> (existing == null ? new StreamLock() : existing).acquire());
        held.lock.lock();
        try {
            return work.get();
        } finally {
            held.lock.unlock();
            locks.computeIfPresent(key, (k, existing) -> existing.release() == 0 ? null : existing);
        }
    }

    long size() {
        recent.cleanUp();
        return recent.estimatedSize();
    }

    int lockedStreams() {
        return locks.size();
    }

    /** Holder count is only touched inside map compute calls for its key. */
    private static final class StreamLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;

        StreamLock acquire() {
            holders++;
            return this;
        }

        int release() {
            return --holders;
        }
    }
}
