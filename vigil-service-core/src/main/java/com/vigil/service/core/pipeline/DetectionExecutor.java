package com.vigil.service.core.pipeline;

import com.vigil.service.core.config.DetectionSettings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Fixed worker pool that runs per-series detection off the request thread. */
@Component
@Slf4j
@RequiredArgsConstructor
public class DetectionExecutor {

    private final DetectionSettings settings;

    private ExecutorService executor;
    private final AtomicInteger activeJobs = new AtomicInteger();

    @PostConstruct
    void start() {
        init(settings.pipeline().workers());
    }

    void init(int workers) {
        AtomicInteger threadIds = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread t = new Thread(runnable, "vigil-detect-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        executor = Executors.newFixedThreadPool(workers, threads);
        log.info("Detection executor started workers={}", workers);
    }

    @PreDestroy
    void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Detection executor did not drain in time; interrupting {} active jobs", activeJobs.get());
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    public <T> Future<T> submit(Callable<T> job) {
        if (executor == null) {
            throw new IllegalStateException("Detection executor is not started");
        }
        try {
            return executor.submit(() -> {
                activeJobs.incrementAndGet();
                try {
                    return job.call();
                } finally {
                    activeJobs.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Detection executor is shut down", e);
        }
    }

    int activeJobs() {
        return activeJobs.get();
    }
}
