package io.gigdraft.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drains the store worker pool when the Spring container stops.
 */
public class GigDraftLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(GigDraftLifecycle.class);

    private final ExecutorService executor;
    private final Duration grace;
    private volatile boolean running = false;

    public GigDraftLifecycle(ExecutorService executor, Duration grace) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.grace = Objects.requireNonNull(grace, "grace must not be null");
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;

        log.info("gigdraft store pool stopping...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("gigdraft store pool did not drain within {}; forcing shutdown", grace);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("gigdraft store pool stopped.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
