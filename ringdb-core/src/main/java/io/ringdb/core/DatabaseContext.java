package io.ringdb.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Services shared by every ring and block of one database. Created by {@link Database} and closed with it.
 */
public final class DatabaseContext implements AutoCloseable {

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final DatabaseConfig config;
    private final ScheduledExecutorService scheduler;

    DatabaseContext(DatabaseConfig config, ScheduledExecutorService scheduler) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    public static DatabaseContext create(DatabaseConfig config) {
        return new DatabaseContext(config, Executors.newSingleThreadScheduledExecutor(daemonThreads("ringdb-flush")));
    }

    public Duration flushDelay() {
        return config.flushDelay();
    }

    public ScheduledExecutorService scheduler() {
        return scheduler;
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
