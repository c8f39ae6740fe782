package io.ringdb.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Debounce timer for one block: every {@link #reset} cancels the pending flush and arms a new one,
 * so a burst of writes ends in a single flush.
 */
final class FlushScheduler {
    private static final Logger logger = LoggerFactory.getLogger(FlushScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final String blockName;
    private final AtomicReference<ScheduledFuture<?>> pending;

    FlushScheduler(ScheduledExecutorService scheduler, String blockName) {
        this.scheduler = scheduler;
        this.blockName = blockName;
        this.pending = new AtomicReference<>();
    }

    void reset(Duration delay, Runnable flush) {
        ScheduledFuture<?> task = scheduler.schedule(
            () -> {
                try {
                    flush.run();
                } catch (Exception e) {
                    logger.error("Scheduled flush of block {} failed", blockName, e);
                }
            },
            delay.toMillis(),
            TimeUnit.MILLISECONDS
        );

        ScheduledFuture<?> previous = pending.getAndSet(task);
        if (previous != null && !previous.isDone()) {
            previous.cancel(false);
        }
        logger.debug("Flush of block {} scheduled in {} ms", blockName, delay.toMillis());
    }

    void cancel() {
        ScheduledFuture<?> task = pending.getAndSet(null);
        if (task != null && !task.isDone()) {
            task.cancel(false);
        }
    }
}
