package com.shellrelay.core.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link RelayScheduler} backed by a {@link ScheduledExecutorService}.
 * <p>
 * Owns its executor when created through {@link #create(int)}; {@link #close()}
 * shuts that executor down.
 */
public final class ScheduledExecutorRelayScheduler implements RelayScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorRelayScheduler.class);

    private final ScheduledExecutorService executor;

    public ScheduledExecutorRelayScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Creates a scheduler with its own pool of daemon threads.
     */
    public static ScheduledExecutorRelayScheduler create(int threads) {
        var counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "shellrelay-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new ScheduledExecutorRelayScheduler(Executors.newScheduledThreadPool(threads, factory));
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(task, "task");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        ScheduledFuture<?> future = executor.schedule(() -> runLogged(task),
                delay.toNanos(), TimeUnit.NANOSECONDS);
        // never interrupt a task that already started
        return () -> future.cancel(false);
    }

    private static void runLogged(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Scheduled task failed", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
