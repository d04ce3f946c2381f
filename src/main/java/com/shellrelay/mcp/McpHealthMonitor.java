package com.shellrelay.mcp;

import com.shellrelay.core.time.Cancellable;
import com.shellrelay.core.time.RelayScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs a liveness probe on a fixed interval until stopped.
 * <p>
 * The next probe is scheduled only after the current one returns, so probes never overlap.
 */
public class McpHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(McpHealthMonitor.class);

    private final RelayScheduler scheduler;
    private final Duration interval;
    private final Runnable probe;

    private boolean running;
    private Cancellable next;

    public McpHealthMonitor(RelayScheduler scheduler, Duration interval, Runnable probe) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("health check interval must be positive");
        }
        this.scheduler = scheduler;
        this.interval = interval;
        this.probe = probe;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduleNext();
        log.debug("Health monitor started (every {}ms)", interval.toMillis());
    }

    public synchronized void stop() {
        running = false;
        if (next != null) {
            next.cancel();
            next = null;
        }
    }

    public synchronized boolean isRunning() {
        return running;
    }

    private void tick() {
        synchronized (this) {
            if (!running) {
                return;
            }
            next = null;
        }
        try {
            probe.run();
        } catch (RuntimeException e) {
            log.warn("Health probe failed: {}", e.getMessage(), e);
        }
        synchronized (this) {
            if (running && next == null) {
                scheduleNext();
            }
        }
    }

    private void scheduleNext() {
        next = scheduler.schedule(interval, this::tick);
    }
}
