package com.shellrelay.core.time;

/**
 * Monotonic tick source used for elapsed-time measurements.
 * Wall-clock time ({@code Instant.now()}) is only used for event timestamps.
 */
@FunctionalInterface
public interface MonotonicClock {

    long nowNanos();

    default long elapsedMillisSince(long startNanos) {
        return (nowNanos() - startNanos) / 1_000_000L;
    }
}
