package com.shellrelay.core.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 */
public final class SystemMonotonicClock implements MonotonicClock {

    public static final SystemMonotonicClock INSTANCE = new SystemMonotonicClock();

    private SystemMonotonicClock() {}

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
