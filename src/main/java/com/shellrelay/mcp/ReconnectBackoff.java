package com.shellrelay.mcp;

import java.time.Duration;

/**
 * Exponential reconnect delay: {@code base * 2^(attempt-1)}, capped at {@code max}.
 */
public final class ReconnectBackoff {

    private final long baseMs;
    private final long maxMs;

    public ReconnectBackoff(long baseMs, long maxMs) {
        if (baseMs <= 0) {
            throw new IllegalArgumentException("base delay must be positive");
        }
        this.baseMs = baseMs;
        this.maxMs = Math.max(baseMs, maxMs);
    }

    /**
     * @param attempt 1-based reconnect attempt number
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        int shift = Math.min(attempt - 1, 30);
        long delay = baseMs << shift;
        if (delay <= 0 || delay > maxMs) {
            delay = maxMs;
        }
        return Duration.ofMillis(delay);
    }
}
