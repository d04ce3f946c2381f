package com.shellrelay.core.time;

import java.time.Duration;

/**
 * Blocking pause between command attempts.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
