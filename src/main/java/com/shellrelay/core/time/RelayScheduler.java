package com.shellrelay.core.time;

import java.time.Duration;

/**
 * Timer surface for request deadlines, reconnect backoff and health probing.
 * <p>
 * Production code uses {@link ScheduledExecutorRelayScheduler}; tests drive a
 * deterministic implementation so backoff and timeout behaviour can be asserted
 * without waiting on the wall clock.
 */
public interface RelayScheduler {

    /**
     * Runs {@code task} once, no earlier than {@code delay} from now.
     *
     * @param delay non-negative delay
     * @param task  the task to run
     * @return a handle that cancels the task if it has not run yet
     */
    Cancellable schedule(Duration delay, Runnable task);
}
