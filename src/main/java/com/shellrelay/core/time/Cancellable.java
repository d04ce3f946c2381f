package com.shellrelay.core.time;

/**
 * Cancellation handle for a task scheduled on a {@link RelayScheduler}.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Attempts to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already ran
     *         or was cancelled before
     */
    boolean cancel();
}
