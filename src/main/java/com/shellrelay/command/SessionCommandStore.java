package com.shellrelay.command;

import java.util.List;
import java.util.Optional;

/**
 * Per-session command history and in-progress command, owned by the
 * {@link CommandExecutionManager}.
 */
public interface SessionCommandStore {

    /** Occurrences of exactly {@code command} in the session's history. */
    int countOccurrences(String sessionId, String command);

    /** Appends to the history, evicting the oldest entries beyond the limit. */
    void appendHistory(String sessionId, String command);

    /** Oldest first; empty for unknown sessions. */
    List<String> history(String sessionId);

    /**
     * Records {@code command} as in progress unless the session already has one.
     *
     * @return {@code false} if another command is pending for the session
     */
    boolean beginCommand(String sessionId, PendingCommand command);

    Optional<PendingCommand> pendingCommand(String sessionId);

    /** No-op unless the session's pending command is still the one with {@code commandId}. */
    void updateRetryCount(String sessionId, String commandId, int retryCount);

    /**
     * Clears the pending command if it is still the one with {@code commandId}. A command
     * started after {@link #clearSession} is left alone.
     */
    void endCommand(String sessionId, String commandId);

    /** Drops both history and any pending command. */
    void clearSession(String sessionId);
}
