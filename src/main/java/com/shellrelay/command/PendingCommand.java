package com.shellrelay.command;

import java.time.Instant;
import java.util.UUID;

/**
 * The command a session is currently executing.
 *
 * @param id         identifies this execution; the store only lets its owner update or end it
 * @param command    the command text
 * @param startTime  when execution began
 * @param retryCount retries performed so far
 */
public record PendingCommand(String id, String command, Instant startTime, int retryCount) {

    public static PendingCommand start(String command) {
        return new PendingCommand(UUID.randomUUID().toString(), command, Instant.now(), 0);
    }

    public PendingCommand withRetryCount(int retryCount) {
        return new PendingCommand(id, command, startTime, retryCount);
    }
}
