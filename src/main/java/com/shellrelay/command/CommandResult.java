package com.shellrelay.command;

import com.shellrelay.core.error.ErrorInfo;

/**
 * Outcome of {@link CommandExecutionManager#execute}. Failures are reported here,
 * never thrown.
 *
 * @param success    the command completed without a tool error
 * @param output     text output of the last attempt that produced any
 * @param exitCode   exit code reported by the tool, or -1 when no attempt returned a result
 * @param attempts   attempts made (0 when rejected by loop detection)
 * @param durationMs wall time spent, including retry delays
 * @param error      classified failure; {@code null} on success
 */
public record CommandResult(
    boolean success,
    String output,
    int exitCode,
    int attempts,
    long durationMs,
    ErrorInfo error
) {

    public static CommandResult success(String output, int exitCode, int attempts, long durationMs) {
        return new CommandResult(true, output, exitCode, attempts, durationMs, null);
    }

    public static CommandResult failure(ErrorInfo error, String output, int exitCode, int attempts, long durationMs) {
        return new CommandResult(false, output != null ? output : "", exitCode, attempts, durationMs, error);
    }
}
