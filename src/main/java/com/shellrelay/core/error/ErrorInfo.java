package com.shellrelay.core.error;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable description of a classified failure, ready to be rendered to a user.
 *
 * @param kind       failure category
 * @param message    human-readable message
 * @param detail     the original low-level message (may be empty)
 * @param retryable  whether retrying the same operation may succeed
 * @param suggestion what the user or operator should try next
 * @param details    structured context (e.g. command, observed count)
 * @param timestamp  when the failure was classified
 */
public record ErrorInfo(
    ErrorKind kind,
    String message,
    String detail,
    boolean retryable,
    String suggestion,
    Map<String, Object> details,
    Instant timestamp
) {

    public ErrorInfo {
        detail = detail != null ? detail : "";
        details = details != null ? Map.copyOf(details) : Map.of();
    }
}
