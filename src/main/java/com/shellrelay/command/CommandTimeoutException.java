package com.shellrelay.command;

import com.shellrelay.core.error.ErrorKind;
import com.shellrelay.mcp.McpException;

import java.time.Duration;

/**
 * A single attempt exceeded the per-attempt timeout.
 */
public class CommandTimeoutException extends McpException {

    public CommandTimeoutException(String command, Duration timeout) {
        super(ErrorKind.TIMEOUT, "Command timed out after " + timeout.toMillis() + "ms: " + command);
    }
}
