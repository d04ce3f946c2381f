package com.shellrelay.mcp.transport;

import com.shellrelay.core.error.ErrorKind;
import com.shellrelay.mcp.McpException;

/**
 * Failure of the child process transport.
 */
public class TransportException extends McpException {

    public enum Reason { SPAWN_FAILED, NOT_RUNNING, WRITE_FAILED }

    private final Reason reason;

    public TransportException(Reason reason, String message) {
        super(ErrorKind.CONNECTION, message);
        this.reason = reason;
    }

    public TransportException(Reason reason, String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String userMessage() {
        return reason == Reason.SPAWN_FAILED ? "MCP server process failed to start." : null;
    }

    @Override
    public String suggestion() {
        if (reason == Reason.SPAWN_FAILED) {
            return "Check that the MCP server executable exists and the configuration is correct"
                    + " (shellrelay.mcp.executable, args, container-name).";
        }
        return null;
    }
}
