package com.shellrelay.mcp;

import com.shellrelay.core.error.ErrorKind;

/**
 * Raised for every request outstanding, or issued, once shutdown has begun.
 */
public class ShuttingDownException extends McpException {

    public ShuttingDownException() {
        super(ErrorKind.CONNECTION, "MCP client shutting down");
    }

    @Override
    public String suggestion() {
        return "The client was shut down. Start a new client to continue.";
    }
}
