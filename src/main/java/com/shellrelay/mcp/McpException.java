package com.shellrelay.mcp;

import com.shellrelay.core.error.ClassifiedFailure;
import com.shellrelay.core.error.ErrorKind;

/**
 * Base class for failures raised by the MCP client, its transport and its correlator.
 */
public class McpException extends RuntimeException implements ClassifiedFailure {

    private final ErrorKind kind;

    public McpException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public McpException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Override
    public ErrorKind kind() {
        return kind;
    }
}
