package com.shellrelay.mcp;

import com.shellrelay.core.error.ErrorKind;

/**
 * The client is not connected, or the connection was lost while a request was pending.
 */
public class McpConnectionException extends McpException {

    public McpConnectionException(String message) {
        super(ErrorKind.CONNECTION, message);
    }

    public McpConnectionException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
    }
}
