package com.shellrelay.mcp;

import com.shellrelay.core.error.ErrorKind;

import java.time.Duration;

/**
 * A request's deadline fired before a matching response arrived.
 */
public class RequestTimeoutException extends McpException {

    private final long requestId;
    private final String method;

    public RequestTimeoutException(long requestId, String method, Duration timeout) {
        super(ErrorKind.TIMEOUT, "Request timeout after " + timeout.toMillis() + "ms: " + method
                + " (id " + requestId + ")");
        this.requestId = requestId;
        this.method = method;
    }

    public long getRequestId() {
        return requestId;
    }

    public String getMethod() {
        return method;
    }
}
