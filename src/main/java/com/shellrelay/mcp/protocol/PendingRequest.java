package com.shellrelay.mcp.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.shellrelay.core.time.Cancellable;

import java.util.concurrent.CompletableFuture;

/**
 * An in-flight request awaiting its response, keyed by id in the {@link RequestCorrelator}.
 */
public final class PendingRequest {

    private final long id;
    private final String method;
    private final long startNanos;
    private final CompletableFuture<JsonNode> future = new CompletableFuture<>();
    private volatile Cancellable deadline;

    PendingRequest(long id, String method, long startNanos) {
        this.id = id;
        this.method = method;
        this.startNanos = startNanos;
    }

    public long id() { return id; }
    public String method() { return method; }
    public long startNanos() { return startNanos; }
    public CompletableFuture<JsonNode> future() { return future; }

    void attachDeadline(Cancellable deadline) {
        this.deadline = deadline;
    }

    void cancelDeadline() {
        Cancellable d = deadline;
        if (d != null) {
            d.cancel();
        }
    }
}
