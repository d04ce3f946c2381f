package com.shellrelay.mcp.protocol;

import com.fasterxml.jackson.databind.node.NullNode;
import com.shellrelay.core.time.MonotonicClock;
import com.shellrelay.core.time.RelayScheduler;
import com.shellrelay.mcp.McpRemoteException;
import com.shellrelay.mcp.RequestTimeoutException;
import com.shellrelay.mcp.ShuttingDownException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Matches responses to outstanding requests by id and enforces per-request deadlines.
 * <p>
 * Every pending request is settled exactly once: by its response, by its deadline,
 * or by a bulk rejection. Whoever removes the entry from the map settles it, so a
 * response racing a deadline cannot complete the same future twice. The shutdown flag
 * is checked again after every map update, so once shutdown has begun no request is
 * left pending and no response completes a caller. Ids start at 1,
 * increase monotonically and are not reused until {@link #resetIds()}.
 */
public class RequestCorrelator {

    private static final Logger log = LoggerFactory.getLogger(RequestCorrelator.class);

    private final RelayScheduler scheduler;
    private final MonotonicClock clock;
    private final AtomicLong nextId = new AtomicLong();
    private final ConcurrentHashMap<Long, PendingRequest> pending = new ConcurrentHashMap<>();
    private final Object shutdownLock = new Object();
    private volatile boolean shutdown;

    // test seams for the window between the shutdown check and the map update
    volatile Runnable beforeRecord = () -> { };
    volatile Runnable beforeSettle = () -> { };

    public RequestCorrelator(RelayScheduler scheduler, MonotonicClock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Allocates an id, records the request as pending and arms its deadline.
     * The caller writes the frame afterwards and calls {@link #fail} if that write fails.
     */
    public PendingRequest register(String method, Duration timeout) {
        if (shutdown) {
            throw new ShuttingDownException();
        }
        long id = nextId.incrementAndGet();
        PendingRequest request = new PendingRequest(id, method, clock.nowNanos());
        beforeRecord.run();
        pending.put(id, request);
        if (shutdown) {
            // shutdown() may have taken its snapshot before the put
            fail(id, new ShuttingDownException());
            throw new ShuttingDownException();
        }
        request.attachDeadline(scheduler.schedule(timeout, () -> expire(id, timeout)));
        if (request.future().isDone()) {
            request.cancelDeadline();
        }
        return request;
    }

    /**
     * Settles the request that {@code message} answers.
     *
     * @return {@code false} for unknown or already-settled ids, and after shutdown
     */
    public boolean resolve(JsonRpcMessage message) {
        if (shutdown) {
            return false;
        }
        var id = message.numericId();
        if (id.isEmpty()) {
            log.debug("Ignoring response with non-numeric id {}", message.id());
            return false;
        }
        PendingRequest request = pending.remove(id.getAsLong());
        if (request == null) {
            log.debug("Ignoring response for unknown or settled request {}", id.getAsLong());
            return false;
        }
        request.cancelDeadline();
        beforeSettle.run();
        synchronized (shutdownLock) {
            if (shutdown) {
                request.future().completeExceptionally(new ShuttingDownException());
                return false;
            }
            if (message.hasError()) {
                request.future().completeExceptionally(
                        new McpRemoteException(message.errorMessage(), message.errorCode()));
            } else {
                request.future().complete(message.result() != null ? message.result() : NullNode.getInstance());
            }
        }
        return true;
    }

    /**
     * Settles one request with {@code error}, e.g. when its frame could not be written.
     */
    public void fail(long id, Throwable error) {
        PendingRequest request = pending.remove(id);
        if (request != null) {
            request.cancelDeadline();
            request.future().completeExceptionally(error);
        }
    }

    /**
     * Rejects every pending request, each with a fresh exception from {@code errors}.
     *
     * @return how many requests were rejected
     */
    public int rejectAll(Supplier<? extends RuntimeException> errors) {
        int rejected = 0;
        for (Long id : new ArrayList<>(pending.keySet())) {
            PendingRequest request = pending.remove(id);
            if (request != null) {
                request.cancelDeadline();
                request.future().completeExceptionally(errors.get());
                rejected++;
            }
        }
        return rejected;
    }

    /**
     * Restarts id allocation at 1. Only valid once nothing is pending, i.e. for a fresh connection.
     */
    public void resetIds() {
        nextId.set(0);
    }

    /**
     * Rejects all pending requests with {@link ShuttingDownException}; later responses are ignored
     * and later registrations fail.
     */
    public int shutdown() {
        synchronized (shutdownLock) {
            shutdown = true;
        }
        return rejectAll(ShuttingDownException::new);
    }

    public int size() {
        return pending.size();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private void expire(long id, Duration timeout) {
        PendingRequest request = pending.remove(id);
        if (request == null) {
            return;
        }
        log.warn("Request {} ({}) timed out after {}ms", id, request.method(), timeout.toMillis());
        request.future().completeExceptionally(new RequestTimeoutException(id, request.method(), timeout));
    }
}
