package com.shellrelay.mcp.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shellrelay.core.time.DeterministicScheduler;
import com.shellrelay.core.time.ManualMonotonicClock;
import com.shellrelay.mcp.McpConnectionException;
import com.shellrelay.mcp.McpRemoteException;
import com.shellrelay.mcp.RequestTimeoutException;
import com.shellrelay.mcp.ShuttingDownException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RequestCorrelatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final JsonRpcCodec codec = new JsonRpcCodec(new ObjectMapper());
    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RequestCorrelator correlator;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        correlator = new RequestCorrelator(scheduler, clock);
    }

    private JsonRpcMessage response(long id, String text) {
        return codec.parse("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":{\"text\":\"" + text + "\"}}")
                .orElseThrow();
    }

    private static Throwable failureOf(PendingRequest request) {
        var error = assertThrows(CompletionException.class, () -> request.future().join());
        return error.getCause();
    }

    @Nested
    @DisplayName("ids")
    class IdTests {

        @Test
        @DisplayName("start at 1 and increase")
        void monotonic() {
            assertEquals(1, correlator.register("a", TIMEOUT).id());
            assertEquals(2, correlator.register("b", TIMEOUT).id());
            assertEquals(3, correlator.register("c", TIMEOUT).id());
        }

        @Test
        @DisplayName("are not reused after settlement")
        void notReused() {
            var first = correlator.register("a", TIMEOUT);
            correlator.resolve(response(first.id(), "x"));
            assertEquals(2, correlator.register("b", TIMEOUT).id());
        }

        @Test
        @DisplayName("restart at 1 after resetIds")
        void reset() {
            correlator.register("a", TIMEOUT);
            correlator.rejectAll(() -> new McpConnectionException("restart"));
            correlator.resetIds();
            assertEquals(1, correlator.register("b", TIMEOUT).id());
        }
    }

    @Nested
    @DisplayName("resolve")
    class ResolveTests {

        @Test
        @DisplayName("out-of-order responses reach the matching callers")
        void outOfOrder() {
            List<PendingRequest> requests = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                requests.add(correlator.register("tools/call", TIMEOUT));
            }
            for (int i = requests.size() - 1; i >= 0; i--) {
                assertTrue(correlator.resolve(response(requests.get(i).id(), "r" + requests.get(i).id())));
            }
            for (var request : requests) {
                assertEquals("r" + request.id(), request.future().join().path("text").asText());
            }
            assertEquals(0, correlator.size());
            assertEquals(0, scheduler.pendingTasks());
        }

        @Test
        @DisplayName("error member completes the caller exceptionally")
        void errorResponse() {
            var request = correlator.register("tools/call", TIMEOUT);
            correlator.resolve(codec.parse("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32602,"
                    + "\"message\":\"Unknown tool: nope\"}}").orElseThrow());

            var cause = failureOf(request);
            assertInstanceOf(McpRemoteException.class, cause);
            assertEquals("Unknown tool: nope", cause.getMessage());
            assertEquals(-32602, ((McpRemoteException) cause).getCode());
        }

        @Test
        @DisplayName("unknown ids are dropped")
        void unknownId() {
            correlator.register("a", TIMEOUT);
            assertFalse(correlator.resolve(response(99, "x")));
            assertEquals(1, correlator.size());
        }

        @Test
        @DisplayName("missing result completes with a null node")
        void missingResult() {
            var request = correlator.register("a", TIMEOUT);
            correlator.resolve(codec.parse("{\"jsonrpc\":\"2.0\",\"id\":1}").orElseThrow());
            assertTrue(request.future().join().isNull());
        }
    }

    @Nested
    @DisplayName("deadlines")
    class DeadlineTests {

        @Test
        @DisplayName("deadline settles the caller exactly once with a timeout")
        void timeoutExactlyOnce() {
            var request = correlator.register("tools/call", TIMEOUT);
            var settlements = new AtomicInteger();
            request.future().whenComplete((r, e) -> settlements.incrementAndGet());

            scheduler.advance(TIMEOUT);

            var cause = failureOf(request);
            assertInstanceOf(RequestTimeoutException.class, cause);
            assertEquals(1, ((RequestTimeoutException) cause).getRequestId());

            assertFalse(correlator.resolve(response(request.id(), "late")));
            assertEquals(1, settlements.get());
            assertEquals(0, correlator.size());
        }

        @Test
        @DisplayName("deadline does not fire early")
        void notEarly() {
            var request = correlator.register("tools/call", TIMEOUT);
            scheduler.advance(TIMEOUT.minusMillis(1));
            assertFalse(request.future().isDone());
        }

        @Test
        @DisplayName("response cancels the deadline")
        void responseCancelsDeadline() {
            var request = correlator.register("tools/call", TIMEOUT);
            correlator.resolve(response(request.id(), "ok"));
            scheduler.advance(TIMEOUT);
            assertEquals("ok", request.future().join().path("text").asText());
            assertEquals(0, scheduler.pendingTasks());
        }
    }

    @Nested
    @DisplayName("shutdown")
    class ShutdownTests {

        @Test
        @DisplayName("rejects all pending requests and ignores later responses")
        void rejectsPending() {
            List<PendingRequest> requests = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                requests.add(correlator.register("tools/call", TIMEOUT));
            }

            assertEquals(4, correlator.shutdown());

            for (var request : requests) {
                assertInstanceOf(ShuttingDownException.class, failureOf(request));
                assertFalse(correlator.resolve(response(request.id(), "late")));
            }
            assertEquals(0, scheduler.pendingTasks());
            assertThrows(ShuttingDownException.class, () -> correlator.register("x", TIMEOUT));
        }

        @Test
        @DisplayName("fail settles a single request")
        void failOne() {
            var a = correlator.register("a", TIMEOUT);
            var b = correlator.register("b", TIMEOUT);
            correlator.fail(a.id(), new McpConnectionException("write failed"));

            assertInstanceOf(McpConnectionException.class, failureOf(a));
            assertFalse(b.future().isDone());
        }

        @Test
        @DisplayName("a response claimed just as shutdown begins rejects its caller")
        void shutdownDuringResolve() {
            var request = correlator.register("tools/call", TIMEOUT);
            var rejected = new AtomicInteger(-1);
            correlator.beforeSettle = () -> rejected.set(correlator.shutdown());

            assertFalse(correlator.resolve(response(request.id(), "late")));

            assertEquals(0, rejected.get());
            assertInstanceOf(ShuttingDownException.class, failureOf(request));
            assertEquals(0, scheduler.pendingTasks());
        }

        @Test
        @DisplayName("a registration racing shutdown is rejected, not left pending")
        void shutdownDuringRegister() {
            correlator.beforeRecord = correlator::shutdown;

            assertThrows(ShuttingDownException.class, () -> correlator.register("tools/call", TIMEOUT));

            assertEquals(0, correlator.size());
            assertEquals(0, scheduler.pendingTasks());
        }
    }
}
