package com.shellrelay.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shellrelay.core.error.ErrorClassifier;
import com.shellrelay.core.error.ErrorKind;
import com.shellrelay.core.events.EventBus;
import com.shellrelay.core.events.RelayEvent;
import com.shellrelay.core.metrics.RelayMetrics;
import com.shellrelay.core.time.ManualMonotonicClock;
import com.shellrelay.mcp.McpConnectionException;
import com.shellrelay.mcp.McpToolClient;
import com.shellrelay.mcp.ToolCallResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CommandExecutionManagerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private McpToolClient toolClient;
    private CommandProperties props;
    private InMemorySessionCommandStore store;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private List<Duration> sleeps;
    private CommandExecutionManager manager;

    @BeforeEach
    void setUp() {
        toolClient = mock(McpToolClient.class);
        props = new CommandProperties();
        props.setAttemptTimeoutMs(50);
        store = new InMemorySessionCommandStore(props.getHistoryLimit());
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        sleeps = new CopyOnWriteArrayList<>();
        manager = new CommandExecutionManager(toolClient, store, props, new ErrorClassifier(), eventBus,
                new RelayMetrics(registry), sleeps::add, new ManualMonotonicClock());
    }

    private static CompletableFuture<ToolCallResult> result(String text, boolean isError) {
        ObjectNode raw = MAPPER.createObjectNode();
        raw.putArray("content").addObject().put("type", "text").put("text", text);
        if (isError) {
            raw.put("isError", true);
        }
        return CompletableFuture.completedFuture(new ToolCallResult(raw));
    }

    private static CompletableFuture<ToolCallResult> never() {
        return new CompletableFuture<>();
    }

    private List<String> eventTypes(List<RelayEvent> events) {
        return events.stream().map(RelayEvent::eventType).toList();
    }

    @Nested
    @DisplayName("attempts")
    class AttemptTests {

        @Test
        @DisplayName("first-attempt success returns the tool output")
        void successFirstAttempt() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(result("README.md", false));

            var result = manager.execute("s1", "ls");

            assertTrue(result.success());
            assertEquals("README.md", result.output());
            assertEquals(0, result.exitCode());
            assertEquals(1, result.attempts());
            assertNull(result.error());
            assertTrue(sleeps.isEmpty());
            verify(toolClient).callTool("write_command", Map.of("command", "ls"));
        }

        @Test
        @DisplayName("two timeouts then success takes three attempts with fixed delays")
        void timeoutsThenSuccess() {
            when(toolClient.callTool(eq("write_command"), anyMap()))
                    .thenReturn(never(), never(), result("done", false));

            var result = manager.execute("s1", "make build");

            assertTrue(result.success());
            assertEquals(3, result.attempts());
            assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(2)), sleeps);
        }

        @Test
        @DisplayName("timeouts on every attempt exhaust retries with a TIMEOUT error")
        void timeoutExhaustion() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenAnswer(inv -> never());

            var result = manager.execute("s1", "sleep 100");

            assertFalse(result.success());
            assertEquals(3, result.attempts());
            assertEquals(ErrorKind.TIMEOUT, result.error().kind());
            assertEquals(-1, result.exitCode());
            assertEquals(2, sleeps.size());
            assertEquals(3, result.error().details().get("attempts"));
        }

        @Test
        @DisplayName("tool error results count as failed attempts")
        void toolErrorIsFailure() {
            when(toolClient.callTool(eq("write_command"), anyMap()))
                    .thenReturn(result("bash: foo: permission denied", true));

            var result = manager.execute("s1", "foo");

            assertFalse(result.success());
            assertEquals(3, result.attempts());
            assertEquals(ErrorKind.TOOL_CALL, result.error().kind());
            assertEquals("bash: foo: permission denied", result.output());
            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("connection failures are classified as CONNECTION")
        void connectionFailure() {
            when(toolClient.callTool(eq("write_command"), anyMap()))
                    .thenAnswer(inv -> CompletableFuture.failedFuture(new McpConnectionException("MCP client not connected")));

            var result = manager.execute("s1", "ls");

            assertFalse(result.success());
            assertEquals(ErrorKind.CONNECTION, result.error().kind());
            assertTrue(result.error().retryable());
        }

        @Test
        @DisplayName("max-retries of one disables retry")
        void singleAttempt() {
            props.setMaxRetries(1);
            when(toolClient.callTool(eq("write_command"), anyMap())).thenAnswer(inv -> never());

            var result = manager.execute("s1", "ls");

            assertEquals(1, result.attempts());
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("interrupted retry delay stops retrying")
        void interruptedDelay() {
            manager = new CommandExecutionManager(toolClient, store, props, new ErrorClassifier(), eventBus,
                    new RelayMetrics(registry), d -> { throw new InterruptedException(); }, new ManualMonotonicClock());
            when(toolClient.callTool(eq("write_command"), anyMap())).thenAnswer(inv -> never());

            var result = manager.execute("s1", "ls");

            assertTrue(Thread.interrupted());
            assertFalse(result.success());
            assertEquals(1, result.attempts());
        }

        @Test
        @DisplayName("MDC is cleared after execution")
        void mdcCleared() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(result("ok", false));

            manager.execute("s1", "ls");

            assertNull(MDC.get("sessionId"));
            assertNull(MDC.get("attempt"));
        }
    }

    @Nested
    @DisplayName("loop detection and history")
    class LoopTests {

        @Test
        @DisplayName("sixth identical command is rejected without calling the tool")
        void loopDetected() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(result("ok", false));
            for (int i = 0; i < 5; i++) {
                assertTrue(manager.execute("s1", "ls").success());
            }

            var result = manager.execute("s1", "ls");

            assertFalse(result.success());
            assertEquals(0, result.attempts());
            assertEquals(-1, result.exitCode());
            assertEquals(ErrorKind.LOOP_DETECTED, result.error().kind());
            assertFalse(result.error().retryable());
            assertEquals(5, result.error().details().get("count"));
            verify(toolClient, times(5)).callTool(eq("write_command"), anyMap());
            assertEquals(1.0, registry.get("shellrelay.command.loops").counter().count());
            assertEquals(5, manager.getSessionHistory("s1").size());
        }

        @Test
        @DisplayName("loop detection is per session and per exact command")
        void loopScoped() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(result("ok", false));
            for (int i = 0; i < 5; i++) {
                manager.execute("s1", "ls");
            }

            assertTrue(manager.execute("s2", "ls").success());
            assertTrue(manager.execute("s1", "ls -la").success());
        }

        @Test
        @DisplayName("failed commands count toward loop detection")
        void failuresCount() {
            props.setMaxRetries(1);
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(result("no", true));
            for (int i = 0; i < 5; i++) {
                manager.execute("s1", "cat missing");
            }

            assertEquals(ErrorKind.LOOP_DETECTED, manager.execute("s1", "cat missing").error().kind());
        }

        @Test
        @DisplayName("history keeps the latest fifty commands in order")
        void historyCapped() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(result("ok", false));
            for (int i = 0; i < 60; i++) {
                manager.execute("s1", "echo " + i);
            }

            var history = manager.getSessionHistory("s1");
            assertEquals(50, history.size());
            assertEquals("echo 10", history.get(0));
            assertEquals("echo 59", history.get(49));
        }

        @Test
        @DisplayName("clearSession resets loop detection")
        void clearSessionResets() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(result("ok", false));
            for (int i = 0; i < 5; i++) {
                manager.execute("s1", "ls");
            }

            manager.clearSession("s1");

            assertTrue(manager.getSessionHistory("s1").isEmpty());
            assertTrue(manager.execute("s1", "ls").success());
        }
    }

    @Nested
    @DisplayName("session concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("a second command while one is pending is rejected")
        void busySession() throws Exception {
            var inFlight = new CompletableFuture<ToolCallResult>();
            var called = new CountDownLatch(1);
            props.setAttemptTimeoutMs(5000);
            when(toolClient.callTool(eq("write_command"), anyMap())).thenAnswer(inv -> {
                called.countDown();
                return inFlight;
            });

            var first = CompletableFuture.supplyAsync(() -> manager.execute("s1", "sleep 1"));
            assertTrue(called.await(5, TimeUnit.SECONDS));
            assertTrue(manager.isCommandPending("s1"));
            assertEquals("sleep 1", manager.getPendingCommand("s1").orElseThrow().command());

            var error = assertThrows(SessionBusyException.class, () -> manager.execute("s1", "ls"));
            assertEquals("s1", error.getSessionId());
            assertEquals(List.of("sleep 1"), manager.getSessionHistory("s1"));

            inFlight.complete(new ToolCallResult(MAPPER.createObjectNode()));
            assertTrue(first.get(5, TimeUnit.SECONDS).success());
            assertFalse(manager.isCommandPending("s1"));
        }

        @Test
        @DisplayName("a command cleared mid-flight does not release its successor's slot")
        void clearedCommandKeepsSuccessorPending() throws Exception {
            Map<String, CompletableFuture<ToolCallResult>> inFlight = new ConcurrentHashMap<>();
            Map<String, CountDownLatch> called = new ConcurrentHashMap<>();
            for (String cmd : List.of("sleep 1", "sleep 2")) {
                inFlight.put(cmd, new CompletableFuture<>());
                called.put(cmd, new CountDownLatch(1));
            }
            props.setAttemptTimeoutMs(5000);
            when(toolClient.callTool(eq("write_command"), anyMap())).thenAnswer(inv -> {
                String cmd = (String) inv.<Map<String, Object>>getArgument(1).get("command");
                called.get(cmd).countDown();
                return inFlight.get(cmd);
            });
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                var first = executor.submit(() -> manager.execute("s1", "sleep 1"));
                assertTrue(called.get("sleep 1").await(5, TimeUnit.SECONDS));

                manager.clearSession("s1");
                var second = executor.submit(() -> manager.execute("s1", "sleep 2"));
                assertTrue(called.get("sleep 2").await(5, TimeUnit.SECONDS));

                inFlight.get("sleep 1").complete(new ToolCallResult(MAPPER.createObjectNode()));
                assertTrue(first.get(5, TimeUnit.SECONDS).success());

                assertTrue(manager.isCommandPending("s1"));
                assertEquals("sleep 2", manager.getPendingCommand("s1").orElseThrow().command());
                assertThrows(SessionBusyException.class, () -> manager.execute("s1", "ls"));

                inFlight.get("sleep 2").complete(new ToolCallResult(MAPPER.createObjectNode()));
                assertTrue(second.get(5, TimeUnit.SECONDS).success());
                assertFalse(manager.isCommandPending("s1"));
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("events")
    class EventTests {

        @Test
        @DisplayName("observer sees progress, timeout, retry and completion in order")
        void eventSequence() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(never(), result("ok", false));
            List<RelayEvent> seen = new ArrayList<>();

            manager.execute("s1", "ls", seen::add);

            assertEquals(List.of(
                    RelayEvent.COMMAND_PROGRESS,
                    RelayEvent.COMMAND_TIMEOUT,
                    RelayEvent.COMMAND_RETRY,
                    RelayEvent.COMMAND_PROGRESS,
                    RelayEvent.COMMAND_COMPLETED), eventTypes(seen));
            var retry = seen.get(2);
            assertEquals(2, retry.payload().get("nextAttempt"));
            assertEquals(2000L, retry.payload().get("delayMs"));
            assertEquals(true, seen.get(4).payload().get("success"));
        }

        @Test
        @DisplayName("observer only sees its own session and is removed afterwards")
        void observerScoped() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(result("ok", false));
            List<RelayEvent> seen = new ArrayList<>();

            manager.execute("s1", "ls", seen::add);
            manager.execute("s2", "ls");
            manager.execute("s1", "pwd");

            assertEquals(2, seen.size());
            assertTrue(seen.stream().allMatch(e -> "s1".equals(e.sessionId())));
        }

        @Test
        @DisplayName("loop rejection publishes loop_detected")
        void loopEvent() {
            when(toolClient.callTool(eq("write_command"), anyMap())).thenReturn(result("ok", false));
            for (int i = 0; i < 5; i++) {
                manager.execute("s1", "ls");
            }
            List<RelayEvent> seen = new ArrayList<>();

            manager.execute("s1", "ls", seen::add);

            assertEquals(List.of(RelayEvent.COMMAND_LOOP_DETECTED), eventTypes(seen));
            assertEquals(5, seen.get(0).payload().get("count"));
        }
    }
}
