package com.shellrelay.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shellrelay.core.events.EventBus;
import com.shellrelay.core.events.RelayEvent;
import com.shellrelay.core.logging.MdcContext;
import com.shellrelay.core.metrics.RelayMetrics;
import com.shellrelay.core.time.Cancellable;
import com.shellrelay.core.time.MonotonicClock;
import com.shellrelay.core.time.RelayScheduler;
import com.shellrelay.mcp.protocol.FrameReader;
import com.shellrelay.mcp.protocol.JsonRpcCodec;
import com.shellrelay.mcp.protocol.JsonRpcMessage;
import com.shellrelay.mcp.protocol.PendingRequest;
import com.shellrelay.mcp.protocol.RequestCorrelator;
import com.shellrelay.mcp.transport.LaunchSpec;
import com.shellrelay.mcp.transport.ProcessLauncher;
import com.shellrelay.mcp.transport.ProcessTransport;
import com.shellrelay.mcp.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client for one MCP server running as a child process on stdio.
 * <p>
 * Supervises the process (handshake, exit detection, reconnect with exponential
 * backoff, periodic liveness probe) and correlates JSON-RPC requests with their
 * responses. Lifecycle transitions are serialized on this instance; request
 * traffic is not, so any number of callers may have requests in flight.
 * <p>
 * Lifecycle events are published on the {@link EventBus} without a session id.
 */
public class McpClient implements McpToolClient {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);

    static final String METHOD_INITIALIZE = "initialize";
    static final String METHOD_INITIALIZED = "notifications/initialized";
    static final String METHOD_TOOLS_LIST = "tools/list";
    static final String METHOD_TOOLS_CALL = "tools/call";
    static final String METHOD_PING = "ping";

    private static final int METHOD_NOT_FOUND = -32601;
    private static final Duration HANDSHAKE_SLACK = Duration.ofSeconds(1);

    private final McpProperties props;
    private final LaunchSpec launchSpec;
    private final RelayScheduler scheduler;
    private final MonotonicClock clock;
    private final EventBus eventBus;
    private final RelayMetrics metrics;
    private final ObjectMapper mapper;
    private final JsonRpcCodec codec;
    private final RequestCorrelator correlator;
    private final FrameReader frameReader = new FrameReader();
    private final ProcessTransport transport;
    private final ReconnectBackoff backoff;
    private final McpHealthMonitor healthMonitor;
    private final ConnectionState state = new ConnectionState();

    private Cancellable reconnectTimer;
    private volatile boolean shuttingDown;

    public McpClient(McpProperties props, ProcessLauncher launcher, RelayScheduler scheduler,
                     MonotonicClock clock, EventBus eventBus, RelayMetrics metrics, ObjectMapper mapper) {
        props.validate();
        this.props = props;
        this.launchSpec = LaunchSpec.from(props);
        this.scheduler = scheduler;
        this.clock = clock;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.mapper = mapper;
        this.codec = new JsonRpcCodec(mapper);
        this.correlator = new RequestCorrelator(scheduler, clock);
        this.transport = new ProcessTransport(launcher, new TransportListener());
        this.backoff = new ReconnectBackoff(props.getReconnectDelayMs(), props.getMaxReconnectDelayMs());
        this.healthMonitor = new McpHealthMonitor(scheduler,
                Duration.ofMillis(props.getHealthCheck().getIntervalMs()), this::checkHealth);
    }

    // ── Lifecycle ────────────────────────────────────────────────────

    /**
     * Launches the server and completes the handshake. A failure here is returned to
     * the caller; automatic reconnect only covers connections that were established.
     *
     * @throws McpException if the process cannot be started or the handshake fails
     */
    public synchronized void start() {
        if (shuttingDown) {
            throw new IllegalStateException("MCP client has been shut down");
        }
        if (state.isConnected()) {
            return;
        }
        doConnect();
    }

    /**
     * Leaves the terminal reconnect-failed state and connects again from scratch.
     */
    public synchronized void reinitialize() {
        if (shuttingDown) {
            throw new IllegalStateException("MCP client has been shut down");
        }
        log.info("Reinitializing MCP client");
        cancelReconnect();
        healthMonitor.stop();
        transport.stop();
        state.reset();
        doConnect();
    }

    /**
     * Terminates the server process and marks the connection down. Idempotent.
     * Pending requests are rejected with a connection error.
     */
    public synchronized void stop() {
        cancelReconnect();
        healthMonitor.stop();
        transport.stop();
        correlator.rejectAll(() -> new McpConnectionException("MCP client stopped"));
        if (state.isConnected()) {
            state.markDisconnected();
            eventBus.publish(RelayEvent.connection(RelayEvent.DISCONNECTED, Map.of("reason", "stopped")));
        }
    }

    /**
     * Rejects every pending request with {@link ShuttingDownException}, cancels all timers
     * and terminates the server. The instance cannot be started again.
     */
    public void shutdown() {
        if (shuttingDown) {
            return;
        }
        // outside the lock: a handshake in progress holds it and waits on the correlator
        shuttingDown = true;
        int rejected = correlator.shutdown();
        synchronized (this) {
            cancelReconnect();
            healthMonitor.stop();
            transport.stop();
            state.markDisconnected();
        }
        log.info("MCP client shut down ({} pending request(s) rejected)", rejected);
        eventBus.publish(RelayEvent.connection(RelayEvent.SHUTDOWN, Map.of("rejectedRequests", rejected)));
    }

    public boolean isConnected() {
        return state.isConnected();
    }

    public ConnectionStatus getStatus() {
        return new ConnectionStatus(
                state.isConnected(),
                transport.isAlive(),
                transport.pid().orElse(null),
                state.reconnectCount(),
                correlator.size(),
                state.isReconnectPending(),
                state.isReconnectFailed());
    }

    // ── Requests ─────────────────────────────────────────────────────

    /**
     * Sends a request and returns its eventual result. Fails fast, without touching the
     * process, when the client is shutting down or not connected.
     */
    public CompletableFuture<JsonNode> sendRequest(String method, Object params, Duration timeout) {
        if (shuttingDown) {
            return CompletableFuture.failedFuture(new ShuttingDownException());
        }
        if (!state.isConnected()) {
            return CompletableFuture.failedFuture(notConnected());
        }
        try {
            return send(method, toParams(params), timeout).future();
        } catch (ShuttingDownException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public CompletableFuture<JsonNode> sendRequest(String method, Object params) {
        return sendRequest(method, params, props.requestTimeout());
    }

    /**
     * Fire-and-forget message with no id.
     *
     * @throws McpException if the client is not connected or the write fails
     */
    public void sendNotification(String method, Object params) {
        if (shuttingDown) {
            throw new ShuttingDownException();
        }
        if (!state.isConnected()) {
            throw notConnected();
        }
        transport.write(codec.encodeNotification(method, toParams(params)));
    }

    @Override
    public CompletableFuture<ToolCallResult> callTool(String name, Map<String, Object> arguments) {
        ObjectNode params = mapper.createObjectNode();
        params.put("name", name);
        params.set("arguments", mapper.valueToTree(arguments != null ? arguments : Map.of()));
        return sendRequest(METHOD_TOOLS_CALL, params).thenApply(ToolCallResult::new);
    }

    public CompletableFuture<List<ToolDescriptor>> listTools() {
        return sendRequest(METHOD_TOOLS_LIST, mapper.createObjectNode())
                .thenApply(result -> {
                    JsonNode tools = result.path("tools");
                    if (!tools.isArray()) {
                        return List.of();
                    }
                    return mapper.convertValue(tools, new TypeReference<List<ToolDescriptor>>() {});
                });
    }

    // ── Connection management (callers hold the lock) ────────────────

    private void doConnect() {
        correlator.rejectAll(() -> new McpConnectionException("MCP connection restarted"));
        correlator.resetIds();
        frameReader.reset();

        transport.start(launchSpec, props.startupGrace());
        JsonNode serverInfo;
        try {
            JsonNode result = awaitHandshake(send(METHOD_INITIALIZE, initializeParams(), props.requestTimeout()));
            serverInfo = result.path("serverInfo");
            transport.write(codec.encodeNotification(METHOD_INITIALIZED, null));
        } catch (RuntimeException e) {
            transport.stop();
            throw e;
        }

        state.markConnected();
        if (props.getHealthCheck().isEnabled()) {
            healthMonitor.start();
        }
        log.info("MCP server connected: {} {}", serverInfo.path("name").asText("unknown"),
                serverInfo.path("version").asText(""));

        var payload = new LinkedHashMap<String, Object>();
        transport.pid().ifPresent(pid -> payload.put("pid", pid));
        payload.put("server", serverInfo.path("name").asText("unknown"));
        eventBus.publish(RelayEvent.connection(RelayEvent.CONNECTED, payload));
    }

    private ObjectNode initializeParams() {
        ObjectNode params = mapper.createObjectNode();
        params.put("protocolVersion", props.getProtocolVersion());
        params.putObject("capabilities");
        params.putObject("clientInfo")
                .put("name", props.getClientName())
                .put("version", props.getClientVersion());
        return params;
    }

    private JsonNode awaitHandshake(PendingRequest request) {
        Duration timeout = props.requestTimeout();
        try {
            return request.future().get(timeout.plus(HANDSHAKE_SLACK).toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new McpConnectionException("MCP handshake failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            var timeoutError = new RequestTimeoutException(request.id(), request.method(), timeout);
            correlator.fail(request.id(), timeoutError);
            throw timeoutError;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new McpConnectionException("Interrupted during MCP handshake", e);
        }
    }

    private void scheduleReconnect() {
        if (shuttingDown || state.isReconnectPending()) {
            return;
        }
        if (state.reconnectCount() >= props.getReconnectAttempts()) {
            state.markReconnectFailed();
            healthMonitor.stop();
            metrics.incrementReconnectFailures();
            log.error("MCP server reconnect failed after {} attempt(s); reinitialize required",
                    state.reconnectCount());
            eventBus.publish(RelayEvent.connection(RelayEvent.RECONNECT_FAILED,
                    Map.of("attempts", state.reconnectCount())));
            return;
        }
        int attempt = state.nextReconnectAttempt();
        Duration delay = backoff.delayFor(attempt);
        metrics.incrementReconnectAttempts();
        log.info("Reconnecting to MCP server in {}ms (attempt {}/{})",
                delay.toMillis(), attempt, props.getReconnectAttempts());
        eventBus.publish(RelayEvent.connection(RelayEvent.RECONNECTING,
                Map.of("attempt", attempt, "delayMs", delay.toMillis(),
                        "maxAttempts", props.getReconnectAttempts())));
        reconnectTimer = scheduler.schedule(delay, this::attemptReconnect);
    }

    private synchronized void attemptReconnect() {
        reconnectTimer = null;
        state.reconnectStarted();
        if (shuttingDown) {
            return;
        }
        try {
            doConnect();
            log.info("Reconnected to MCP server");
        } catch (RuntimeException e) {
            log.warn("Reconnect attempt {} failed: {}", state.reconnectCount(), e.getMessage());
            transport.stop();
            scheduleReconnect();
        }
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
        state.reconnectStarted();
    }

    /**
     * Liveness probe run by the {@link McpHealthMonitor}.
     */
    synchronized void checkHealth() {
        if (shuttingDown || state.isReconnectFailed() || state.isReconnectPending()) {
            return;
        }
        boolean connected = state.isConnected();
        boolean alive = transport.isAlive();
        if (connected && alive) {
            log.debug("MCP server healthy");
            return;
        }
        log.warn("MCP server unhealthy (connected={}, processAlive={})", connected, alive);
        state.markDisconnected();
        transport.stop();
        correlator.rejectAll(() -> new McpConnectionException("MCP server became unhealthy"));
        eventBus.publish(RelayEvent.connection(RelayEvent.UNHEALTHY,
                Map.of("connected", connected, "processAlive", alive)));
        scheduleReconnect();
    }

    // ── Inbound traffic ──────────────────────────────────────────────

    private void handleData(byte[] chunk) {
        for (String line : frameReader.feed(chunk)) {
            codec.parse(line).ifPresent(this::route);
        }
    }

    private void route(JsonRpcMessage message) {
        if (message.isNotification()) {
            log.debug("MCP notification: {}", message.method());
            var payload = new LinkedHashMap<String, Object>();
            payload.put("method", message.method());
            payload.put("params", message.params() != null ? message.params() : NullNode.getInstance());
            eventBus.publish(RelayEvent.connection(RelayEvent.NOTIFICATION, payload));
        } else if (message.isResponse()) {
            correlator.resolve(message);
        } else if (message.method() != null) {
            answerServerRequest(message);
        } else {
            log.debug("Ignoring message without id or method");
        }
    }

    private void answerServerRequest(JsonRpcMessage message) {
        try {
            if (METHOD_PING.equals(message.method())) {
                transport.write(codec.encodeResult(message.id(), mapper.createObjectNode()));
            } else {
                log.debug("Rejecting unsupported server request {}", message.method());
                transport.write(codec.encodeError(message.id(), METHOD_NOT_FOUND,
                        "Method not found: " + message.method()));
            }
        } catch (TransportException e) {
            log.warn("Could not answer server request {}: {}", message.method(), e.getMessage());
        }
    }

    private void handleExit(int exitCode) {
        int rejected = correlator.rejectAll(() ->
                new McpConnectionException("MCP server process exited with code " + exitCode));
        synchronized (this) {
            if (shuttingDown || !state.isConnected() || transport.isAlive()) {
                return;
            }
            state.markDisconnected();
            log.warn("MCP server disconnected (exit code {}, {} pending request(s) rejected)", exitCode, rejected);
            eventBus.publish(RelayEvent.connection(RelayEvent.DISCONNECTED,
                    Map.of("code", exitCode, "rejectedRequests", rejected)));
            scheduleReconnect();
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private PendingRequest send(String method, JsonNode params, Duration timeout) {
        PendingRequest request = correlator.register(method, timeout);
        request.future().whenComplete((result, error) -> recordOutcome(request, error));

        MdcContext.setRequest(method, request.id());
        try {
            log.debug("Sending request {} ({})", request.id(), method);
            transport.write(codec.encodeRequest(request.id(), method, params));
        } catch (TransportException e) {
            correlator.fail(request.id(), e);
        } finally {
            MdcContext.clearRequest();
        }
        return request;
    }

    private void recordOutcome(PendingRequest request, Throwable error) {
        long elapsed = clock.elapsedMillisSince(request.startNanos());
        String outcome;
        if (error == null) {
            outcome = "success";
        } else if (error instanceof RequestTimeoutException) {
            outcome = "timeout";
            metrics.incrementRequestTimeouts(request.method());
        } else if (error instanceof ShuttingDownException) {
            outcome = "rejected";
        } else {
            outcome = "error";
        }
        metrics.recordRequest(request.method(), outcome, elapsed);
    }

    private JsonNode toParams(Object params) {
        if (params == null) {
            return null;
        }
        if (params instanceof JsonNode node) {
            return node;
        }
        return mapper.valueToTree(params);
    }

    private McpConnectionException notConnected() {
        if (state.isReconnectFailed()) {
            return new McpConnectionException("MCP server connection failed after "
                    + props.getReconnectAttempts() + " reconnect attempts; reinitialize required");
        }
        return new McpConnectionException("MCP server not connected");
    }

    private class TransportListener implements ProcessTransport.Listener {

        @Override
        public void onData(byte[] chunk) {
            handleData(chunk);
        }

        @Override
        public void onExit(int exitCode) {
            handleExit(exitCode);
        }
    }
}
