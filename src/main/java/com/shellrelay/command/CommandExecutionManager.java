package com.shellrelay.command;

import com.shellrelay.core.error.ErrorClassifier;
import com.shellrelay.core.error.ErrorInfo;
import com.shellrelay.core.error.ErrorKind;
import com.shellrelay.core.events.EventBus;
import com.shellrelay.core.events.RelayEvent;
import com.shellrelay.core.logging.MdcContext;
import com.shellrelay.core.metrics.RelayMetrics;
import com.shellrelay.core.time.MonotonicClock;
import com.shellrelay.core.time.Sleeper;
import com.shellrelay.core.time.SystemMonotonicClock;
import com.shellrelay.mcp.McpException;
import com.shellrelay.mcp.McpToolClient;
import com.shellrelay.mcp.ToolCallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Runs a command for a session through the MCP command tool with retry,
 * per-attempt timeout and loop detection.
 * <p>
 * Per call: loop check, then attempts up to {@code max-retries} with a fixed
 * delay between them. A session runs one command at a time; a second call while
 * one is pending fails with {@link SessionBusyException}. All other failures are
 * returned inside the {@link CommandResult}.
 * <p>
 * Progress is published as session events: {@code command.progress} before each
 * attempt, {@code command.timeout} when an attempt times out, {@code command.retry}
 * before each retry delay, {@code command.loop_detected} and {@code command.completed}.
 */
@Service
public class CommandExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutionManager.class);

    private final McpToolClient toolClient;
    private final SessionCommandStore store;
    private final CommandProperties props;
    private final ErrorClassifier classifier;
    private final EventBus eventBus;
    private final RelayMetrics metrics;
    private final Sleeper sleeper;
    private final MonotonicClock clock;

    @Autowired
    public CommandExecutionManager(McpToolClient toolClient, SessionCommandStore store, CommandProperties props,
                                   ErrorClassifier classifier, EventBus eventBus, RelayMetrics metrics) {
        this(toolClient, store, props, classifier, eventBus, metrics, Sleeper.system(), SystemMonotonicClock.INSTANCE);
    }

    public CommandExecutionManager(McpToolClient toolClient, SessionCommandStore store, CommandProperties props,
                                   ErrorClassifier classifier, EventBus eventBus, RelayMetrics metrics,
                                   Sleeper sleeper, MonotonicClock clock) {
        this.toolClient = toolClient;
        this.store = store;
        this.props = props;
        this.classifier = classifier;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Same as {@link #execute(String, String)}, with {@code observer} subscribed to the
     * session's events for the duration of the call.
     */
    public CommandResult execute(String sessionId, String command, Consumer<RelayEvent> observer) {
        try (var subscription = eventBus.subscribe(sessionId, observer)) {
            return execute(sessionId, command);
        }
    }

    /**
     * Executes {@code command} for {@code sessionId}, blocking through all attempts.
     *
     * @throws SessionBusyException if the session already has a command in progress
     */
    public CommandResult execute(String sessionId, String command) {
        long start = clock.nowNanos();
        MdcContext.setSession(sessionId);
        try {
            int occurrences = store.countOccurrences(sessionId, command);
            if (occurrences >= props.getMaxSameCommandRetries()) {
                return rejectLoop(sessionId, command, occurrences, start);
            }

            PendingCommand pending = PendingCommand.start(command);
            if (!store.beginCommand(sessionId, pending)) {
                throw new SessionBusyException(sessionId, store.pendingCommand(sessionId).orElse(null));
            }
            try {
                store.appendHistory(sessionId, command);
                return runAttempts(sessionId, pending, start);
            } finally {
                store.endCommand(sessionId, pending.id());
            }
        } finally {
            MdcContext.clear();
        }
    }

    public boolean isCommandPending(String sessionId) {
        return store.pendingCommand(sessionId).isPresent();
    }

    public Optional<PendingCommand> getPendingCommand(String sessionId) {
        return store.pendingCommand(sessionId);
    }

    public List<String> getSessionHistory(String sessionId) {
        return store.history(sessionId);
    }

    public void clearSession(String sessionId) {
        store.clearSession(sessionId);
        log.info("Cleared command history for session {}", sessionId);
    }

    private CommandResult rejectLoop(String sessionId, String command, int occurrences, long start) {
        ErrorInfo error = classifier.loopDetected(command, occurrences);
        log.warn("Loop detected for session {}: \"{}\" already executed {} times", sessionId, command, occurrences);
        metrics.incrementLoopDetections();
        eventBus.publish(RelayEvent.session(RelayEvent.COMMAND_LOOP_DETECTED, sessionId,
                Map.of("command", command, "count", occurrences)));
        return CommandResult.failure(error, "", -1, 0, clock.elapsedMillisSince(start));
    }

    private CommandResult runAttempts(String sessionId, PendingCommand pending, long start) {
        String command = pending.command();
        int maxAttempts = Math.max(1, props.getMaxRetries());
        Duration attemptTimeout = props.attemptTimeout();
        Throwable lastFailure = null;
        ToolCallResult lastResult = null;
        int attempts = 0;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attempts = attempt;
            MdcContext.setAttempt(sessionId, attempt);
            publish(RelayEvent.COMMAND_PROGRESS, sessionId,
                    Map.of("command", command, "attempt", attempt, "maxAttempts", maxAttempts));
            log.info("Executing command (attempt {}/{}): {}", attempt, maxAttempts, command);

            CompletableFuture<ToolCallResult> call = toolClient.callTool(props.getToolName(), Map.of("command", command));
            try {
                ToolCallResult result = call.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!result.isError()) {
                    return succeed(sessionId, command, result, attempt, start);
                }
                lastResult = result;
                lastFailure = new McpException(ErrorKind.TOOL_CALL,
                        result.text().isBlank() ? "Tool reported an error" : result.text());
            } catch (TimeoutException e) {
                call.cancel(true);
                lastFailure = new CommandTimeoutException(command, attemptTimeout);
                publish(RelayEvent.COMMAND_TIMEOUT, sessionId,
                        Map.of("command", command, "attempt", attempt, "timeoutMs", attemptTimeout.toMillis()));
            } catch (ExecutionException e) {
                lastFailure = e.getCause() != null ? e.getCause() : e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastFailure = new McpException(ErrorKind.TOOL_CALL, "Command execution interrupted", e);
                break;
            }
            log.warn("Attempt {}/{} failed: {}", attempt, maxAttempts, lastFailure.getMessage());

            if (attempt < maxAttempts) {
                store.updateRetryCount(sessionId, pending.id(), attempt);
                publish(RelayEvent.COMMAND_RETRY, sessionId, Map.of(
                        "command", command,
                        "attempt", attempt,
                        "nextAttempt", attempt + 1,
                        "delayMs", props.getRetryDelayMs(),
                        "error", String.valueOf(lastFailure.getMessage())));
                try {
                    sleeper.sleep(props.retryDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastFailure = new McpException(ErrorKind.TOOL_CALL, "Command execution interrupted", e);
                    break;
                }
            }
        }

        return fail(sessionId, command, lastFailure, lastResult, attempts, start);
    }

    private CommandResult succeed(String sessionId, String command, ToolCallResult result, int attempts, long start) {
        long duration = clock.elapsedMillisSince(start);
        metrics.recordCommand(true, attempts, duration);
        log.info("Command succeeded after {} attempt(s) in {}ms", attempts, duration);
        publish(RelayEvent.COMMAND_COMPLETED, sessionId,
                Map.of("command", command, "success", true, "attempts", attempts, "durationMs", duration));
        return CommandResult.success(result.text(), result.exitCode(), attempts, duration);
    }

    private CommandResult fail(String sessionId, String command, Throwable failure, ToolCallResult lastResult,
                               int attempts, long start) {
        long duration = clock.elapsedMillisSince(start);
        var details = new LinkedHashMap<String, Object>();
        details.put("command", command);
        details.put("attempts", attempts);
        ErrorInfo error = classifier.classify(failure, details);

        metrics.recordCommand(false, attempts, duration);
        log.error("Command failed after {} attempt(s): {} ({})", attempts, error.message(), error.detail());
        publish(RelayEvent.COMMAND_COMPLETED, sessionId, Map.of(
                "command", command,
                "success", false,
                "attempts", attempts,
                "durationMs", duration,
                "errorKind", error.kind().code()));

        String output = lastResult != null ? lastResult.text() : "";
        int exitCode = lastResult != null ? lastResult.exitCode() : -1;
        return CommandResult.failure(error, output, exitCode, attempts, duration);
    }

    private void publish(String type, String sessionId, Map<String, Object> payload) {
        eventBus.publish(RelayEvent.session(type, sessionId, payload));
    }
}
