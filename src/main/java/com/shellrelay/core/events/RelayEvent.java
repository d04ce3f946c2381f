package com.shellrelay.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle or command-progress event published on the {@link EventBus}.
 *
 * @param eventType event type (e.g. "connection.reconnecting", "command.retry")
 * @param sessionId the session this event belongs to (null for connection-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RelayEvent(
    String eventType,
    String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String CONNECTED = "connection.connected";
    public static final String DISCONNECTED = "connection.disconnected";
    public static final String RECONNECTING = "connection.reconnecting";
    public static final String RECONNECT_FAILED = "connection.reconnect_failed";
    public static final String UNHEALTHY = "connection.unhealthy";
    public static final String SHUTDOWN = "connection.shutdown";
    public static final String NOTIFICATION = "mcp.notification";
    public static final String COMMAND_PROGRESS = "command.progress";
    public static final String COMMAND_RETRY = "command.retry";
    public static final String COMMAND_TIMEOUT = "command.timeout";
    public static final String COMMAND_LOOP_DETECTED = "command.loop_detected";
    public static final String COMMAND_COMPLETED = "command.completed";

    public static RelayEvent connection(String eventType, Map<String, Object> payload) {
        return new RelayEvent(eventType, null, payload, Instant.now());
    }

    public static RelayEvent session(String eventType, String sessionId, Map<String, Object> payload) {
        return new RelayEvent(eventType, sessionId, payload, Instant.now());
    }
}
