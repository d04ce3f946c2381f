package com.shellrelay.mcp;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the MCP server connection.
 * Reads the client's connection state; does not send traffic.
 */
@Component
public class McpHealthIndicator implements HealthIndicator {

    private final McpClient client;

    public McpHealthIndicator(McpClient client) {
        this.client = client;
    }

    @Override
    public Health health() {
        ConnectionStatus status = client.getStatus();

        Health.Builder builder;
        if (status.connected() && status.serverRunning()) {
            builder = Health.up().withDetail("state", "CONNECTED");
        } else if (status.reconnectFailed()) {
            builder = Health.down().withDetail("state", "FAILED");
        } else if (status.reconnecting()) {
            builder = Health.status("DEGRADED").withDetail("state", "RECONNECTING");
        } else {
            builder = Health.down().withDetail("state", "DISCONNECTED");
        }

        if (status.pid() != null) {
            builder.withDetail("pid", status.pid());
        }
        return builder
                .withDetail("reconnectCount", status.reconnectCount())
                .withDetail("pendingRequests", status.pendingRequests())
                .build();
    }
}
