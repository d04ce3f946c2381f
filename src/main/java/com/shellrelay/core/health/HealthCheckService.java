package com.shellrelay.core.health;

import com.shellrelay.mcp.ConnectionStatus;
import com.shellrelay.mcp.ContainerProbe;
import com.shellrelay.mcp.McpClient;
import com.shellrelay.mcp.McpProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final McpClient mcpClient;
    private final McpProperties props;
    private final ContainerProbe containerProbe;

    public HealthCheckService(
            McpClient mcpClient,
            McpProperties props,
            @Autowired(required = false) ContainerProbe containerProbe) {
        this.mcpClient = mcpClient;
        this.props = props;
        this.containerProbe = containerProbe;
    }

    public List<HealthStatus> checkAll() {
        var status = mcpClient.getStatus();
        var results = new ArrayList<HealthStatus>();
        results.add(checkConnection(status));
        results.add(checkProcess(status));
        results.add(checkContainer());
        return results;
    }

    private HealthStatus checkConnection(ConnectionStatus status) {
        var metadata = Map.of(
                "reconnectCount", String.valueOf(status.reconnectCount()),
                "pendingRequests", String.valueOf(status.pendingRequests()));
        if (status.connected()) {
            return new HealthStatus("mcp", HealthStatus.Status.UP, "Connected to MCP server", metadata);
        }
        if (status.reconnectFailed()) {
            return new HealthStatus("mcp", HealthStatus.Status.DOWN,
                    "Reconnect attempts exhausted; reinitialize required", metadata);
        }
        if (status.reconnecting()) {
            return new HealthStatus("mcp", HealthStatus.Status.DEGRADED,
                    "Reconnecting (attempt " + status.reconnectCount() + "/" + props.getReconnectAttempts() + ")",
                    metadata);
        }
        return new HealthStatus("mcp", HealthStatus.Status.DOWN, "Not connected", metadata);
    }

    private HealthStatus checkProcess(ConnectionStatus status) {
        if (status.serverRunning()) {
            return new HealthStatus("process", HealthStatus.Status.UP, "MCP server process running",
                    status.pid() != null ? Map.of("pid", String.valueOf(status.pid())) : Map.of());
        }
        return new HealthStatus("process", HealthStatus.Status.DOWN, "MCP server process not running", Map.of());
    }

    private HealthStatus checkContainer() {
        if (!props.usesContainer()) {
            return new HealthStatus("container", HealthStatus.Status.UP,
                    "Direct launch (no container configured)", Map.of());
        }
        var metadata = Map.of("container", props.getContainerName());
        if (containerProbe == null) {
            return new HealthStatus("container", HealthStatus.Status.DEGRADED,
                    "No container probe available", metadata);
        }
        try {
            if (containerProbe.isRunning(props.getContainerName())) {
                return new HealthStatus("container", HealthStatus.Status.UP, "Container running", metadata);
            }
            return new HealthStatus("container", HealthStatus.Status.DOWN, "Container not running", metadata);
        } catch (Exception e) {
            log.warn("Container health check failed: {}", e.getMessage());
            return new HealthStatus("container", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), metadata);
        }
    }
}
