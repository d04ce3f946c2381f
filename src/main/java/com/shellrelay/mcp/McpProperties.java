package com.shellrelay.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the MCP server child process and the client talking to it.
 *
 * <pre>
 * shellrelay:
 *   mcp:
 *     executable: node
 *     args: [/opt/DesktopCommanderMCP/build/index.js]
 *     container-name: kali-pentest
 *     env:
 *       GOTTY_WS_URL: ws://kali-pentest:8080/ws
 *     reconnect-attempts: 5
 *     reconnect-delay-ms: 1000
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "shellrelay.mcp")
public class McpProperties {

    private String executable = "node";
    private List<String> args = new ArrayList<>();
    private String containerName = "";
    private String hostTool = "docker";
    private String containerUser = "pentester";
    private Map<String, String> env = new LinkedHashMap<>();
    private long requestTimeoutMs = 30_000;
    private long startupGraceMs = 1_000;
    private int reconnectAttempts = 5;
    private long reconnectDelayMs = 1_000;
    private long maxReconnectDelayMs = 30_000;
    private String protocolVersion = "2024-11-05";
    private String clientName = "shellrelay";
    private String clientVersion = "0.1.0";
    private boolean autoConnect = false;
    private HealthCheck healthCheck = new HealthCheck();

    public String getExecutable() { return executable; }
    public void setExecutable(String executable) { this.executable = executable; }
    public List<String> getArgs() { return args; }
    public void setArgs(List<String> args) { this.args = args; }
    public String getContainerName() { return containerName; }
    public void setContainerName(String containerName) { this.containerName = containerName; }
    public String getHostTool() { return hostTool; }
    public void setHostTool(String hostTool) { this.hostTool = hostTool; }
    public String getContainerUser() { return containerUser; }
    public void setContainerUser(String containerUser) { this.containerUser = containerUser; }
    public Map<String, String> getEnv() { return env; }
    public void setEnv(Map<String, String> env) { this.env = env; }
    public long getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    public long getStartupGraceMs() { return startupGraceMs; }
    public void setStartupGraceMs(long startupGraceMs) { this.startupGraceMs = startupGraceMs; }
    public int getReconnectAttempts() { return reconnectAttempts; }
    public void setReconnectAttempts(int reconnectAttempts) { this.reconnectAttempts = reconnectAttempts; }
    public long getReconnectDelayMs() { return reconnectDelayMs; }
    public void setReconnectDelayMs(long reconnectDelayMs) { this.reconnectDelayMs = reconnectDelayMs; }
    public long getMaxReconnectDelayMs() { return maxReconnectDelayMs; }
    public void setMaxReconnectDelayMs(long maxReconnectDelayMs) { this.maxReconnectDelayMs = maxReconnectDelayMs; }
    public String getProtocolVersion() { return protocolVersion; }
    public void setProtocolVersion(String protocolVersion) { this.protocolVersion = protocolVersion; }
    public String getClientName() { return clientName; }
    public void setClientName(String clientName) { this.clientName = clientName; }
    public String getClientVersion() { return clientVersion; }
    public void setClientVersion(String clientVersion) { this.clientVersion = clientVersion; }
    public boolean isAutoConnect() { return autoConnect; }
    public void setAutoConnect(boolean autoConnect) { this.autoConnect = autoConnect; }
    public HealthCheck getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheck healthCheck) { this.healthCheck = healthCheck; }

    public Duration requestTimeout() { return Duration.ofMillis(requestTimeoutMs); }
    public Duration startupGrace() { return Duration.ofMillis(startupGraceMs); }

    /**
     * Returns {@code true} when the server runs inside a container and is launched
     * through the host tool rather than directly.
     */
    public boolean usesContainer() {
        return containerName != null && !containerName.isBlank();
    }

    /**
     * Checks the settings that would make the client unusable, reporting every
     * problem at once.
     *
     * @throws IllegalStateException listing all problems found
     */
    public void validate() {
        var errors = new ArrayList<String>();
        if (executable == null || executable.isBlank()) {
            errors.add("MCP server executable is required");
        }
        if (requestTimeoutMs < 1000) {
            errors.add("MCP request timeout must be at least 1000ms");
        }
        if (reconnectAttempts < 0) {
            errors.add("MCP reconnect attempts must be non-negative");
        }
        if (reconnectDelayMs <= 0) {
            errors.add("MCP reconnect delay must be positive");
        }
        if (usesContainer() && (hostTool == null || hostTool.isBlank())) {
            errors.add("Host tool is required when a container name is set");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed:\n" + String.join("\n", errors));
        }
    }

    public static class HealthCheck {
        private boolean enabled = true;
        private long intervalMs = 10_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }
}
