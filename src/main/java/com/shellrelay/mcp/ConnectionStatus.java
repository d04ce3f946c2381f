package com.shellrelay.mcp;

/**
 * Point-in-time view of the MCP connection.
 *
 * @param connected        handshake completed and no exit observed since
 * @param serverRunning    the child process is alive
 * @param pid              child pid, or {@code null} when unknown
 * @param reconnectCount   consecutive reconnect attempts since the last successful handshake
 * @param pendingRequests  requests awaiting a response
 * @param reconnecting     a reconnect is scheduled
 * @param reconnectFailed  the reconnect budget is exhausted; {@link McpClient#reinitialize()} is required
 */
public record ConnectionStatus(
    boolean connected,
    boolean serverRunning,
    Long pid,
    int reconnectCount,
    int pendingRequests,
    boolean reconnecting,
    boolean reconnectFailed
) {}
