package com.shellrelay.mcp;

/**
 * Mutable connection bookkeeping owned by {@link McpClient}.
 * Writes happen under the client's lock; reads may come from any thread.
 */
final class ConnectionState {

    private volatile boolean connected;
    private volatile int reconnectCount;
    private volatile boolean reconnectFailed;
    private volatile boolean reconnectPending;

    boolean isConnected() { return connected; }
    int reconnectCount() { return reconnectCount; }
    boolean isReconnectFailed() { return reconnectFailed; }
    boolean isReconnectPending() { return reconnectPending; }

    void markConnected() {
        connected = true;
        reconnectCount = 0;
        reconnectFailed = false;
    }

    void markDisconnected() {
        connected = false;
    }

    int nextReconnectAttempt() {
        reconnectPending = true;
        return ++reconnectCount;
    }

    void reconnectStarted() {
        reconnectPending = false;
    }

    void markReconnectFailed() {
        reconnectPending = false;
        reconnectFailed = true;
    }

    void reset() {
        connected = false;
        reconnectCount = 0;
        reconnectFailed = false;
        reconnectPending = false;
    }
}
