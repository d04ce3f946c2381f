package com.shellrelay.dispatch.cli;

import com.shellrelay.mcp.McpClient;
import com.shellrelay.mcp.McpException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: shellrelay status [--connect]
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show MCP connection status")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--connect", "-c"}, description = "Connect to the MCP server before reporting")
    boolean connect;

    private final McpClient client;

    public StatusCommand(McpClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (connect && !client.isConnected()) {
            try {
                client.start();
            } catch (McpException e) {
                ConsoleOutput.error("Connect failed: " + e.getMessage());
            }
        }

        var status = client.getStatus();
        if (status.connected()) {
            ConsoleOutput.success("Connected");
        } else if (status.reconnectFailed()) {
            ConsoleOutput.error("Reconnect failed; reinitialize required");
        } else if (status.reconnecting()) {
            ConsoleOutput.info("Reconnecting");
        } else {
            ConsoleOutput.error("Not connected");
        }
        ConsoleOutput.info("Server process: " + (status.serverRunning() ? "running" : "stopped")
                + (status.pid() != null ? " (pid " + status.pid() + ")" : ""));
        ConsoleOutput.info("Reconnect attempts: " + status.reconnectCount());
        ConsoleOutput.info("Pending requests: " + status.pendingRequests());
    }
}
