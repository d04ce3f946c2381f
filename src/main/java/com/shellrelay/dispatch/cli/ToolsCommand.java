package com.shellrelay.dispatch.cli;

import com.shellrelay.core.error.ErrorClassifier;
import com.shellrelay.mcp.McpClient;
import com.shellrelay.mcp.McpException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * CLI command: shellrelay tools
 * <p>
 * Connects to the MCP server and lists the tools it offers.
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "List tools offered by the MCP server")
@Component
public class ToolsCommand implements Callable<Integer> {

    private final McpClient client;
    private final ErrorClassifier classifier;

    public ToolsCommand(McpClient client, ErrorClassifier classifier) {
        this.client = client;
        this.classifier = classifier;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            client.start();
            var tools = client.listTools().join();
            if (tools.isEmpty()) {
                ConsoleOutput.info("The server offers no tools");
                return 0;
            }
            for (var tool : tools) {
                ConsoleOutput.success(tool.name()
                        + (tool.description() != null ? "  " + tool.description() : ""));
            }
            ConsoleOutput.info(tools.size() + " tool(s) available");
            return 0;
        } catch (McpException | CompletionException e) {
            ConsoleOutput.failure(classifier.classify(e));
            return 1;
        }
    }
}
