package com.shellrelay.mcp;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The "call a named tool with arguments" surface that the command layer depends on.
 */
public interface McpToolClient {

    CompletableFuture<ToolCallResult> callTool(String name, Map<String, Object> arguments);
}
