package com.shellrelay.mcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of the server's {@code tools/list} response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolDescriptor(String name, String description, JsonNode inputSchema) {}
