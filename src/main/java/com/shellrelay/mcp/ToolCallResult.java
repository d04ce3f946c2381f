package com.shellrelay.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a {@code tools/call} request, wrapping the raw {@code result} member.
 */
public record ToolCallResult(JsonNode raw) {

    public ToolCallResult {
        raw = raw != null ? raw : NullNode.getInstance();
    }

    /**
     * The {@code text} content parts joined by newlines, in order.
     */
    public String text() {
        JsonNode content = raw.path("content");
        if (!content.isArray()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode part : content) {
            if ("text".equals(part.path("type").asText()) && part.has("text")) {
                parts.add(part.get("text").asText());
            }
        }
        return String.join("\n", parts);
    }

    public boolean isError() {
        return raw.path("isError").asBoolean(false);
    }

    /**
     * The exit code reported in {@code metadata.exitCode}, else 1 for error results and 0 otherwise.
     */
    public int exitCode() {
        JsonNode exitCode = raw.path("metadata").path("exitCode");
        if (exitCode.canConvertToInt()) {
            return exitCode.asInt();
        }
        return isError() ? 1 : 0;
    }
}
