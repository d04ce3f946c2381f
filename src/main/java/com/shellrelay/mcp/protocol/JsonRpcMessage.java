package com.shellrelay.mcp.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalLong;

/**
 * One decoded JSON-RPC 2.0 message from the server.
 * <p>
 * Absent members are {@code null}. A message with a {@code method} and no {@code id}
 * is a notification; one with an {@code id} and no {@code method} is a response.
 */
public record JsonRpcMessage(JsonNode id, String method, JsonNode params, JsonNode result, JsonNode error) {

    public boolean isNotification() {
        return method != null && (id == null || id.isNull());
    }

    public boolean isResponse() {
        return method == null && id != null && !id.isNull();
    }

    public boolean hasError() {
        return error != null && !error.isNull();
    }

    /**
     * The id as a number; our ids are always integral, so anything else cannot
     * belong to a pending request.
     */
    public OptionalLong numericId() {
        if (id == null || !id.canConvertToLong() || !id.isIntegralNumber()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(id.asLong());
    }

    public String errorMessage() {
        if (!hasError()) {
            return null;
        }
        JsonNode message = error.get("message");
        return message != null && message.isTextual() ? message.asText() : error.toString();
    }

    public Integer errorCode() {
        if (!hasError()) {
            return null;
        }
        JsonNode code = error.get("code");
        return code != null && code.canConvertToInt() ? code.asInt() : null;
    }
}
