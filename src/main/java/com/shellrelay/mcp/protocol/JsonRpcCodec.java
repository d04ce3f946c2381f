package com.shellrelay.mcp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Encodes outgoing JSON-RPC 2.0 frames and decodes incoming lines.
 */
public class JsonRpcCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcCodec.class);

    static final String JSONRPC_VERSION = "2.0";

    private final ObjectMapper mapper;

    public JsonRpcCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Decodes one line of server output.
     * <p>
     * Servers print banners and log lines on stdout too; anything that is not a JSON
     * object yields an empty result instead of an error.
     */
    public Optional<JsonRpcMessage> parse(String line) {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.info("Non-JSON output from MCP server: {}", line);
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.info("Non-JSON output from MCP server: {}", line);
            return Optional.empty();
        }
        JsonNode method = node.get("method");
        return Optional.of(new JsonRpcMessage(
                node.get("id"),
                method != null && method.isTextual() ? method.asText() : null,
                node.get("params"),
                node.get("result"),
                node.get("error")));
    }

    public byte[] encodeRequest(long id, String method, JsonNode params) {
        ObjectNode frame = mapper.createObjectNode();
        frame.put("jsonrpc", JSONRPC_VERSION);
        frame.put("id", id);
        frame.put("method", method);
        if (params != null) {
            frame.set("params", params);
        }
        return toFrame(frame);
    }

    public byte[] encodeNotification(String method, JsonNode params) {
        ObjectNode frame = mapper.createObjectNode();
        frame.put("jsonrpc", JSONRPC_VERSION);
        frame.put("method", method);
        if (params != null) {
            frame.set("params", params);
        }
        return toFrame(frame);
    }

    /** Answers a server-initiated request. */
    public byte[] encodeResult(JsonNode id, JsonNode result) {
        ObjectNode frame = mapper.createObjectNode();
        frame.put("jsonrpc", JSONRPC_VERSION);
        frame.set("id", id);
        frame.set("result", result);
        return toFrame(frame);
    }

    public byte[] encodeError(JsonNode id, int code, String message) {
        ObjectNode frame = mapper.createObjectNode();
        frame.put("jsonrpc", JSONRPC_VERSION);
        frame.set("id", id);
        frame.putObject("error").put("code", code).put("message", message);
        return toFrame(frame);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private byte[] toFrame(ObjectNode frame) {
        try {
            return (mapper.writeValueAsString(frame) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode JSON-RPC frame: " + e.getMessage(), e);
        }
    }
}
