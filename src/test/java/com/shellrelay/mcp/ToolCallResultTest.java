package com.shellrelay.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ToolCallResult parse(String json) throws Exception {
        return new ToolCallResult(mapper.readTree(json));
    }

    @Test
    @DisplayName("joins text parts with newlines and skips other content types")
    void joinsTextParts() throws Exception {
        var result = parse("""
                {"content":[{"type":"text","text":"line one"},{"type":"image","data":"AAAA"},
                            {"type":"text","text":"line two"}]}
                """);

        assertEquals("line one\nline two", result.text());
        assertFalse(result.isError());
        assertEquals(0, result.exitCode());
    }

    @Test
    @DisplayName("error results default to exit code 1")
    void errorDefaultsExitCode() throws Exception {
        var result = parse("{\"content\":[{\"type\":\"text\",\"text\":\"bash: foo: command not found\"}],\"isError\":true}");

        assertTrue(result.isError());
        assertEquals(1, result.exitCode());
    }

    @Test
    @DisplayName("metadata exit code wins")
    void metadataExitCode() throws Exception {
        var result = parse("{\"content\":[],\"isError\":true,\"metadata\":{\"exitCode\":127}}");

        assertEquals(127, result.exitCode());
        assertEquals("", result.text());
    }

    @Test
    @DisplayName("missing result is empty")
    void nullResult() {
        var result = new ToolCallResult(null);

        assertEquals("", result.text());
        assertFalse(result.isError());
    }
}
