package com.shellrelay.mcp;

/**
 * The server answered a request with a JSON-RPC {@code error} member.
 * <p>
 * The kind is left open so the classifier decides from the server's message
 * (unknown tool, invalid arguments, timeout reported by the tool, ...).
 */
public class McpRemoteException extends McpException {

    private final Integer code;

    public McpRemoteException(String message, Integer code) {
        super(null, message);
        this.code = code;
    }

    /**
     * @return the JSON-RPC error code, or {@code null} when the server sent none
     */
    public Integer getCode() {
        return code;
    }
}
