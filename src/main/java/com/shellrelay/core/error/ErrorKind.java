package com.shellrelay.core.error;

/**
 * Closed failure taxonomy shared by the transport, the RPC layer and the
 * command execution layer.
 */
public enum ErrorKind {
    CONNECTION("connection"),
    TOOL_CALL("tool_call"),
    TIMEOUT("timeout"),
    PROTOCOL("protocol"),
    /** Produced only by the command execution layer, never by the classifier rules. */
    LOOP_DETECTED("loop_detected");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
