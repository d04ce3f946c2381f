package com.shellrelay.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing ShellRelay-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setAttempt(String sessionId, int attempt) {
        MDC.put("sessionId", sessionId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void setRequest(String method, long requestId) {
        MDC.put("rpcMethod", method);
        MDC.put("rpcId", String.valueOf(requestId));
    }

    public static void clearRequest() {
        MDC.remove("rpcMethod");
        MDC.remove("rpcId");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("attempt");
        clearRequest();
    }
}
