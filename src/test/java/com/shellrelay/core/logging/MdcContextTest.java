package com.shellrelay.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setSession puts sessionId in MDC")
    void setSession() {
        MdcContext.setSession("s1");
        assertEquals("s1", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("setAttempt puts sessionId and attempt in MDC")
    void setAttempt() {
        MdcContext.setAttempt("s1", 2);
        assertEquals("s1", MDC.get("sessionId"));
        assertEquals("2", MDC.get("attempt"));
    }

    @Test
    @DisplayName("clearRequest removes only the request keys")
    void clearRequest() {
        MdcContext.setSession("s1");
        MdcContext.setRequest("tools/call", 7);
        assertEquals("tools/call", MDC.get("rpcMethod"));
        assertEquals("7", MDC.get("rpcId"));

        MdcContext.clearRequest();
        assertNull(MDC.get("rpcMethod"));
        assertNull(MDC.get("rpcId"));
        assertEquals("s1", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("clear removes all shellrelay MDC keys")
    void clear() {
        MdcContext.setAttempt("s1", 3);
        MdcContext.setRequest("initialize", 1);
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("attempt"));
        assertNull(MDC.get("rpcMethod"));
        assertNull(MDC.get("rpcId"));
    }
}
