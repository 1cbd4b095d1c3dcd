package com.enclave.core.logging;

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
        MdcContext.setSession("session-1700000000000-ab12cd34");
        assertEquals("session-1700000000000-ab12cd34", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("setContainer shortens the id to 12 characters")
    void setContainer() {
        MdcContext.setContainer("0123456789abcdef0123456789abcdef", "exec");
        assertEquals("0123456789ab", MDC.get("containerId"));
        assertEquals("exec", MDC.get("operation"));
    }

    @Test
    void shortIdHandlesShortAndNullIds() {
        assertEquals("abc", MdcContext.shortId("abc"));
        assertEquals("", MdcContext.shortId(null));
    }

    @Test
    @DisplayName("clear removes all enclave MDC keys")
    void clear() {
        MdcContext.setSession("s");
        MdcContext.setContainer("c", "start");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("containerId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("clearContainer keeps an enclosing session")
    void clearContainerKeepsSession() {
        MdcContext.setSession("repo-1");
        MdcContext.setContainer("c", "exec");

        MdcContext.clearContainer();

        assertEquals("repo-1", MDC.get("sessionId"));
        assertNull(MDC.get("containerId"));
        assertNull(MDC.get("operation"));

        MdcContext.clearSession();
        assertNull(MDC.get("sessionId"));
    }
}
