package com.enclave.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Enclave-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setContainer(String containerId, String operation) {
        MDC.put("containerId", shortId(containerId));
        MDC.put("operation", operation);
    }

    /** Removes only the keys set by {@link #setContainer}; an enclosing session stays. */
    public static void clearContainer() {
        MDC.remove("containerId");
        MDC.remove("operation");
    }

    public static void clearSession() {
        MDC.remove("sessionId");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("containerId");
        MDC.remove("operation");
    }

    static String shortId(String containerId) {
        if (containerId == null) return "";
        return containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }
}
