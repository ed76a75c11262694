package com.agentgate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing AgentGate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTenant(String tenantId) {
        MDC.put("tenantId", tenantId);
    }

    public static void setInstance(String poolKey) {
        MDC.put("poolKey", poolKey);
    }

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void clearSession() {
        MDC.remove("sessionId");
    }

    public static void clear() {
        MDC.remove("tenantId");
        MDC.remove("poolKey");
        MDC.remove("sessionId");
    }
}
