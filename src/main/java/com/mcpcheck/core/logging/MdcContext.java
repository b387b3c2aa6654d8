package com.mcpcheck.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing mcp-check MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setPlugin(String pluginName, String targetOperation) {
        MDC.put("pluginName", pluginName);
        MDC.put("targetOperation", targetOperation);
    }

    public static void clearPlugin() {
        MDC.remove("pluginName");
        MDC.remove("targetOperation");
    }

    public static void clear() {
        MDC.remove("runId");
        clearPlugin();
    }
}
