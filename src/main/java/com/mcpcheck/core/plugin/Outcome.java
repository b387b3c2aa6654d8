package com.mcpcheck.core.plugin;

import java.io.Serializable;

/**
 * Pass/fail record for a single plugin in a single run.
 *
 * @param pluginName      name of the plugin that produced (or was skipped for) this outcome
 * @param targetOperation MCP operation the plugin exercises, e.g. "tools/list" or a tool name
 * @param passed          whether the check passed
 * @param message         human-readable summary
 * @param error           captured error detail, or null
 * @param durationMs      wall-clock time spent in the plugin, or null when it never ran
 * @param state           terminal state; derived from {@code passed} when null
 */
public record Outcome(
    String pluginName,
    String targetOperation,
    boolean passed,
    String message,
    String error,
    Long durationMs,
    PluginState state
) implements Serializable {

    public Outcome {
        if (state == null) {
            state = passed ? PluginState.PASSED : PluginState.FAILED;
        }
        if (passed && state != PluginState.PASSED) {
            throw new IllegalArgumentException("A passed outcome must be in state PASSED, got " + state);
        }
    }

    public static Outcome pass(String pluginName, String targetOperation, String message, long durationMs) {
        return new Outcome(pluginName, targetOperation, true, message, null, durationMs, PluginState.PASSED);
    }

    public static Outcome fail(String pluginName, String targetOperation, String message,
                               String error, Long durationMs) {
        return new Outcome(pluginName, targetOperation, false, message, error, durationMs, PluginState.FAILED);
    }

    public static Outcome skipped(String pluginName, String targetOperation, String message) {
        return new Outcome(pluginName, targetOperation, false, message, null, null, PluginState.SKIPPED);
    }

    public boolean skipped() {
        return state == PluginState.SKIPPED;
    }
}
