package com.mcpcheck.core.plugin;

/**
 * Terminal state of a plugin within a single run.
 * <p>
 * A plugin starts out pending and either moves straight to {@link #SKIPPED}
 * (a hard dependency failed) or runs and ends in {@link #PASSED} or {@link #FAILED}.
 */
public enum PluginState {
    PASSED,
    FAILED,
    SKIPPED
}
