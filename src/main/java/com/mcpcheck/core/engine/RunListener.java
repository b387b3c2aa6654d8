package com.mcpcheck.core.engine;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.core.plugin.TestPlugin;
import com.mcpcheck.core.report.Report;
import com.mcpcheck.core.scheduler.Resolution;

/**
 * Observer for run progress. Callbacks are made on the thread driving the run,
 * in execution order. Used for progress output only.
 */
public interface RunListener {

    RunListener NONE = new RunListener() {};

    default void onRunStarted(String runId, Resolution resolution) {}

    /** Called just before a plugin is invoked. Not called for skipped plugins. */
    default void onPluginStarted(TestPlugin plugin) {}

    default void onOutcome(TestPlugin plugin, Outcome outcome) {}

    default void onRunFinished(Report report) {}
}
