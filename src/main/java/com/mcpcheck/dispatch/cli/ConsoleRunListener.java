package com.mcpcheck.dispatch.cli;

import com.mcpcheck.core.engine.RunListener;
import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.core.plugin.TestPlugin;
import com.mcpcheck.core.scheduler.Resolution;

/**
 * Prints PASS/FAIL/SKIP progress lines as plugins complete.
 */
public class ConsoleRunListener implements RunListener {

    @Override
    public void onRunStarted(String runId, Resolution resolution) {
        ConsoleOutput.section("Running Tests (" + runId + ")");
        if (!resolution.unresolved().isEmpty()) {
            ConsoleOutput.warn("Unknown dependency reference(s) ignored: " + resolution.unresolved());
        }
        if (resolution.hasCycles()) {
            ConsoleOutput.warn("Dependency cycle(s): " + resolution.cycles());
        }
    }

    @Override
    public void onOutcome(TestPlugin plugin, Outcome outcome) {
        ConsoleOutput.outcome(outcome);
    }
}
