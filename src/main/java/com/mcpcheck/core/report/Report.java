package com.mcpcheck.core.report;

import com.mcpcheck.core.plugin.Outcome;

import java.time.Instant;
import java.util.List;

/**
 * Result of one run: outcomes in execution order plus summary counts.
 *
 * @param timestamp when the report was assembled
 * @param target    URL of the server under test, or null
 * @param outcomes  one outcome per processed plugin, in execution order
 * @param summary   counts derived from {@code outcomes}
 * @param cancelled whether the run stopped early; outcomes then cover only the plugins processed
 */
public record Report(
    Instant timestamp,
    String target,
    List<Outcome> outcomes,
    Summary summary,
    boolean cancelled
) {
    public Report {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Process exit status: 0 when nothing failed, 1 otherwise.
     */
    public int exitStatus() {
        return summary.failed() == 0 ? 0 : 1;
    }
}
