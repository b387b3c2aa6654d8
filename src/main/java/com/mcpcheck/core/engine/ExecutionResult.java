package com.mcpcheck.core.engine;

import com.mcpcheck.core.plugin.Outcome;

import java.util.List;

/**
 * Outcomes produced by the executor, in execution order.
 *
 * @param outcomes  one outcome per processed plugin
 * @param cancelled whether the run stopped early on a cancellation signal
 */
public record ExecutionResult(List<Outcome> outcomes, boolean cancelled) {
    public ExecutionResult {
        outcomes = List.copyOf(outcomes);
    }
}
