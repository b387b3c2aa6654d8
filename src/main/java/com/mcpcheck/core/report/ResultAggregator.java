package com.mcpcheck.core.report;

import com.mcpcheck.core.plugin.Outcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates outcomes in execution order and folds them into a {@link Summary}.
 */
public class ResultAggregator {

    private final List<Outcome> outcomes = new ArrayList<>();

    public ResultAggregator add(Outcome outcome) {
        outcomes.add(outcome);
        return this;
    }

    public ResultAggregator addAll(List<Outcome> more) {
        outcomes.addAll(more);
        return this;
    }

    public Summary summary() {
        return summarize(outcomes);
    }

    public Report toReport(String target, boolean cancelled, Instant timestamp) {
        return new Report(timestamp, target, outcomes, summary(), cancelled);
    }

    public static Summary summarize(List<Outcome> outcomes) {
        int passed = 0;
        long durationMs = 0;
        for (Outcome outcome : outcomes) {
            if (outcome.passed()) passed++;
            if (outcome.durationMs() != null) durationMs += outcome.durationMs();
        }
        return new Summary(outcomes.size(), passed, outcomes.size() - passed, durationMs);
    }
}
