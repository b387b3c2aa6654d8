package com.mcpcheck.core.metrics;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.core.report.Report;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for test runs.
 */
@Service
public class RunMetrics {

    private final MeterRegistry registry;

    public RunMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOutcome(Outcome outcome) {
        String state = outcome.state().name().toLowerCase();
        Counter.builder("mcpcheck.plugin.outcomes")
                .tag("state", state)
                .register(registry)
                .increment();
        if (outcome.durationMs() != null) {
            Timer.builder("mcpcheck.plugin.duration")
                    .tag("operation", String.valueOf(outcome.targetOperation()))
                    .tag("state", state)
                    .register(registry)
                    .record(Duration.ofMillis(outcome.durationMs()));
        }
    }

    public void recordRun(Report report) {
        String result;
        if (report.cancelled()) {
            result = "cancelled";
        } else {
            result = report.exitStatus() == 0 ? "passed" : "failed";
        }
        Counter.builder("mcpcheck.runs.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
