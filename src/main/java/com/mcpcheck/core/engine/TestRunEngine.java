package com.mcpcheck.core.engine;

import com.mcpcheck.core.logging.MdcContext;
import com.mcpcheck.core.metrics.RunMetrics;
import com.mcpcheck.core.plugin.PluginCatalog;
import com.mcpcheck.core.report.Report;
import com.mcpcheck.core.report.ResultAggregator;
import com.mcpcheck.core.scheduler.DependencyResolver;
import com.mcpcheck.mcp.McpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.Year;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a plugin catalog against a session: resolve order, execute, aggregate.
 * <p>
 * Plugin failures never surface as exceptions here; the returned {@link Report}
 * and its exit status are the only aggregate signal.
 */
@Service
public class TestRunEngine {

    private static final Logger log = LoggerFactory.getLogger(TestRunEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final DependencyResolver resolver;
    private final PluginExecutor executor;
    private final RunMetrics metrics;

    public TestRunEngine(DependencyResolver resolver, PluginExecutor executor, RunMetrics metrics) {
        this.resolver = resolver;
        this.executor = executor;
        this.metrics = metrics;
    }

    public Report run(McpSession session, PluginCatalog catalog) {
        return run(session, catalog, null, null, RunListener.NONE, new CancellationSignal());
    }

    /**
     * Runs every plugin in the catalog once.
     *
     * @param session  the session handed to each plugin
     * @param catalog  plugins for this run
     * @param target   server URL recorded in the report (nullable)
     * @param timeout  default per-plugin timeout for this run, or null for the configured one
     * @param listener progress observer
     * @param signal   cooperative cancellation flag
     * @return the assembled report
     */
    public Report run(McpSession session, PluginCatalog catalog, String target, Duration timeout,
                      RunListener listener, CancellationSignal signal) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            var resolution = resolver.resolve(catalog);
            log.info("Run {}: {} plugin(s), order {}", runId, catalog.size(), resolution.orderedNames());
            listener.onRunStarted(runId, resolution);

            var result = executor.execute(session, resolution.order(),
                    timeout != null ? timeout : executor.getDefaultTimeout(), listener, signal);
            result.outcomes().forEach(metrics::recordOutcome);

            var report = new ResultAggregator()
                    .addAll(result.outcomes())
                    .toReport(target, result.cancelled(), Instant.now());
            metrics.recordRun(report);

            log.info("Run {} finished: {} total, {} passed, {} failed{}", runId,
                    report.summary().total(), report.summary().passed(), report.summary().failed(),
                    report.cancelled() ? " (cancelled)" : "");
            listener.onRunFinished(report);
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private String generateRunId() {
        return String.format("RUN-%d-%04d", Year.now().getValue(), RUN_COUNTER.incrementAndGet());
    }
}
