package com.mcpcheck.core.engine;

import com.mcpcheck.core.logging.MdcContext;
import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.core.plugin.PluginConfigurationException;
import com.mcpcheck.core.plugin.TestPlugin;
import com.mcpcheck.mcp.McpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs plugins one at a time in a resolved order, producing exactly one outcome each.
 * <p>
 * A plugin whose hard dependency failed or was skipped is itself skipped without being
 * invoked, and its name joins the failed set so the skip cascades further. Exceptions and
 * timeouts are converted into failed outcomes at this boundary; nothing a plugin does can
 * abort the remaining sequence. The only early exit is a {@link CancellationSignal},
 * checked between plugins.
 * <p>
 * Each invocation runs on a single worker thread so the caller can wait with an upper
 * bound. On timeout the worker is interrupted and replaced, so a plugin that ignores the
 * interrupt does not delay the ones after it.
 */
@Service
public class PluginExecutor {

    private static final Logger log = LoggerFactory.getLogger(PluginExecutor.class);

    static final String TIMED_OUT = "timed out";
    static final String UNEXPECTED_EXCEPTION = "Unexpected exception during test";
    static final String SKIPPED_PREFIX = "skipped — failed dependency: ";

    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger(0);

    private final Duration defaultTimeout;

    @Autowired
    public PluginExecutor(RunnerProperties properties) {
        this(properties.getPluginTimeout());
    }

    public PluginExecutor(Duration defaultTimeout) {
        requirePositive(defaultTimeout, "Plugin timeout");
        this.defaultTimeout = defaultTimeout;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Executes the plugins in the given order against the session.
     *
     * @param session  shared session handle, passed to every plugin untouched
     * @param ordered  plugins in run order (see {@code DependencyResolver})
     * @param listener progress observer
     * @param signal   cooperative cancellation flag
     * @return outcomes in execution order, and whether the run was cancelled
     */
    public ExecutionResult execute(McpSession session, List<TestPlugin> ordered,
                                   RunListener listener, CancellationSignal signal) {
        return execute(session, ordered, defaultTimeout, listener, signal);
    }

    /**
     * As {@link #execute(McpSession, List, RunListener, CancellationSignal)} with a run-specific
     * default timeout. Plugins declaring their own {@link TestPlugin#timeout()} keep it.
     *
     * @throws IllegalArgumentException     if {@code timeout} is not positive
     * @throws PluginConfigurationException if a plugin declares a non-positive timeout;
     *                                      nothing runs in either case
     */
    public ExecutionResult execute(McpSession session, List<TestPlugin> ordered, Duration timeout,
                                   RunListener listener, CancellationSignal signal) {
        requirePositive(timeout, "Run timeout");
        for (TestPlugin plugin : ordered) {
            Duration own = plugin.timeout();
            if (own != null && (own.isNegative() || own.isZero())) {
                throw new PluginConfigurationException(
                        "Plugin " + plugin.name() + " declares a non-positive timeout: " + own);
            }
        }

        var outcomes = new ArrayList<Outcome>(ordered.size());
        Set<String> failed = new LinkedHashSet<>();
        var invoker = new Invoker();
        boolean cancelled = false;

        try {
            for (TestPlugin plugin : ordered) {
                if (signal.isCancelled()) {
                    log.info("Run cancelled, abandoning {} remaining plugin(s)",
                            ordered.size() - outcomes.size());
                    cancelled = true;
                    break;
                }

                MdcContext.setPlugin(plugin.name(), plugin.targetOperation());
                try {
                    Outcome outcome = runOne(session, plugin, failed, timeout, invoker, listener, signal);
                    if (!outcome.passed()) {
                        failed.add(plugin.name());
                    }
                    outcomes.add(outcome);
                    listener.onOutcome(plugin, outcome);
                } finally {
                    MdcContext.clearPlugin();
                }
            }
        } finally {
            invoker.shutdown();
        }

        return new ExecutionResult(outcomes, cancelled || invoker.interrupted);
    }

    private static void requirePositive(Duration timeout, String what) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException(what + " must be positive: " + timeout);
        }
    }

    private Outcome runOne(McpSession session, TestPlugin plugin, Set<String> failed, Duration runTimeout,
                           Invoker invoker, RunListener listener, CancellationSignal signal) {
        var failedDeps = new ArrayList<String>();
        if (plugin.hardDeps() != null) {
            for (String dep : plugin.hardDeps()) {
                if (failed.contains(dep) && !failedDeps.contains(dep)) {
                    failedDeps.add(dep);
                }
            }
        }
        if (!failedDeps.isEmpty()) {
            log.info("Skipping {}: failed dependency {}", plugin.name(), failedDeps);
            return Outcome.skipped(plugin.name(), plugin.targetOperation(),
                    SKIPPED_PREFIX + String.join(", ", failedDeps));
        }

        listener.onPluginStarted(plugin);
        Duration timeout = plugin.timeout() != null ? plugin.timeout() : runTimeout;
        log.debug("Running {} (timeout {})", plugin.name(), timeout);
        return invoker.invoke(session, plugin, timeout, signal);
    }

    /**
     * Owns the worker thread for one run.
     */
    private static final class Invoker {

        private ExecutorService worker = newWorker();
        private boolean interrupted;

        Outcome invoke(McpSession session, TestPlugin plugin, Duration timeout, CancellationSignal signal) {
            Map<String, String> mdc = MDC.getCopyOfContextMap();
            long start = System.currentTimeMillis();
            Future<Outcome> future = worker.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return plugin.run(session);
                } finally {
                    MDC.clear();
                }
            });

            try {
                Outcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (outcome == null) {
                    log.warn("Plugin {} returned no outcome", plugin.name());
                    return Outcome.fail(plugin.name(), plugin.targetOperation(), UNEXPECTED_EXCEPTION,
                            "Plugin returned no outcome", elapsedSince(start));
                }
                return outcome;
            } catch (TimeoutException e) {
                log.warn("Plugin {} timed out after {}", plugin.name(), timeout);
                future.cancel(true);
                replaceWorker();
                return Outcome.fail(plugin.name(), plugin.targetOperation(), TIMED_OUT,
                        "No result within " + timeout.toMillis() + "ms", elapsedSince(start));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Plugin {} threw {}", plugin.name(), cause.toString(), cause);
                return Outcome.fail(plugin.name(), plugin.targetOperation(), UNEXPECTED_EXCEPTION,
                        describe(cause), elapsedSince(start));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                replaceWorker();
                interrupted = true;
                signal.cancel();
                log.warn("Interrupted while waiting for plugin {}, cancelling run", plugin.name());
                return Outcome.fail(plugin.name(), plugin.targetOperation(), "interrupted",
                        "Runner thread interrupted", elapsedSince(start));
            }
        }

        void shutdown() {
            worker.shutdownNow();
        }

        private void replaceWorker() {
            worker.shutdownNow();
            worker = newWorker();
        }

        private static ExecutorService newWorker() {
            return Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "plugin-runner-" + WORKER_COUNTER.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        private static long elapsedSince(long start) {
            return System.currentTimeMillis() - start;
        }

        private static String describe(Throwable t) {
            String message = t.getMessage();
            return message == null || message.isBlank()
                    ? t.getClass().getSimpleName()
                    : t.getClass().getSimpleName() + ": " + message;
        }
    }
}
