package com.mcpcheck.core.engine;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.core.plugin.PluginConfigurationException;
import com.mcpcheck.core.plugin.PluginState;
import com.mcpcheck.core.plugin.StubPlugin;
import com.mcpcheck.core.plugin.TestPlugin;
import com.mcpcheck.mcp.McpSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class PluginExecutorTest {

    private PluginExecutor executor;
    private McpSession session;

    @BeforeEach
    void setUp() {
        executor = new PluginExecutor(Duration.ofSeconds(5));
        session = mock(McpSession.class);
    }

    private ExecutionResult execute(TestPlugin... plugins) {
        return executor.execute(session, List.of(plugins), RunListener.NONE, new CancellationSignal());
    }

    @Test
    @DisplayName("Non-positive default timeout is rejected")
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new PluginExecutor(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new PluginExecutor(Duration.ofSeconds(-1)));
    }

    @Test
    @DisplayName("Plugin outcomes are used as returned")
    void pluginOutcomeUsedAsIs() {
        var a = StubPlugin.of("A", List.of(), List.of(),
                (self, s) -> new Outcome("A", "custom_op", true, "all good", null, 42L, null));
        var result = execute(a);

        var outcome = result.outcomes().get(0);
        assertEquals("custom_op", outcome.targetOperation());
        assertEquals("all good", outcome.message());
        assertEquals(42L, outcome.durationMs());
        assertFalse(result.cancelled());
    }

    @Test
    @DisplayName("Session is handed to the plugin untouched")
    void sessionPassedThrough() {
        var seen = new ArrayList<McpSession>();
        var a = StubPlugin.of("A", List.of(), List.of(), (self, s) -> {
            seen.add(s);
            return Outcome.pass("A", "op", "ok", 1);
        });
        execute(a);
        assertSame(session, seen.get(0));
        verifyNoInteractions(session);
    }

    @Nested
    @DisplayName("Cascading skip")
    class CascadingSkip {

        @Test
        @DisplayName("A fails -> B (hard dep on A) skipped with message naming A, never invoked")
        void dependentSkipped() {
            var a = StubPlugin.failing("A");
            var b = StubPlugin.passing("B", "A");
            var result = execute(a, b);

            assertEquals(2, result.outcomes().size());
            assertEquals(PluginState.FAILED, result.outcomes().get(0).state());
            var skipped = result.outcomes().get(1);
            assertEquals(PluginState.SKIPPED, skipped.state());
            assertFalse(skipped.passed());
            assertTrue(skipped.message().contains("A"));
            assertTrue(skipped.message().startsWith(PluginExecutor.SKIPPED_PREFIX));
            assertEquals(0, b.invocations());
        }

        @Test
        @DisplayName("Skips cascade transitively through A -> B -> C")
        void transitiveSkip() {
            var a = StubPlugin.failing("A");
            var b = StubPlugin.passing("B", "A");
            var c = StubPlugin.passing("C", "B");
            var result = execute(a, b, c);

            assertEquals(PluginState.SKIPPED, result.outcomes().get(2).state());
            assertTrue(result.outcomes().get(2).message().contains("B"));
            assertEquals(0, c.invocations());
        }

        @Test
        @DisplayName("Soft ordering does not propagate failure")
        void softOrderDoesNotPropagate() {
            var a = StubPlugin.failing("A");
            var b = StubPlugin.after("B", "A");
            var result = execute(a, b);

            assertEquals(PluginState.PASSED, result.outcomes().get(1).state());
            assertEquals(1, b.invocations());
        }

        @Test
        @DisplayName("Only failed dependencies are named in the skip message")
        void onlyFailedDepsNamed() {
            var a = StubPlugin.passing("A");
            var b = StubPlugin.failing("B");
            var c = StubPlugin.passing("C", "A", "B");
            var result = execute(a, b, c);

            var message = result.outcomes().get(2).message();
            assertTrue(message.endsWith("B"));
            assertFalse(message.contains("A,"));
        }

        @Test
        @DisplayName("Independent plugins still run after a failure")
        void independentStillRuns() {
            var a = StubPlugin.failing("A");
            var b = StubPlugin.passing("B");
            var result = execute(a, b);
            assertTrue(result.outcomes().get(1).passed());
            assertEquals(1, b.invocations());
        }
    }

    @Nested
    @DisplayName("Failure boundary")
    class FailureBoundary {

        @Test
        @DisplayName("Uncaught exception -> FAILED with captured error, next plugin still runs")
        void exceptionCaptured() {
            var a = StubPlugin.of("A", List.of(), List.of(), (self, s) -> {
                throw new IllegalStateException("boom");
            });
            var b = StubPlugin.passing("B");
            var result = execute(a, b);

            var failed = result.outcomes().get(0);
            assertFalse(failed.passed());
            assertEquals(PluginExecutor.UNEXPECTED_EXCEPTION, failed.message());
            assertEquals("IllegalStateException: boom", failed.error());
            assertNotNull(failed.durationMs());
            assertTrue(result.outcomes().get(1).passed());
        }

        @Test
        @DisplayName("Checked exceptions are captured too")
        void checkedExceptionCaptured() {
            var a = StubPlugin.of("A", List.of(), List.of(), (self, s) -> {
                throw new java.io.IOException("connection reset");
            });
            var outcome = execute(a).outcomes().get(0);
            assertEquals("IOException: connection reset", outcome.error());
        }

        @Test
        @DisplayName("Null outcome is treated as a fault")
        void nullOutcomeIsFault() {
            var a = StubPlugin.of("A", List.of(), List.of(), (self, s) -> null);
            var outcome = execute(a).outcomes().get(0);
            assertFalse(outcome.passed());
            assertEquals("A", outcome.pluginName());
            assertNotNull(outcome.error());
        }

        @Test
        @DisplayName("A faulted plugin cascades to its dependents")
        void faultCascades() {
            var a = StubPlugin.of("A", List.of(), List.of(), (self, s) -> {
                throw new RuntimeException("x");
            });
            var b = StubPlugin.passing("B", "A");
            var result = execute(a, b);
            assertEquals(PluginState.SKIPPED, result.outcomes().get(1).state());
        }
    }

    @Nested
    @DisplayName("Timeouts")
    class Timeouts {

        @Test
        @DisplayName("Plugin exceeding its budget -> FAILED 'timed out', next plugin runs")
        void timeoutProducesFailedOutcome() {
            var slow = StubPlugin.of("Slow", List.of(), List.of(), (self, s) -> {
                Thread.sleep(10_000);
                return Outcome.pass("Slow", "op", "late", 10_000);
            }).withTimeout(Duration.ofMillis(100));
            var next = StubPlugin.passing("Next");
            var result = execute(slow, next);

            var timedOut = result.outcomes().get(0);
            assertFalse(timedOut.passed());
            assertEquals("timed out", timedOut.message());
            assertTrue(result.outcomes().get(1).passed());
        }

        @Test
        @DisplayName("Run-level timeout applies to plugins without an override")
        void runLevelTimeout() {
            var slow = StubPlugin.of("Slow", List.of(), List.of(), (self, s) -> {
                Thread.sleep(10_000);
                return Outcome.pass("Slow", "op", "late", 10_000);
            });
            var result = executor.execute(session, List.of(slow), Duration.ofMillis(100),
                    RunListener.NONE, new CancellationSignal());
            assertEquals("timed out", result.outcomes().get(0).message());
        }

        @Test
        @DisplayName("A plugin ignoring interrupts does not block the next one")
        void stuckPluginDoesNotBlockNext() {
            var release = new AtomicBoolean(false);
            var stuck = StubPlugin.of("Stuck", List.of(), List.of(), (self, s) -> {
                while (!release.get()) {
                    try {
                        Thread.sleep(10);
                    } catch (InterruptedException ignored) {
                        // keep going, simulating a plugin that ignores interruption
                    }
                }
                return Outcome.pass("Stuck", "op", "released", 0);
            }).withTimeout(Duration.ofMillis(100));
            var next = StubPlugin.passing("Next").withTimeout(Duration.ofSeconds(2));

            try {
                var result = execute(stuck, next);
                assertEquals("timed out", result.outcomes().get(0).message());
                assertTrue(result.outcomes().get(1).passed());
            } finally {
                release.set(true);
            }
        }

        @Test
        @DisplayName("Zero or negative run timeout is rejected before any plugin runs")
        void rejectsNonPositiveRunTimeout() {
            var a = StubPlugin.passing("A");
            for (Duration bad : List.of(Duration.ZERO, Duration.ofSeconds(-5))) {
                assertThrows(IllegalArgumentException.class, () -> executor.execute(session, List.of(a), bad,
                        RunListener.NONE, new CancellationSignal()));
            }
            assertEquals(0, a.invocations());
        }

        @Test
        @DisplayName("Zero or negative plugin timeout is a configuration error")
        void rejectsNonPositivePluginTimeout() {
            var a = StubPlugin.passing("A");
            var b = StubPlugin.passing("B").withTimeout(Duration.ZERO);

            var e = assertThrows(PluginConfigurationException.class, () -> execute(a, b));

            assertTrue(e.getMessage().contains("B"));
            assertEquals(0, a.invocations());
        }

        @Test
        @DisplayName("Timed-out plugin cascades to its dependents")
        void timeoutCascades() {
            var slow = StubPlugin.of("Slow", List.of(), List.of(), (self, s) -> {
                Thread.sleep(10_000);
                return null;
            }).withTimeout(Duration.ofMillis(50));
            var dependent = StubPlugin.passing("Dependent", "Slow");
            var result = execute(slow, dependent);
            assertEquals(PluginState.SKIPPED, result.outcomes().get(1).state());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancel during a plugin lets it finish, then abandons the rest")
        void cancelBetweenPlugins() {
            var signal = new CancellationSignal();
            var a = StubPlugin.of("A", List.of(), List.of(), (self, s) -> {
                signal.cancel();
                return Outcome.pass("A", "op", "ok", 1);
            });
            var b = StubPlugin.passing("B");
            var result = executor.execute(session, List.of(a, b), RunListener.NONE, signal);

            assertTrue(result.cancelled());
            assertEquals(1, result.outcomes().size());
            assertTrue(result.outcomes().get(0).passed());
            assertEquals(0, b.invocations());
        }

        @Test
        @DisplayName("Interrupting the runner fails the current plugin and cancels the rest")
        void interruptedRunner() throws Exception {
            var started = new CountDownLatch(1);
            var blocked = StubPlugin.of("Blocked", List.of(), List.of(), (self, s) -> {
                started.countDown();
                Thread.sleep(30_000);
                return Outcome.pass("Blocked", "op", "late", 30_000);
            }).withTimeout(Duration.ofSeconds(60));
            var next = StubPlugin.passing("Next");
            var signal = new CancellationSignal();
            var result = new AtomicReference<ExecutionResult>();

            var runner = new Thread(() -> result.set(
                    executor.execute(session, List.of(blocked, next), RunListener.NONE, signal)));
            runner.start();
            assertTrue(started.await(5, TimeUnit.SECONDS));
            runner.interrupt();
            runner.join(5_000);

            assertFalse(runner.isAlive());
            assertTrue(result.get().cancelled());
            assertTrue(signal.isCancelled());
            assertEquals(1, result.get().outcomes().size());
            var outcome = result.get().outcomes().get(0);
            assertEquals(PluginState.FAILED, outcome.state());
            assertEquals("interrupted", outcome.message());
            assertEquals(0, next.invocations());
        }

        @Test
        @DisplayName("Interrupt during the last plugin still marks the run cancelled")
        void interruptedOnLastPlugin() throws Exception {
            var started = new CountDownLatch(1);
            var blocked = StubPlugin.of("Blocked", List.of(), List.of(), (self, s) -> {
                started.countDown();
                Thread.sleep(30_000);
                return null;
            });
            var result = new AtomicReference<ExecutionResult>();

            var runner = new Thread(() -> result.set(
                    executor.execute(session, List.of(blocked), RunListener.NONE, new CancellationSignal())));
            runner.start();
            assertTrue(started.await(5, TimeUnit.SECONDS));
            runner.interrupt();
            runner.join(5_000);

            assertTrue(result.get().cancelled());
            assertEquals(1, result.get().outcomes().size());
        }

        @Test
        @DisplayName("Cancelled before start -> no plugins run")
        void cancelledBeforeStart() {
            var signal = new CancellationSignal();
            signal.cancel();
            var a = StubPlugin.passing("A");
            var result = executor.execute(session, List.of(a), RunListener.NONE, signal);
            assertTrue(result.cancelled());
            assertTrue(result.outcomes().isEmpty());
            assertEquals(0, a.invocations());
        }
    }

    @Test
    @DisplayName("Listener sees start only for invoked plugins and every outcome in order")
    void listenerCallbacks() {
        var started = new ArrayList<String>();
        var finished = new ArrayList<String>();
        var listener = new RunListener() {
            @Override
            public void onPluginStarted(TestPlugin plugin) {
                started.add(plugin.name());
            }

            @Override
            public void onOutcome(TestPlugin plugin, Outcome outcome) {
                finished.add(plugin.name() + ":" + outcome.state());
            }
        };
        executor.execute(session, List.of(StubPlugin.failing("A"), StubPlugin.passing("B", "A"),
                StubPlugin.passing("C")), listener, new CancellationSignal());

        assertEquals(List.of("A", "C"), started);
        assertEquals(List.of("A:FAILED", "B:SKIPPED", "C:PASSED"), finished);
    }

    @Test
    @DisplayName("Every plugin gets exactly one outcome")
    void totalCoverage() {
        var plugins = List.<TestPlugin>of(
                StubPlugin.failing("A"), StubPlugin.passing("B", "A"), StubPlugin.passing("C"),
                StubPlugin.of("D", List.of(), List.of(), (self, s) -> {
                    throw new RuntimeException("x");
                }),
                StubPlugin.passing("E", "D"));
        var result = executor.execute(session, plugins, RunListener.NONE, new CancellationSignal());
        assertEquals(plugins.size(), result.outcomes().size());
        assertEquals(List.of("A", "B", "C", "D", "E"),
                result.outcomes().stream().map(Outcome::pluginName).toList());
    }
}
