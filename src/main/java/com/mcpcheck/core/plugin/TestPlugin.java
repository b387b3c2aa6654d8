package com.mcpcheck.core.plugin;

import com.mcpcheck.mcp.McpSession;

import java.time.Duration;
import java.util.List;

/**
 * A named, independent check bound to one operation of the MCP server under test.
 * <p>
 * Plugins declare two kinds of ordering edges by plugin name:
 * <ul>
 *   <li>{@link #hardDeps()} must pass before this plugin runs; if any fails, this
 *       plugin is skipped without being invoked.</li>
 *   <li>{@link #softOrder()} only influences ordering; failures do not propagate.</li>
 * </ul>
 * Names that match no plugin in the run are treated as satisfied.
 */
public interface TestPlugin {

    /**
     * Unique name within a run. Defaults to the simple class name.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * The MCP operation this plugin exercises, used for reporting and classification.
     */
    String targetOperation();

    default String description() {
        return "No description";
    }

    default List<String> hardDeps() {
        return List.of();
    }

    default List<String> softOrder() {
        return List.of();
    }

    /**
     * Per-plugin timeout override, or null to use the runner default.
     */
    default Duration timeout() {
        return null;
    }

    /**
     * Runs the check against the session and reports the result.
     * Implementations are expected to inspect returned content for application-level
     * errors themselves; any exception that escapes is recorded as a failed outcome.
     */
    Outcome run(McpSession session) throws Exception;
}
