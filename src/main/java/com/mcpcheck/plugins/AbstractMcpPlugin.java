package com.mcpcheck.plugins;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.core.plugin.TestPlugin;
import com.mcpcheck.mcp.McpSession;

import java.util.List;

/**
 * Base class for plugins that exercise one MCP operation.
 * <p>
 * Measures duration and turns exceptions from the session into a failed outcome
 * carrying {@link #failureMessage()}, so subclasses only describe the check itself.
 */
public abstract class AbstractMcpPlugin implements TestPlugin {

    private final String targetOperation;
    private final String description;
    private final List<String> hardDeps;
    private final List<String> softOrder;

    protected AbstractMcpPlugin(String targetOperation, String description,
                                List<String> hardDeps, List<String> softOrder) {
        this.targetOperation = targetOperation;
        this.description = description;
        this.hardDeps = hardDeps != null ? List.copyOf(hardDeps) : List.of();
        this.softOrder = softOrder != null ? List.copyOf(softOrder) : List.of();
    }

    @Override
    public String targetOperation() {
        return targetOperation;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public List<String> hardDeps() {
        return hardDeps;
    }

    @Override
    public List<String> softOrder() {
        return softOrder;
    }

    @Override
    public final Outcome run(McpSession session) {
        long start = System.currentTimeMillis();
        try {
            return check(session, start);
        } catch (Exception e) {
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return fail(failureMessage(), detail, start);
        }
    }

    /**
     * Performs the check. {@code startMs} is the wall-clock start, for {@link #pass}/{@link #fail}.
     */
    protected abstract Outcome check(McpSession session, long startMs) throws Exception;

    protected String failureMessage() {
        return "Failed to call " + targetOperation;
    }

    protected Outcome pass(String message, long startMs) {
        return Outcome.pass(name(), targetOperation, message, System.currentTimeMillis() - startMs);
    }

    protected Outcome fail(String message, String error, long startMs) {
        return Outcome.fail(name(), targetOperation, message, error, System.currentTimeMillis() - startMs);
    }

    static String preview(List<String> items) {
        if (items.size() <= 3) return items.toString();
        return items.subList(0, 3) + "...";
    }
}
