package com.mcpcheck.plugins;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.mcp.McpSession;

import java.util.List;

/**
 * Verifies prompts/list works. An empty list passes.
 */
public class ListPromptsPlugin extends AbstractMcpPlugin {

    public ListPromptsPlugin() {
        super("prompts/list", "Verifies prompts/list works",
                List.of("ServerPingPlugin"), List.of("ListToolsPlugin"));
    }

    @Override
    protected Outcome check(McpSession session, long startMs) {
        var prompts = session.listPrompts();
        return pass("Prompts list returned successfully (" + prompts.size() + " prompts)", startMs);
    }

    @Override
    protected String failureMessage() {
        return "Failed to list prompts";
    }
}
