package com.mcpcheck.plugins;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.mcp.McpSession;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Verifies tools/list returns well-formed tools and includes every expected tool name.
 */
public class ListToolsPlugin extends AbstractMcpPlugin {

    private final List<String> expectedTools;

    public ListToolsPlugin(List<String> expectedTools) {
        super("tools/list", "Verifies server exposes expected tools",
                List.of("ServerPingPlugin"), List.of());
        this.expectedTools = expectedTools != null ? List.copyOf(expectedTools) : List.of();
    }

    @Override
    protected Outcome check(McpSession session, long startMs) {
        List<McpSchema.Tool> tools = session.listTools();

        var names = new ArrayList<String>();
        var seen = new HashSet<String>();
        var duplicates = new ArrayList<String>();
        for (var tool : tools) {
            if (tool.name() == null || tool.name().isBlank()) {
                return fail("Server listed a tool without a name", String.valueOf(tool), startMs);
            }
            if (!seen.add(tool.name())) {
                duplicates.add(tool.name());
            }
            names.add(tool.name());
        }
        if (!duplicates.isEmpty()) {
            return fail("Duplicate tool name(s): " + duplicates, null, startMs);
        }

        var missing = expectedTools.stream().filter(t -> !seen.contains(t)).toList();
        if (!missing.isEmpty()) {
            return fail("Missing " + missing.size() + " tool(s): " + preview(missing),
                    "Available: " + names, startMs);
        }
        return pass("Found " + tools.size() + " tool(s)"
                + (expectedTools.isEmpty() ? "" : ", all " + expectedTools.size() + " expected present"), startMs);
    }

    @Override
    protected String failureMessage() {
        return "Failed to list tools";
    }
}
