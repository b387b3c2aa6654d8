package com.mcpcheck.plugins;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.mcp.McpSession;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Verifies resources/list works and includes every expected resource URI.
 */
public class ListResourcesPlugin extends AbstractMcpPlugin {

    private final List<String> expectedResources;

    public ListResourcesPlugin(List<String> expectedResources) {
        super("resources/list", "Verifies server exposes expected resources",
                List.of("ServerPingPlugin"), List.of());
        this.expectedResources = expectedResources != null ? List.copyOf(expectedResources) : List.of();
    }

    @Override
    protected Outcome check(McpSession session, long startMs) {
        Set<String> uris = session.listResources().stream()
                .map(r -> String.valueOf(r.uri()))
                .collect(Collectors.toSet());

        var missing = expectedResources.stream().filter(r -> !uris.contains(r)).toList();
        if (!missing.isEmpty()) {
            return fail("Missing " + missing.size() + " resource(s): " + preview(missing), null, startMs);
        }
        if (expectedResources.isEmpty()) {
            return pass("Resources list returned successfully (" + uris.size() + " resources)", startMs);
        }
        return pass("Found all " + expectedResources.size() + " expected resources", startMs);
    }

    @Override
    protected String failureMessage() {
        return "Failed to list resources";
    }
}
