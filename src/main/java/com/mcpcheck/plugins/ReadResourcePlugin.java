package com.mcpcheck.plugins;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.mcp.McpSession;

import java.util.List;

/**
 * Reads one resource and checks its text for expected markers.
 * <p>
 * Reads the configured URI, or the first listed resource when none is configured.
 */
public class ReadResourcePlugin extends AbstractMcpPlugin {

    private final String uri;
    private final List<String> expectedMarkers;

    public ReadResourcePlugin(String uri, List<String> expectedMarkers) {
        super("resources/read", "Verifies a resource can be read",
                List.of("ListResourcesPlugin"), List.of());
        this.uri = uri;
        this.expectedMarkers = expectedMarkers != null ? List.copyOf(expectedMarkers) : List.of();
    }

    @Override
    protected Outcome check(McpSession session, long startMs) {
        String target = uri;
        if (target == null || target.isBlank()) {
            var resources = session.listResources();
            if (resources.isEmpty()) {
                return pass("No resources exposed, nothing to read", startMs);
            }
            target = resources.get(0).uri();
        }

        String text = ContentText.of(session.readResource(target));
        if (text.isEmpty()) {
            return fail("Resource " + target + " returned no text content", null, startMs);
        }

        var missing = expectedMarkers.stream().filter(m -> !text.contains(m)).toList();
        if (!missing.isEmpty()) {
            return fail("Resource " + target + " missing expected content: " + missing, null, startMs);
        }
        return pass("Successfully read " + target + " (" + text.length() + " chars)", startMs);
    }

    @Override
    protected String failureMessage() {
        return "Failed to read resource";
    }
}
