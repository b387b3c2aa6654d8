package com.mcpcheck.plugins;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.mcp.McpSession;

import java.util.List;

/**
 * Verifies the server answers a ping and identified itself during initialize.
 */
public class ServerPingPlugin extends AbstractMcpPlugin {

    public ServerPingPlugin() {
        super("ping", "Verifies the server responds to ping", List.of(), List.of());
    }

    @Override
    protected Outcome check(McpSession session, long startMs) {
        session.ping();
        var info = session.serverInfo();
        if (info == null || info.name() == null || info.name().isBlank()) {
            return fail("Server did not report its name during initialize", null, startMs);
        }
        return pass("Server " + info.name() + " " + info.version() + " responded to ping", startMs);
    }

    @Override
    protected String failureMessage() {
        return "Ping failed";
    }
}
