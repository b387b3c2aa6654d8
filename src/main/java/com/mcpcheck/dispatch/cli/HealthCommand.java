package com.mcpcheck.dispatch.cli;

import com.mcpcheck.mcp.McpClientManager;
import com.mcpcheck.mcp.McpHealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: mcpcheck health
 * <p>
 * Connects to the MCP server, pings it and shows what it reports about itself.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check that the MCP server is reachable")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--url", "-u"}, description = "Server URL (default: $MCP_HTTP_URL or http://localhost:8000)")
    private String url;

    @Option(names = "--token", description = "Bearer token (default: $MCP_TOKEN)")
    private String token;

    private final McpHealthIndicator healthIndicator;
    private final McpClientManager clientManager;

    public HealthCommand(McpHealthIndicator healthIndicator, McpClientManager clientManager) {
        this.healthIndicator = healthIndicator;
        this.clientManager = clientManager;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var health = healthIndicator.check(
                url != null ? url : clientManager.defaultUrl(),
                token != null ? token : clientManager.defaultToken());

        health.getDetails().forEach((key, value) -> ConsoleOutput.info(key + ": " + value));
        if (Status.UP.equals(health.getStatus())) {
            ConsoleOutput.success("MCP server is up");
            return 0;
        }
        ConsoleOutput.error("MCP server is " + health.getStatus().getCode());
        return 1;
    }
}
