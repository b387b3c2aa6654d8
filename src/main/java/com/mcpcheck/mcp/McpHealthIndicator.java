package com.mcpcheck.mcp;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the MCP server under test.
 * Connects, pings, and reports the server's self-declared identity.
 */
@Component
public class McpHealthIndicator implements HealthIndicator {

    private final McpClientManager clientManager;

    public McpHealthIndicator(McpClientManager clientManager) {
        this.clientManager = clientManager;
    }

    @Override
    public Health health() {
        return check(clientManager.defaultUrl(), clientManager.defaultToken());
    }

    public Health check(String url, String token) {
        String endpoint = McpProperties.endpointFor(url).url();
        try (var session = clientManager.open(url, token)) {
            session.ping();
            var builder = Health.up().withDetail("url", endpoint);
            var info = session.serverInfo();
            if (info != null) {
                builder.withDetail("server", String.valueOf(info.name()))
                        .withDetail("version", String.valueOf(info.version()));
            }
            return builder.build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("url", endpoint)
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
