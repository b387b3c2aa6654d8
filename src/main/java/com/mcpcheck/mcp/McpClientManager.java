package com.mcpcheck.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Opens initialized MCP sessions over streamable HTTP.
 * <p>
 * Each call creates a new client; the caller owns the returned session and closes it
 * when the run is over.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);
    private static final String CLIENT_VERSION = "0.1.0";

    private final McpProperties props;

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    public SyncClientSession open() {
        return open(props.getUrl(), props.getToken());
    }

    /**
     * Connects to the server and performs the MCP initialize handshake.
     *
     * @param url   server URL, with or without the trailing MCP endpoint
     * @param token bearer token, or null/blank for none
     * @throws McpConnectionException if the client cannot be created or initialized
     */
    public SyncClientSession open(String url, String token) {
        var endpoint = McpProperties.endpointFor(url);
        McpSyncClient client = null;
        try {
            client = buildClient(endpoint, token);
            var init = client.initialize();
            log.info("MCP client connected to {} (server: {} {})", endpoint.url(),
                    init.serverInfo() != null ? init.serverInfo().name() : "unknown",
                    init.serverInfo() != null ? init.serverInfo().version() : "");
            return new SyncClientSession(client, init, endpoint.url());
        } catch (Exception e) {
            log.warn("Failed to connect to MCP server at {}: {}", endpoint.url(), e.getMessage());
            if (client != null) {
                SyncClientSession.closeClient(client, endpoint.url());
            }
            throw new McpConnectionException("Failed to connect to " + endpoint.url() + ": " + e.getMessage(), e);
        }
    }

    McpSyncClient buildClient(McpProperties.Endpoint endpoint, String token) {
        var transportBuilder = HttpClientStreamableHttpTransport.builder(endpoint.baseUri())
                .endpoint(endpoint.path());
        if (token != null && !token.isBlank()) {
            transportBuilder.customizeRequest(req ->
                    req.header("Authorization", "Bearer " + token));
        }
        return McpClient.sync(transportBuilder.build())
                .requestTimeout(props.getRequestTimeout())
                .clientInfo(new McpSchema.Implementation(props.getClientName(), CLIENT_VERSION))
                .build();
    }

    public String defaultUrl() {
        return props.getUrl();
    }

    public String defaultToken() {
        return props.getToken();
    }
}
