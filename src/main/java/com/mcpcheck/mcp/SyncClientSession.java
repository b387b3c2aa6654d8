package com.mcpcheck.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * {@link McpSession} backed by an initialized MCP Java SDK sync client.
 */
public class SyncClientSession implements McpSession, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyncClientSession.class);

    private final McpSyncClient client;
    private final McpSchema.InitializeResult initializeResult;
    private final String url;

    public SyncClientSession(McpSyncClient client, McpSchema.InitializeResult initializeResult, String url) {
        this.client = client;
        this.initializeResult = initializeResult;
        this.url = url;
    }

    public String url() {
        return url;
    }

    @Override
    public McpSchema.Implementation serverInfo() {
        return initializeResult != null ? initializeResult.serverInfo() : null;
    }

    @Override
    public McpSchema.CallToolResult callTool(String toolName, Map<String, Object> arguments) {
        log.debug("tools/call {} {}", toolName, arguments);
        return client.callTool(new McpSchema.CallToolRequest(toolName,
                arguments != null ? arguments : Map.of()));
    }

    @Override
    public List<McpSchema.Tool> listTools() {
        var result = client.listTools();
        return result.tools() != null ? result.tools() : List.of();
    }

    @Override
    public List<McpSchema.Resource> listResources() {
        var result = client.listResources();
        return result.resources() != null ? result.resources() : List.of();
    }

    @Override
    public McpSchema.ReadResourceResult readResource(String uri) {
        log.debug("resources/read {}", uri);
        return client.readResource(new McpSchema.ReadResourceRequest(uri));
    }

    @Override
    public List<McpSchema.Prompt> listPrompts() {
        var result = client.listPrompts();
        return result.prompts() != null ? result.prompts() : List.of();
    }

    @Override
    public void ping() {
        client.ping();
    }

    @Override
    public void close() {
        closeClient(client, url);
    }

    /**
     * Graceful close, falling back to an immediate close when that does not complete.
     */
    static void closeClient(McpSyncClient client, String url) {
        boolean graceful = false;
        try {
            graceful = client.closeGracefully();
        } catch (RuntimeException e) {
            log.debug("Graceful close failed for {}: {}", url, e.getMessage());
        }
        try {
            if (!graceful) {
                client.close();
            }
            log.info("MCP client disconnected ({})", url);
        } catch (RuntimeException e) {
            log.warn("Error closing MCP client for {}: {}", url, e.getMessage());
        }
    }
}
