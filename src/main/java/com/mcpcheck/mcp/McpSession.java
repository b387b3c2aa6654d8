package com.mcpcheck.mcp;

import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;
import java.util.Map;

/**
 * Capability handle through which plugins talk to the MCP server under test.
 * <p>
 * The runner passes the same instance to every plugin and never calls it itself;
 * any state a plugin creates on the server is the plugin's responsibility.
 */
public interface McpSession {

    McpSchema.Implementation serverInfo();

    McpSchema.CallToolResult callTool(String toolName, Map<String, Object> arguments);

    List<McpSchema.Tool> listTools();

    List<McpSchema.Resource> listResources();

    McpSchema.ReadResourceResult readResource(String uri);

    List<McpSchema.Prompt> listPrompts();

    void ping();
}
