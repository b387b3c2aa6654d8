package com.mcpcheck.mcp;

/**
 * Thrown when the MCP server cannot be reached or the initialize handshake fails.
 */
public class McpConnectionException extends RuntimeException {

    public McpConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
