package com.mcpcheck.plugins;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * Extracts the primary text from MCP results.
 */
public final class ContentText {

    private ContentText() {}

    /**
     * Text of the first content item when it is text, otherwise an empty string.
     */
    public static String of(McpSchema.CallToolResult result) {
        if (result == null || result.content() == null || result.content().isEmpty()) return "";
        if (result.content().get(0) instanceof McpSchema.TextContent text) {
            return text.text() != null ? text.text() : "";
        }
        return "";
    }

    public static String of(McpSchema.ReadResourceResult result) {
        if (result == null || result.contents() == null || result.contents().isEmpty()) return "";
        if (result.contents().get(0) instanceof McpSchema.TextResourceContents text) {
            return text.text() != null ? text.text() : "";
        }
        return "";
    }
}
