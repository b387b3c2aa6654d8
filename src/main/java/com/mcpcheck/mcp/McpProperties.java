package com.mcpcheck.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the MCP server under test.
 *
 * <pre>
 * mcpcheck:
 *   mcp:
 *     url: http://localhost:8000
 *     token: pre-acquired-bearer-token
 *     request-timeout: 30s
 * </pre>
 * The streamable HTTP endpoint {@value #DEFAULT_ENDPOINT} is appended to the URL
 * unless it already ends with it.
 */
@Component
@ConfigurationProperties(prefix = "mcpcheck.mcp")
public class McpProperties {

    public static final String DEFAULT_URL = "http://localhost:8000";
    public static final String DEFAULT_ENDPOINT = "/mcp";

    private String url = DEFAULT_URL;
    private String token = "";
    private Duration requestTimeout = Duration.ofSeconds(30);
    private String clientName = "mcp-check";

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public String getClientName() { return clientName; }
    public void setClientName(String clientName) { this.clientName = clientName; }

    /**
     * Splits a user-supplied URL into transport base URI and MCP endpoint path.
     * "http://host:8000" and "http://host:8000/mcp/" both yield base "http://host:8000"
     * and endpoint "/mcp".
     */
    public static Endpoint endpointFor(String url) {
        String trimmed = url == null || url.isBlank() ? DEFAULT_URL : url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith(DEFAULT_ENDPOINT)) {
            trimmed = trimmed.substring(0, trimmed.length() - DEFAULT_ENDPOINT.length());
        }
        return new Endpoint(trimmed, DEFAULT_ENDPOINT);
    }

    public record Endpoint(String baseUri, String path) {
        public String url() {
            return baseUri + path;
        }
    }
}
