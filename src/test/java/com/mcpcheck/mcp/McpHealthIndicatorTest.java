package com.mcpcheck.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class McpHealthIndicatorTest {

    private McpClientManager clientManager;
    private McpHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        clientManager = mock(McpClientManager.class);
        indicator = new McpHealthIndicator(clientManager);
    }

    @Test
    @DisplayName("UP with server identity when ping succeeds")
    void upWhenReachable() {
        var session = mock(SyncClientSession.class);
        when(session.serverInfo()).thenReturn(new McpSchema.Implementation("pattern-server", "1.4.0"));
        when(clientManager.open("http://host:8000", null)).thenReturn(session);

        var health = indicator.check("http://host:8000", null);

        assertEquals(Status.UP, health.getStatus());
        assertEquals("http://host:8000/mcp", health.getDetails().get("url"));
        assertEquals("pattern-server", health.getDetails().get("server"));
        assertEquals("1.4.0", health.getDetails().get("version"));
        verify(session).ping();
        verify(session).close();
    }

    @Test
    @DisplayName("DOWN with error detail when the connection fails")
    void downWhenUnreachable() {
        when(clientManager.open(anyString(), any()))
                .thenThrow(new McpConnectionException("Failed to connect to http://host:9/mcp: refused", null));

        var health = indicator.check("http://host:9", "secret");

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Failed to connect to http://host:9/mcp: refused", health.getDetails().get("error"));
    }

    @Test
    @DisplayName("DOWN and session closed when ping fails")
    void downWhenPingFails() {
        var session = mock(SyncClientSession.class);
        doThrow(new IllegalStateException()).when(session).ping();
        when(clientManager.open(anyString(), any())).thenReturn(session);

        var health = indicator.check("http://host:8000", null);

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("IllegalStateException", health.getDetails().get("error"));
        verify(session).close();
    }

    @Test
    @DisplayName("health() uses the configured URL and token")
    void usesDefaults() {
        when(clientManager.defaultUrl()).thenReturn("http://configured:8000");
        when(clientManager.defaultToken()).thenReturn("tok");
        when(clientManager.open("http://configured:8000", "tok"))
                .thenThrow(new McpConnectionException("down", null));

        assertEquals(Status.DOWN, indicator.health().getStatus());
        verify(clientManager).open("http://configured:8000", "tok");
    }
}
