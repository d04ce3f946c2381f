package com.shellrelay.core.health;

import com.shellrelay.mcp.ConnectionStatus;
import com.shellrelay.mcp.ContainerProbe;
import com.shellrelay.mcp.McpClient;
import com.shellrelay.mcp.McpProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private McpClient client;
    private McpProperties props;

    @BeforeEach
    void setUp() {
        client = mock(McpClient.class);
        props = new McpProperties();
        props.setExecutable("terminal-mcp");
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns mcp, process, container components")
    void checkAllReturnsAllComponents() {
        when(client.getStatus()).thenReturn(new ConnectionStatus(false, false, null, 0, 0, false, false));
        var results = new HealthCheckService(client, props, null).checkAll();

        assertEquals(List.of("mcp", "process", "container"), results.stream().map(HealthStatus::component).toList());
    }

    @Test
    @DisplayName("connected direct launch -> all UP")
    void connectedAllUp() {
        when(client.getStatus()).thenReturn(new ConnectionStatus(true, true, 77L, 0, 1, false, false));
        var results = new HealthCheckService(client, props, null).checkAll();

        for (var status : results) {
            assertEquals(HealthStatus.Status.UP, status.status(), status.component() + " should be UP");
        }
        assertEquals("77", component(results, "process").metadata().get("pid"));
        assertEquals("1", component(results, "mcp").metadata().get("pendingRequests"));
    }

    @Test
    @DisplayName("pending reconnect -> mcp DEGRADED with attempt count")
    void reconnectingDegraded() {
        when(client.getStatus()).thenReturn(new ConnectionStatus(false, false, null, 2, 0, true, false));
        var mcp = component(new HealthCheckService(client, props, null).checkAll(), "mcp");

        assertEquals(HealthStatus.Status.DEGRADED, mcp.status());
        assertEquals("Reconnecting (attempt 2/5)", mcp.detail());
    }

    @Test
    @DisplayName("exhausted reconnects -> mcp DOWN asking for reinitialize")
    void reconnectFailedDown() {
        when(client.getStatus()).thenReturn(new ConnectionStatus(false, false, null, 5, 0, false, true));
        var results = new HealthCheckService(client, props, null).checkAll();

        var mcp = component(results, "mcp");
        assertEquals(HealthStatus.Status.DOWN, mcp.status());
        assertTrue(mcp.detail().contains("reinitialize"));
        assertEquals(HealthStatus.Status.DOWN, component(results, "process").status());
    }

    @Test
    @DisplayName("container configured without a probe -> container DEGRADED")
    void containerWithoutProbe() {
        props.setContainerName("terminal");
        when(client.getStatus()).thenReturn(new ConnectionStatus(true, true, 1L, 0, 0, false, false));

        var container = component(new HealthCheckService(client, props, null).checkAll(), "container");
        assertEquals(HealthStatus.Status.DEGRADED, container.status());
        assertEquals("terminal", container.metadata().get("container"));
    }

    @Test
    @DisplayName("container probe reports running and stopped")
    void containerProbe() {
        props.setContainerName("terminal");
        when(client.getStatus()).thenReturn(new ConnectionStatus(true, true, 1L, 0, 0, false, false));
        var probe = mock(ContainerProbe.class);
        var service = new HealthCheckService(client, props, probe);

        when(probe.isRunning("terminal")).thenReturn(true);
        assertEquals(HealthStatus.Status.UP, component(service.checkAll(), "container").status());

        when(probe.isRunning("terminal")).thenReturn(false);
        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "container").status());
    }

    @Test
    @DisplayName("Docker errors -> container DOWN with the error")
    void containerProbeError() {
        props.setContainerName("terminal");
        when(client.getStatus()).thenReturn(new ConnectionStatus(true, true, 1L, 0, 0, false, false));
        var probe = mock(ContainerProbe.class);
        when(probe.isRunning("terminal")).thenThrow(new RuntimeException("daemon unreachable"));

        var container = component(new HealthCheckService(client, props, probe).checkAll(), "container");
        assertEquals(HealthStatus.Status.DOWN, container.status());
        assertEquals("Docker error: daemon unreachable", container.detail());
    }
}
