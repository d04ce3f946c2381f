package com.shellrelay.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.shellrelay.core.events.EventBus;
import com.shellrelay.core.metrics.RelayMetrics;
import com.shellrelay.core.time.MonotonicClock;
import com.shellrelay.core.time.RelayScheduler;
import com.shellrelay.core.time.ScheduledExecutorRelayScheduler;
import com.shellrelay.core.time.SystemMonotonicClock;
import com.shellrelay.mcp.transport.ProcessLauncher;
import com.shellrelay.mcp.transport.SystemProcessLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class McpConfig {

    private static final Logger log = LoggerFactory.getLogger(McpConfig.class);

    private static final String CONTAINER_CONFIGURED = "!'${shellrelay.mcp.container-name:}'.isBlank()";
    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean(destroyMethod = "close")
    public ScheduledExecutorRelayScheduler relayScheduler() {
        return ScheduledExecutorRelayScheduler.create(2);
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return SystemMonotonicClock.INSTANCE;
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return new SystemProcessLauncher();
    }

    @Bean(destroyMethod = "shutdown")
    public McpClient mcpClient(McpProperties props, ProcessLauncher launcher, RelayScheduler scheduler,
                               MonotonicClock clock, EventBus eventBus, RelayMetrics metrics,
                               ObjectMapper objectMapper) {
        var client = new McpClient(props, launcher, scheduler, clock, eventBus, metrics, objectMapper);
        if (props.isAutoConnect()) {
            try {
                client.start();
            } catch (McpException e) {
                log.warn("MCP server startup connect failed: {}", e.getMessage());
            }
        }
        return client;
    }

    @Bean
    @ConditionalOnExpression(CONTAINER_CONFIGURED)
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnExpression(CONTAINER_CONFIGURED)
    public ContainerProbe containerProbe(DockerClient dockerClient) {
        return new ContainerProbe(dockerClient);
    }
}
