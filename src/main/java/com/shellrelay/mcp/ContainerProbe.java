package com.shellrelay.mcp;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.NotFoundException;

/**
 * Asks the Docker daemon whether the container hosting the MCP server is running.
 */
public class ContainerProbe {

    private final DockerClient dockerClient;

    public ContainerProbe(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    /**
     * @return {@code false} when the container is stopped or does not exist
     */
    public boolean isRunning(String containerName) {
        try {
            var state = dockerClient.inspectContainerCmd(containerName).exec().getState();
            return state != null && Boolean.TRUE.equals(state.getRunning());
        } catch (NotFoundException e) {
            return false;
        }
    }
}
