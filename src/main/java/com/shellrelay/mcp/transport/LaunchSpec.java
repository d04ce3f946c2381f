package com.shellrelay.mcp.transport;

import com.shellrelay.mcp.McpProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The resolved command line and environment overrides for the MCP server process.
 *
 * @param command     program followed by its arguments
 * @param environment variables merged into the child's inherited environment
 */
public record LaunchSpec(List<String> command, Map<String, String> environment) {

    /** Variables that must come from the container's own environment. */
    private static final List<String> HOST_ONLY_VARIABLES = List.of("PATH", "HOME");

    public LaunchSpec {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }

    /**
     * Resolves how to launch the server.
     * <p>
     * Direct: {@code <executable> <args...>} with the overrides in the child environment.
     * In a container: {@code <host-tool> exec -i -u <user> -e K=V ... <container> <executable> <args...>};
     * the overrides travel as {@code -e} flags and the host tool inherits the plain environment.
     */
    public static LaunchSpec from(McpProperties props) {
        var command = new ArrayList<String>();
        if (!props.usesContainer()) {
            command.add(props.getExecutable());
            command.addAll(props.getArgs());
            return new LaunchSpec(command, props.getEnv());
        }

        command.add(props.getHostTool());
        command.add("exec");
        command.add("-i");
        command.add("-u");
        command.add(props.getContainerUser());
        props.getEnv().forEach((key, value) -> {
            if (!HOST_ONLY_VARIABLES.contains(key)) {
                command.add("-e");
                command.add(key + "=" + value);
            }
        });
        command.add(props.getContainerName());
        command.add(props.getExecutable());
        command.addAll(props.getArgs());
        return new LaunchSpec(command, Map.of());
    }

    public String commandLine() {
        return String.join(" ", command);
    }
}
