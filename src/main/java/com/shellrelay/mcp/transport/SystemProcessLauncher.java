package com.shellrelay.mcp.transport;

import java.io.IOException;

/**
 * Launches the server with {@link ProcessBuilder}, keeping stdin, stdout and stderr as pipes.
 */
public class SystemProcessLauncher implements ProcessLauncher {

    @Override
    public Process launch(LaunchSpec spec) throws IOException {
        var builder = new ProcessBuilder(spec.command());
        builder.environment().putAll(spec.environment());
        builder.redirectInput(ProcessBuilder.Redirect.PIPE);
        builder.redirectOutput(ProcessBuilder.Redirect.PIPE);
        builder.redirectError(ProcessBuilder.Redirect.PIPE);
        return builder.start();
    }
}
