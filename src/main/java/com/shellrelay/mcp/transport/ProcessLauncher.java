package com.shellrelay.mcp.transport;

import java.io.IOException;

/**
 * Starts the operating-system process described by a {@link LaunchSpec}.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process launch(LaunchSpec spec) throws IOException;
}
