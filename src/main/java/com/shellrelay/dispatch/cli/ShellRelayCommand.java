package com.shellrelay.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for ShellRelay.
 * Routes to subcommands: health, status, tools, exec, watch.
 */
@Command(
        name = "shellrelay",
        mixinStandardHelpOptions = true,
        version = "ShellRelay 0.1.0",
        description = "Resilient MCP stdio client for agent-driven terminals",
        subcommands = {
                HealthCommand.class,
                StatusCommand.class,
                ToolsCommand.class,
                ExecCommand.class,
                WatchCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShellRelayCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
