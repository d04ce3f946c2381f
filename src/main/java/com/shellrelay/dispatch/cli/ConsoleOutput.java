package com.shellrelay.dispatch.cli;

import com.shellrelay.core.error.ErrorInfo;
import com.shellrelay.core.events.RelayEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the ShellRelay CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SHELLRELAY v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SHELLRELAY]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void failure(ErrorInfo error) {
        error(error.message());
        if (!error.detail().isBlank() && !error.detail().equals(error.message())) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|faint " + error.detail() + "|@"));
        }
        if (error.suggestion() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(yellow) hint:|@ " + error.suggestion()));
        }
    }

    public static void event(RelayEvent event) {
        String color = event.eventType().startsWith("connection.") ? "magenta" : "blue";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(" + color + ") [" + event.eventType() + "]|@ " + event.payload()));
    }
}
