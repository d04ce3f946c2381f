package com.shellrelay.dispatch.cli;

import com.shellrelay.command.CommandExecutionManager;
import com.shellrelay.command.SessionBusyException;
import com.shellrelay.core.error.ErrorClassifier;
import com.shellrelay.mcp.McpClient;
import com.shellrelay.mcp.McpException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: shellrelay exec [--session &lt;id&gt;] [--] &lt;command...&gt;
 * <p>
 * Runs one command through the command execution manager, printing progress
 * events as they happen. Exits with the command's exit code.
 */
@Command(name = "exec", mixinStandardHelpOptions = true, description = "Execute a command in the terminal")
@Component
public class ExecCommand implements Callable<Integer> {

    @Option(names = {"--session", "-s"}, description = "Session id (default: ${DEFAULT-VALUE})",
            defaultValue = "cli")
    String sessionId;

    @Option(names = {"--quiet", "-q"}, description = "Do not print progress events")
    boolean quiet;

    @Parameters(arity = "1..*", description = "Command to execute; put it after -- when it contains dashes")
    List<String> command;

    private final McpClient client;
    private final CommandExecutionManager manager;
    private final ErrorClassifier classifier;

    public ExecCommand(McpClient client, CommandExecutionManager manager, ErrorClassifier classifier) {
        this.client = client;
        this.manager = manager;
        this.classifier = classifier;
    }

    @Override
    public Integer call() {
        try {
            client.start();
        } catch (McpException e) {
            ConsoleOutput.failure(classifier.classify(e));
            return 1;
        }

        String text = String.join(" ", command);
        try {
            var result = quiet
                    ? manager.execute(sessionId, text)
                    : manager.execute(sessionId, text, ConsoleOutput::event);
            if (!result.output().isEmpty()) {
                System.out.println(result.output());
            }
            if (result.success()) {
                return result.exitCode();
            }
            ConsoleOutput.failure(result.error());
            return result.exitCode() > 0 ? result.exitCode() : 1;
        } catch (SessionBusyException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
