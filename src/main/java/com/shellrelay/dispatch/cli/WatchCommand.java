package com.shellrelay.dispatch.cli;

import com.shellrelay.core.error.ErrorClassifier;
import com.shellrelay.core.events.EventBus;
import com.shellrelay.core.events.RelayEvent;
import com.shellrelay.mcp.McpClient;
import com.shellrelay.mcp.McpException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: shellrelay watch [--duration &lt;seconds&gt;]
 * <p>
 * Connects to the MCP server and prints lifecycle events and server
 * notifications until interrupted or the duration elapses.
 */
@Command(name = "watch", mixinStandardHelpOptions = true,
        description = "Print connection events and server notifications")
@Component
public class WatchCommand implements Callable<Integer> {

    @Option(names = {"--duration", "-d"}, description = "Seconds to watch; 0 watches until interrupted")
    long durationSeconds;

    private final McpClient client;
    private final EventBus eventBus;
    private final ErrorClassifier classifier;

    public WatchCommand(McpClient client, EventBus eventBus, ErrorClassifier classifier) {
        this.client = client;
        this.eventBus = eventBus;
        this.classifier = classifier;
    }

    @Override
    public Integer call() throws InterruptedException {
        ConsoleOutput.printBanner();
        var done = new CountDownLatch(1);
        try (var subscription = eventBus.subscribeAll(event -> {
            ConsoleOutput.event(event);
            if (RelayEvent.SHUTDOWN.equals(event.eventType())
                    || RelayEvent.RECONNECT_FAILED.equals(event.eventType())) {
                done.countDown();
            }
        })) {
            try {
                client.start();
            } catch (McpException e) {
                ConsoleOutput.failure(classifier.classify(e));
                return 1;
            }
            ConsoleOutput.info("Watching MCP events (Ctrl+C to stop)");
            if (durationSeconds > 0) {
                done.await(durationSeconds, TimeUnit.SECONDS);
            } else {
                done.await();
            }
        }
        return 0;
    }
}
