package com.shellrelay.dispatch.cli;

import com.shellrelay.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: shellrelay health
 * <p>
 * Reports the MCP connection, the server process and its container, one line each.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check MCP connection health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checks = healthCheckService.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        if (allUp) {
            ConsoleOutput.success("Overall: all components operational");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return 1;
    }
}
