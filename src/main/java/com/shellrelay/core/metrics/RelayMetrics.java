package com.shellrelay.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the RPC and command execution layers.
 */
@Service
public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "success", "error", "timeout" or "rejected"
     */
    public void recordRequest(String method, String outcome, long ms) {
        Timer.builder("shellrelay.rpc.requests")
                .tag("method", method)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementRequestTimeouts(String method) {
        Counter.builder("shellrelay.rpc.timeouts")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    public void incrementReconnectAttempts() {
        Counter.builder("shellrelay.reconnect.attempts")
                .register(registry)
                .increment();
    }

    public void incrementReconnectFailures() {
        Counter.builder("shellrelay.reconnect.failures")
                .description("Times the reconnect budget was exhausted")
                .register(registry)
                .increment();
    }

    public void recordCommand(boolean success, int attempts, long ms) {
        Timer.builder("shellrelay.command.duration")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("shellrelay.command.attempts")
                .register(registry)
                .record(attempts);
    }

    public void incrementLoopDetections() {
        Counter.builder("shellrelay.command.loops")
                .register(registry)
                .increment();
    }
}
