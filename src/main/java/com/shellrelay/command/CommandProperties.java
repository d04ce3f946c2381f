package com.shellrelay.command;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retry, timeout and loop-detection settings for command execution.
 */
@Component
@ConfigurationProperties(prefix = "shellrelay.command")
public class CommandProperties {

    private int maxRetries = 3;
    private long attemptTimeoutMs = 30_000;
    private long retryDelayMs = 2_000;
    private int maxSameCommandRetries = 5;
    private int historyLimit = 50;
    private String toolName = "write_command";

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
    public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }
    public long getRetryDelayMs() { return retryDelayMs; }
    public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }
    public int getMaxSameCommandRetries() { return maxSameCommandRetries; }
    public void setMaxSameCommandRetries(int maxSameCommandRetries) { this.maxSameCommandRetries = maxSameCommandRetries; }
    public int getHistoryLimit() { return historyLimit; }
    public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
    public String getToolName() { return toolName; }
    public void setToolName(String toolName) { this.toolName = toolName; }

    public Duration attemptTimeout() { return Duration.ofMillis(attemptTimeoutMs); }
    public Duration retryDelay() { return Duration.ofMillis(retryDelayMs); }
}
