package com.shellrelay.core.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps heterogeneous failures onto {@link ErrorKind} with a retryability flag,
 * a user-facing message and a suggestion.
 *
 * <p>Rules are checked in order and the first match wins:
 * <ol>
 *   <li>spawn failure or missing executable: connection, retryable</li>
 *   <li>connection refused/reset or lost: connection, retryable</li>
 *   <li>timeout indicator: timeout, retryable</li>
 *   <li>protocol indicator: protocol, not retryable</li>
 *   <li>"not found" / "invalid": tool_call, not retryable</li>
 *   <li>anything else: tool_call, retryable</li>
 * </ol>
 * Exceptions implementing {@link ClassifiedFailure} with a non-null kind skip the
 * message inspection for that kind.
 */
@Component
public class ErrorClassifier {

    static final String MSG_SERVER_NOT_FOUND = "MCP server not found. Please check the installation.";
    static final String MSG_CONNECTION_REFUSED = "Cannot connect to the terminal. Please ensure it is running.";
    static final String MSG_CONNECTION_LOST = "The connection to the MCP server is not available.";
    static final String MSG_TIMEOUT = "Operation timed out. Please try again.";
    static final String MSG_PROTOCOL = "Protocol communication error";
    static final String MSG_NOT_FOUND = "The requested tool or command was not found.";
    static final String MSG_INVALID = "Invalid request. Please check your input.";
    static final String MSG_GENERIC = "An error occurred while executing the command. Please try again.";

    static final String SUGGEST_SPAWN =
            "Check that the MCP server executable exists and that shellrelay.mcp.executable and args are correct.";
    static final String SUGGEST_REFUSED = "Ensure the terminal container or host service is running on the expected port.";
    static final String SUGGEST_CONNECTION =
            "The MCP server process is not running. It restarts automatically; reinitialize the client if reconnection failed.";
    static final String SUGGEST_TIMEOUT =
            "The operation took too long. Try a simpler command or increase the timeout.";
    static final String SUGGEST_PROTOCOL =
            "There was an error in the MCP protocol communication. This may indicate a bug.";
    static final String SUGGEST_UNKNOWN_TOOL = "The tool is not available. Check the MCP server configuration.";
    static final String SUGGEST_INVALID_ARGS = "Check the arguments passed to the tool.";
    static final String SUGGEST_TOOL_FAILED = "The tool execution failed. Check the command and try again.";
    static final String SUGGEST_LOOP = "Try a different approach instead of repeating the same command.";

    public ErrorInfo classify(Throwable error) {
        return classify(error, Map.of());
    }

    public ErrorInfo classify(Throwable error, Map<String, Object> details) {
        Throwable root = unwrap(error);
        String detail = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        String text = detail.toLowerCase(Locale.ROOT);

        if (root instanceof ClassifiedFailure classified && classified.kind() != null) {
            return fromDeclaredKind(classified, text, detail, details);
        }

        if (isSpawnFailure(root, text)) {
            return info(ErrorKind.CONNECTION, MSG_SERVER_NOT_FOUND, detail, true, SUGGEST_SPAWN, details);
        }
        if (root instanceof ConnectException || text.contains("connection refused")
                || text.contains("connection reset") || text.contains("econnrefused")
                || text.contains("econnreset")) {
            return info(ErrorKind.CONNECTION, MSG_CONNECTION_REFUSED, detail, true, SUGGEST_REFUSED, details);
        }
        if (root instanceof TimeoutException || isTimeoutText(text)) {
            return info(ErrorKind.TIMEOUT, MSG_TIMEOUT, detail, true, SUGGEST_TIMEOUT, details);
        }
        if (root instanceof JsonProcessingException || text.contains("protocol")) {
            return info(ErrorKind.PROTOCOL, MSG_PROTOCOL, detail, false, SUGGEST_PROTOCOL, details);
        }
        return toolCall(text, detail, details);
    }

    /**
     * Whether retrying the operation that raised {@code error} may succeed.
     */
    public boolean isRetryable(Throwable error) {
        return classify(error).retryable();
    }

    /**
     * Builds the non-retryable loop detection failure for a command repeated {@code count} times.
     */
    public ErrorInfo loopDetected(String command, int count) {
        String message = "Command loop detected: \"" + command + "\" has been executed " + count
                + " times. Please try a different approach.";
        return info(ErrorKind.LOOP_DETECTED, message, "", false, SUGGEST_LOOP,
                Map.of("command", command, "count", count));
    }

    private ErrorInfo fromDeclaredKind(ClassifiedFailure classified, String text, String detail,
                                       Map<String, Object> details) {
        String suggestion = classified.suggestion();
        String message = classified.userMessage();
        return switch (classified.kind()) {
            case CONNECTION -> info(ErrorKind.CONNECTION,
                    message != null ? message : MSG_CONNECTION_LOST, detail, true,
                    suggestion != null ? suggestion : SUGGEST_CONNECTION, details);
            case TIMEOUT -> info(ErrorKind.TIMEOUT, MSG_TIMEOUT, detail, true,
                    suggestion != null ? suggestion : SUGGEST_TIMEOUT, details);
            case PROTOCOL -> info(ErrorKind.PROTOCOL, MSG_PROTOCOL, detail, false,
                    suggestion != null ? suggestion : SUGGEST_PROTOCOL, details);
            case TOOL_CALL -> toolCall(text, detail, details);
            case LOOP_DETECTED -> info(ErrorKind.LOOP_DETECTED, detail, detail, false,
                    suggestion != null ? suggestion : SUGGEST_LOOP, details);
        };
    }

    private ErrorInfo toolCall(String text, String detail, Map<String, Object> details) {
        if (text.contains("unknown tool") || text.contains("not found")) {
            return info(ErrorKind.TOOL_CALL, MSG_NOT_FOUND, detail, false, SUGGEST_UNKNOWN_TOOL, details);
        }
        if (text.contains("invalid")) {
            return info(ErrorKind.TOOL_CALL, MSG_INVALID, detail, false, SUGGEST_INVALID_ARGS, details);
        }
        return info(ErrorKind.TOOL_CALL, MSG_GENERIC, detail, true, SUGGEST_TOOL_FAILED, details);
    }

    private static boolean isSpawnFailure(Throwable root, String text) {
        if (!(root instanceof IOException)) {
            return false;
        }
        return text.contains("cannot run program") || text.contains("error=2")
                || text.contains("no such file or directory") || text.contains("enoent");
    }

    private static boolean isTimeoutText(String text) {
        return text.contains("timeout") || text.contains("timed out");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ErrorInfo info(ErrorKind kind, String message, String detail, boolean retryable,
                                  String suggestion, Map<String, Object> details) {
        return new ErrorInfo(kind, message, detail, retryable, suggestion, details, Instant.now());
    }
}
