package com.shellrelay.command;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySessionCommandStore implements SessionCommandStore {

    private final int historyLimit;
    private final ConcurrentHashMap<String, Deque<String>> histories = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PendingCommand> pending = new ConcurrentHashMap<>();

    public InMemorySessionCommandStore(int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("history limit must be positive");
        }
        this.historyLimit = historyLimit;
    }

    @Override
    public int countOccurrences(String sessionId, String command) {
        var history = histories.get(sessionId);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return (int) history.stream().filter(command::equals).count();
        }
    }

    @Override
    public void appendHistory(String sessionId, String command) {
        var history = histories.computeIfAbsent(sessionId, k -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(command);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
    }

    @Override
    public List<String> history(String sessionId) {
        var history = histories.get(sessionId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    @Override
    public boolean beginCommand(String sessionId, PendingCommand command) {
        return pending.putIfAbsent(sessionId, command) == null;
    }

    @Override
    public Optional<PendingCommand> pendingCommand(String sessionId) {
        return Optional.ofNullable(pending.get(sessionId));
    }

    @Override
    public void updateRetryCount(String sessionId, String commandId, int retryCount) {
        pending.computeIfPresent(sessionId, (k, current) ->
                current.id().equals(commandId) ? current.withRetryCount(retryCount) : current);
    }

    @Override
    public void endCommand(String sessionId, String commandId) {
        pending.computeIfPresent(sessionId, (k, current) -> current.id().equals(commandId) ? null : current);
    }

    @Override
    public void clearSession(String sessionId) {
        histories.remove(sessionId);
        pending.remove(sessionId);
    }
}
