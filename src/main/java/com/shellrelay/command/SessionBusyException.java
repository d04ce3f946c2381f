package com.shellrelay.command;

/**
 * A session already has a command in progress; concurrent commands are rejected, not queued.
 */
public class SessionBusyException extends IllegalStateException {

    private final String sessionId;
    private final PendingCommand pending;

    public SessionBusyException(String sessionId, PendingCommand pending) {
        super("Session " + sessionId + " is already executing a command"
                + (pending != null ? ": " + pending.command() : ""));
        this.sessionId = sessionId;
        this.pending = pending;
    }

    public String getSessionId() {
        return sessionId;
    }

    public PendingCommand getPending() {
        return pending;
    }
}
