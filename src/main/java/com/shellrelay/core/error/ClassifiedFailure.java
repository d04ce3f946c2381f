package com.shellrelay.core.error;

/**
 * Implemented by exceptions that already know which {@link ErrorKind} they belong to.
 * The {@link ErrorClassifier} trusts the declared kind before falling back to
 * message inspection.
 */
public interface ClassifiedFailure {

    /**
     * @return the declared kind, or {@code null} to let the classifier inspect the message
     */
    ErrorKind kind();

    /**
     * @return a suggestion specific to this failure, or {@code null} for the kind's default
     */
    default String suggestion() {
        return null;
    }

    /**
     * @return a user-facing message specific to this failure, or {@code null} for the kind's default
     */
    default String userMessage() {
        return null;
    }
}
