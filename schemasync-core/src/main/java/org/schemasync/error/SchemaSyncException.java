package org.schemasync.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Classified failure. Carries an {@link ErrorType}, a recoverable flag used by the retry policy and free-form
 * context (failing statement, driver error code, attempt count).
 */
public class SchemaSyncException extends RuntimeException {

    private final ErrorType type;
    private final boolean recoverable;
    private final Map<String, Object> context = new LinkedHashMap<>();
    private String userMessage;

    public SchemaSyncException(ErrorType type, String message) {
        this(type, message, null, false);
    }

    public SchemaSyncException(ErrorType type, String message, Throwable cause) {
        this(type, message, cause, false);
    }

    public SchemaSyncException(ErrorType type, String message, Throwable cause, boolean recoverable) {
        super(message, cause);
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.recoverable = recoverable;
    }

    public static SchemaSyncException recoverable(ErrorType type, String message, Throwable cause) {
        return new SchemaSyncException(type, message, cause, true);
    }

    public static SchemaSyncException validation(String message) {
        return new SchemaSyncException(ErrorType.VALIDATION, message);
    }

    /**
     * Wraps {@code cause} under a new message. A cause that is already classified keeps its type and
     * recoverability; anything else is classified first.
     */
    public static SchemaSyncException wrap(Throwable cause, String message) {
        SchemaSyncException classified = ErrorClassifier.classify(cause);
        SchemaSyncException wrapped = new SchemaSyncException(classified.getType(), message, cause, classified.isRecoverable());
        wrapped.context.putAll(classified.context);
        return wrapped;
    }

    public SchemaSyncException withContext(String key, Object value) {
        context.put(key, value);
        return this;
    }

    public SchemaSyncException withUserMessage(String userMessage) {
        this.userMessage = userMessage;
        return this;
    }

    public ErrorType getType() {
        return type;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Message meant for end users; falls back to the technical message.
     */
    public String getUserMessage() {
        return userMessage != null && !userMessage.isBlank() ? userMessage : getMessage();
    }

    @Override
    public String toString() {
        String base = type + ": " + getMessage();
        if (getCause() != null) {
            base += " (caused by: " + getCause() + ")";
        }
        return base;
    }
}
