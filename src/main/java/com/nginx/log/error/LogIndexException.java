package com.nginx.log.error;

/**
 * Base of all indexing and query failures. Callers switch on {@link #getCategory()}
 * to decide whether to absorb, skip or surface the failure.
 */
public abstract class LogIndexException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorCategory category;

    protected LogIndexException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected LogIndexException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * Name of the concrete reason, e.g. {@code EMPTY_LINE}.
     */
    public abstract String getReasonName();
}
