package com.nginx.log.error;

/**
 * Search-path rejection, surfaced to the caller as is.
 */
public class QueryException extends LogIndexException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        RATE_LIMITED,
        CIRCUIT_OPEN,
        REQUEST_TIMEOUT,
        CANCELLED
    }

    private final Reason reason;

    public QueryException(Reason reason, String message) {
        super(ErrorCategory.QUERY, message);
        this.reason = reason;
    }

    public QueryException(Reason reason, String message, Throwable cause) {
        super(ErrorCategory.QUERY, message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getReasonName() {
        return reason.name();
    }
}
