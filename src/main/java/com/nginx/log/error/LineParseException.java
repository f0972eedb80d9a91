package com.nginx.log.error;

/**
 * Line-local parse failure. Counted and absorbed by the batch parser.
 */
public class LineParseException extends LogIndexException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        EMPTY_LINE,
        UNSUPPORTED_LOG_FORMAT,
        INVALID_TIMESTAMP
    }

    private final Reason reason;

    public LineParseException(Reason reason, String message) {
        super(ErrorCategory.LINE, message);
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
