package com.nginx.log.error;

/**
 * Failure that is fatal for one file. Within a group rebuild the file is skipped
 * and the remaining siblings are still indexed.
 */
public class FileIndexException extends LogIndexException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        FILE_ACCESS_DENIED,
        SYMLINK_ESCAPES_WHITELIST,
        FILE_TOO_LARGE,
        INCREMENTAL_ON_COMPRESSED,
        BATCH_COMMIT_ERROR,
        CURSOR_PERSIST_FAILURE
    }

    private final Reason reason;
    private final String path;

    public FileIndexException(Reason reason, String path, String message) {
        super(ErrorCategory.FILE, message);
        this.reason = reason;
        this.path = path;
    }

    public FileIndexException(Reason reason, String path, String message, Throwable cause) {
        super(ErrorCategory.FILE, message, cause);
        this.reason = reason;
        this.path = path;
    }

    public Reason getReason() {
        return reason;
    }

    public String getPath() {
        return path;
    }

    @Override
    public String getReasonName() {
        return reason.name();
    }
}
