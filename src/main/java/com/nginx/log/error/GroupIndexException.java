package com.nginx.log.error;

/**
 * A log group could not be rebuilt. Surfaced to the caller, but a full
 * rebuild keeps going with the other groups.
 */
public class GroupIndexException extends LogIndexException {

    private static final long serialVersionUID = 1L;

    private final String mainLogPath;

    public GroupIndexException(String mainLogPath, String message, Throwable cause) {
        super(ErrorCategory.GROUP, message, cause);
        this.mainLogPath = mainLogPath;
    }

    public String getMainLogPath() {
        return mainLogPath;
    }

    @Override
    public String getReasonName() {
        return "GROUP_REBUILD_FAILED";
    }
}
