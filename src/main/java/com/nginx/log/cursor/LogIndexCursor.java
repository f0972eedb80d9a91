package com.nginx.log.cursor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nginx.log.files.LogFileGroups;

/**
 * Incremental indexing position and metadata of one log file. Wall-clock times are
 * epoch milliseconds (0 when unset); the record time range is in epoch seconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogIndexCursor {

    private static final long ONE_HOUR_MS = 60 * 60 * 1000L;

    @JsonProperty("path")
    private String path;

    @JsonProperty("main_log_path")
    private String mainLogPath;

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("last_modified")
    private long lastModified;

    /** Total size of the group's files when last indexed. */
    @JsonProperty("last_size")
    private long lastSize;

    /** Byte offset the next incremental run starts from. */
    @JsonProperty("last_position")
    private long lastPosition;

    @JsonProperty("last_indexed")
    private long lastIndexed;

    @JsonProperty("index_start_time")
    private Long indexStartTime;

    @JsonProperty("index_duration")
    private Long indexDuration;

    @JsonProperty("timerange_start")
    private Long timeRangeStart;

    @JsonProperty("timerange_end")
    private Long timeRangeEnd;

    @JsonProperty("document_count")
    private long documentCount;

    @JsonProperty("index_status")
    private IndexStatus indexStatus = IndexStatus.NOT_INDEXED;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("error_time")
    private Long errorTime;

    @JsonProperty("retry_count")
    private int retryCount;

    @JsonProperty("queue_position")
    private int queuePosition;

    public LogIndexCursor() {
    }

    public LogIndexCursor(String path) {
        this.path = path;
        this.mainLogPath = LogFileGroups.getMainLogPath(path);
    }

    /**
     * True when the file was never indexed, has grown since, or shrank (rotation).
     */
    public boolean needsIndexing(long fileModTime, long fileSize) {
        if (lastIndexed == 0) {
            return true;
        }
        if (fileModTime > lastModified && fileSize > lastSize) {
            return true;
        }
        return fileSize < lastSize;
    }

    /**
     * True when the file looks replaced: it shrank, or is much older than what was indexed.
     */
    public boolean shouldFullReindex(long fileModTime, long fileSize) {
        if (fileSize < lastSize) {
            return true;
        }
        return fileModTime < lastModified - ONE_HOUR_MS;
    }

    public void updateProgress(long modTime, long size, long position, long docCount, Long timeStart, Long timeEnd) {
        this.lastModified = modTime;
        this.lastSize = size;
        this.lastPosition = position;
        this.lastIndexed = System.currentTimeMillis();
        this.documentCount = docCount;
        if (timeStart != null) {
            this.timeRangeStart = timeStart;
        }
        if (timeEnd != null) {
            this.timeRangeEnd = timeEnd;
        }
    }

    /**
     * Widens the stored time range to include {@code [min, max]} (epoch seconds).
     */
    public void expandTimeRange(long min, long max) {
        if (min > 0 && (timeRangeStart == null || min < timeRangeStart)) {
            timeRangeStart = min;
        }
        if (max > 0 && (timeRangeEnd == null || max > timeRangeEnd)) {
            timeRangeEnd = max;
        }
    }

    public void markIndexDuration(long startTime) {
        if (indexStartTime == null) {
            indexStartTime = startTime;
        }
        indexDuration = System.currentTimeMillis() - startTime;
    }

    /**
     * Clears position data ahead of a full re-index.
     */
    public void reset() {
        lastModified = 0;
        lastSize = 0;
        lastPosition = 0;
        lastIndexed = 0;
        indexStartTime = null;
        indexDuration = null;
        documentCount = 0;
        timeRangeStart = null;
        timeRangeEnd = null;
        indexStatus = IndexStatus.NOT_INDEXED;
        errorMessage = null;
        errorTime = null;
        retryCount = 0;
        queuePosition = 0;
    }

    public void setIndexingStatus(IndexStatus status) {
        this.indexStatus = status;
        if (status == IndexStatus.INDEXING) {
            indexStartTime = System.currentTimeMillis();
        }
    }

    public void setErrorStatus(String message) {
        indexStatus = IndexStatus.ERROR;
        errorMessage = message;
        errorTime = System.currentTimeMillis();
        retryCount++;
    }

    public void setCompletedStatus() {
        indexStatus = IndexStatus.INDEXED;
        errorMessage = null;
        errorTime = null;
        queuePosition = 0;
    }

    public void setQueuedStatus(int position) {
        indexStatus = IndexStatus.QUEUED;
        queuePosition = position;
    }

    public boolean isHealthy() {
        return indexStatus == IndexStatus.INDEXED || indexStatus == IndexStatus.INDEXING;
    }

    public boolean canRetry(int maxRetries) {
        return indexStatus == IndexStatus.ERROR && retryCount < maxRetries;
    }

    @JsonProperty("has_timerange")
    public boolean hasTimeRange() {
        return timeRangeStart != null && timeRangeEnd != null;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getMainLogPath() {
        return mainLogPath;
    }

    public void setMainLogPath(String mainLogPath) {
        this.mainLogPath = mainLogPath;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getLastModified() {
        return lastModified;
    }

    public void setLastModified(long lastModified) {
        this.lastModified = lastModified;
    }

    public long getLastSize() {
        return lastSize;
    }

    public void setLastSize(long lastSize) {
        this.lastSize = lastSize;
    }

    public long getLastPosition() {
        return lastPosition;
    }

    public void setLastPosition(long lastPosition) {
        this.lastPosition = lastPosition;
    }

    public long getLastIndexed() {
        return lastIndexed;
    }

    public void setLastIndexed(long lastIndexed) {
        this.lastIndexed = lastIndexed;
    }

    public Long getIndexStartTime() {
        return indexStartTime;
    }

    public void setIndexStartTime(Long indexStartTime) {
        this.indexStartTime = indexStartTime;
    }

    public Long getIndexDuration() {
        return indexDuration;
    }

    public void setIndexDuration(Long indexDuration) {
        this.indexDuration = indexDuration;
    }

    public Long getTimeRangeStart() {
        return timeRangeStart;
    }

    public void setTimeRangeStart(Long timeRangeStart) {
        this.timeRangeStart = timeRangeStart;
    }

    public Long getTimeRangeEnd() {
        return timeRangeEnd;
    }

    public void setTimeRangeEnd(Long timeRangeEnd) {
        this.timeRangeEnd = timeRangeEnd;
    }

    public long getDocumentCount() {
        return documentCount;
    }

    public void setDocumentCount(long documentCount) {
        this.documentCount = documentCount;
    }

    public IndexStatus getIndexStatus() {
        return indexStatus;
    }

    public void setIndexStatus(IndexStatus indexStatus) {
        this.indexStatus = indexStatus;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Long getErrorTime() {
        return errorTime;
    }

    public void setErrorTime(Long errorTime) {
        this.errorTime = errorTime;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getQueuePosition() {
        return queuePosition;
    }

    public void setQueuePosition(int queuePosition) {
        this.queuePosition = queuePosition;
    }

    @Override
    public String toString() {
        return "LogIndexCursor [path=" + path + ", mainLogPath=" + mainLogPath + ", lastPosition=" + lastPosition
                + ", documentCount=" + documentCount + ", status=" + indexStatus + "]";
    }
}
