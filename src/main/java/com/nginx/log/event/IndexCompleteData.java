package com.nginx.log.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of {@link EventType#INDEX_COMPLETE}. Published at most once per group rebuild.
 */
public class IndexCompleteData {

    @JsonProperty("log_path")
    private final String logPath;

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("duration_ms")
    private final long durationMs;

    @JsonProperty("total_lines")
    private final long totalLines;

    @JsonProperty("indexed_size_bytes")
    private final long indexedSizeBytes;

    @JsonProperty("error")
    private final String error;

    public IndexCompleteData(String logPath, boolean success, long durationMs, long totalLines, long indexedSizeBytes,
            String error) {
        this.logPath = logPath;
        this.success = success;
        this.durationMs = durationMs;
        this.totalLines = totalLines;
        this.indexedSizeBytes = indexedSizeBytes;
        this.error = error == null ? "" : error;
    }

    public String getLogPath() {
        return logPath;
    }

    public boolean isSuccess() {
        return success;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public long getTotalLines() {
        return totalLines;
    }

    public long getIndexedSizeBytes() {
        return indexedSizeBytes;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "IndexCompleteData [logPath=" + logPath + ", success=" + success + ", totalLines=" + totalLines
                + ", indexedSizeBytes=" + indexedSizeBytes + "]";
    }
}
