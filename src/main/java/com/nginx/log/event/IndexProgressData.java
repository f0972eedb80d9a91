package com.nginx.log.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of {@link EventType#INDEX_PROGRESS}.
 */
public class IndexProgressData {

    @JsonProperty("log_path")
    private final String logPath;

    @JsonProperty("progress")
    private final double progress;

    @JsonProperty("stage")
    private final String stage;

    @JsonProperty("status")
    private final String status;

    @JsonProperty("elapsed_ms")
    private final long elapsedMs;

    @JsonProperty("estimated_remaining_ms")
    private final long estimatedRemainingMs;

    public IndexProgressData(String logPath, double progress, String stage, String status, long elapsedMs,
            long estimatedRemainingMs) {
        this.logPath = logPath;
        this.progress = progress;
        this.stage = stage;
        this.status = status;
        this.elapsedMs = elapsedMs;
        this.estimatedRemainingMs = estimatedRemainingMs;
    }

    public String getLogPath() {
        return logPath;
    }

    public double getProgress() {
        return progress;
    }

    public String getStage() {
        return stage;
    }

    public String getStatus() {
        return status;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public long getEstimatedRemainingMs() {
        return estimatedRemainingMs;
    }

    @Override
    public String toString() {
        return String.format("IndexProgressData [logPath=%s, progress=%.1f, status=%s]", logPath, progress, status);
    }
}
