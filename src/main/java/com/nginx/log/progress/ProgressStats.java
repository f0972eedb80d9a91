package com.nginx.log.progress;

/**
 * Point-in-time view of a tracker.
 */
public class ProgressStats {

    private final String logGroupPath;
    private final double percentage;
    private final int totalFiles;
    private final int completedFiles;
    private final int processingFiles;
    private final long processedLines;
    private final long estimatedLines;
    private final long startTime;
    private final boolean completed;

    ProgressStats(String logGroupPath, double percentage, int totalFiles, int completedFiles, int processingFiles,
            long processedLines, long estimatedLines, long startTime, boolean completed) {
        this.logGroupPath = logGroupPath;
        this.percentage = percentage;
        this.totalFiles = totalFiles;
        this.completedFiles = completedFiles;
        this.processingFiles = processingFiles;
        this.processedLines = processedLines;
        this.estimatedLines = estimatedLines;
        this.startTime = startTime;
        this.completed = completed;
    }

    public String getLogGroupPath() {
        return logGroupPath;
    }

    public double getPercentage() {
        return percentage;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public int getCompletedFiles() {
        return completedFiles;
    }

    public int getProcessingFiles() {
        return processingFiles;
    }

    public long getProcessedLines() {
        return processedLines;
    }

    public long getEstimatedLines() {
        return estimatedLines;
    }

    public long getStartTime() {
        return startTime;
    }

    public boolean isCompleted() {
        return completed;
    }

    @Override
    public String toString() {
        return String.format("%s: %.1f%% (%d/%d files, %d/%d lines)", logGroupPath, percentage, completedFiles,
                totalFiles, processedLines, estimatedLines);
    }
}
