package com.nginx.log.progress;

/**
 * Progress of one file inside a group. Mutated only by {@link ProgressTracker} under
 * its write lock.
 */
public class FileProgress {

    static final long INITIAL_AVG_LINE_SIZE = 120;
    static final long MIN_AVG_LINE_SIZE = 50;
    static final long MAX_AVG_LINE_SIZE = 5000;
    static final long COMPRESSION_RATIO = 3;

    private final String filePath;
    private final boolean compressed;
    private FileState state = FileState.PENDING;
    private long estimatedLines;
    private long processedLines;
    private long fileSize;
    private long currentPosition;
    private long avgLineSize = INITIAL_AVG_LINE_SIZE;
    private long sampleCount;
    private long startTime;
    private long completedTime;
    private String error;

    FileProgress(String filePath, boolean compressed) {
        this.filePath = filePath;
        this.compressed = compressed;
    }

    FileProgress(FileProgress other) {
        this.filePath = other.filePath;
        this.compressed = other.compressed;
        this.state = other.state;
        this.estimatedLines = other.estimatedLines;
        this.processedLines = other.processedLines;
        this.fileSize = other.fileSize;
        this.currentPosition = other.currentPosition;
        this.avgLineSize = other.avgLineSize;
        this.sampleCount = other.sampleCount;
        this.startTime = other.startTime;
        this.completedTime = other.completedTime;
        this.error = other.error;
    }

    /**
     * Compressed files only: re-derives the average uncompressed line size from the
     * 3:1 assumption, sampling densely for the first 1000 lines.
     */
    void updateAverageLineSize(long linesProcessed) {
        if (linesProcessed <= 0) {
            return;
        }
        if (sampleCount < 1000 || sampleCount % 100 == 0) {
            long estimate = fileSize * COMPRESSION_RATIO / linesProcessed;
            if (estimate > MIN_AVG_LINE_SIZE && estimate < MAX_AVG_LINE_SIZE) {
                avgLineSize = sampleCount > 0 ? (avgLineSize + estimate) / 2 : estimate;
            }
        }
        sampleCount = linesProcessed;
    }

    /**
     * Bytes this file contributed, measured where possible.
     */
    long getIndexedBytes() {
        if (compressed) {
            return processedLines * avgLineSize;
        }
        return currentPosition > 0 ? currentPosition : processedLines * 150;
    }

    public String getFilePath() {
        return filePath;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public FileState getState() {
        return state;
    }

    void setState(FileState state) {
        this.state = state;
    }

    public long getEstimatedLines() {
        return estimatedLines;
    }

    void setEstimatedLines(long estimatedLines) {
        this.estimatedLines = estimatedLines;
    }

    public long getProcessedLines() {
        return processedLines;
    }

    void setProcessedLines(long processedLines) {
        this.processedLines = processedLines;
    }

    public long getFileSize() {
        return fileSize;
    }

    void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }

    public long getCurrentPosition() {
        return currentPosition;
    }

    void setCurrentPosition(long currentPosition) {
        this.currentPosition = currentPosition;
    }

    public long getAvgLineSize() {
        return avgLineSize;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public long getStartTime() {
        return startTime;
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getCompletedTime() {
        return completedTime;
    }

    void setCompletedTime(long completedTime) {
        this.completedTime = completedTime;
    }

    public String getError() {
        return error;
    }

    void setError(String error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return "FileProgress [filePath=" + filePath + ", state=" + state + ", processedLines=" + processedLines
                + ", estimatedLines=" + estimatedLines + "]";
    }
}
