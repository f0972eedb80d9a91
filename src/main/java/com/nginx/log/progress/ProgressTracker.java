package com.nginx.log.progress;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nginx.log.event.EventBus;
import com.nginx.log.event.EventType;
import com.nginx.log.event.IndexCompleteData;
import com.nginx.log.event.IndexProgressData;
import com.nginx.log.event.IndexReadyData;

/**
 * Aggregates line progress over the files of one log group and publishes throttled
 * progress events plus a single completion event.
 * <p>
 * All mutations happen under the write lock, and events are published while it is
 * held so that the completion event is always the last event of a rebuild.
 */
public class ProgressTracker {

    static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

    static final long NOTIFY_INTERVAL_MS = 2000;
    static final double RUNNING_CEILING = 99.9;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final String logGroupPath;
    private final EventBus eventBus;
    private final LongSupplier clock;
    private final long startTime;
    private final Map<String, FileProgress> files = new LinkedHashMap<>();

    private long totalEstimate;
    private long totalActual;
    private boolean completed;
    private boolean completionNotified;
    private long lastNotify = Long.MIN_VALUE;
    private double lastPublished;

    public ProgressTracker(String logGroupPath, EventBus eventBus) {
        this(logGroupPath, eventBus, System::currentTimeMillis);
    }

    public ProgressTracker(String logGroupPath, EventBus eventBus, LongSupplier clock) {
        this.logGroupPath = logGroupPath;
        this.eventBus = eventBus;
        this.clock = clock;
        this.startTime = clock.getAsLong();
    }

    /**
     * Line estimate used before a file has been read: 100 bytes per line, with a 3:1
     * ratio assumed for compressed files.
     */
    public static long estimateFileLines(long fileSize, boolean compressed) {
        if (fileSize <= 0) {
            return 0;
        }
        if (compressed) {
            return fileSize * FileProgress.COMPRESSION_RATIO / 100;
        }
        return fileSize / 100;
    }

    public void addFile(String filePath, boolean compressed) {
        lock.writeLock().lock();
        try {
            FileProgress previous = files.put(filePath, new FileProgress(filePath, compressed));
            if (previous != null) {
                totalEstimate -= previous.getEstimatedLines();
                totalActual -= previous.getProcessedLines();
            }
            logger.debug("Added {} to progress of {} (compressed: {})", filePath, logGroupPath, compressed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setFileEstimate(String filePath, long estimatedLines) {
        lock.writeLock().lock();
        try {
            FileProgress progress = files.get(filePath);
            if (progress != null) {
                totalEstimate = totalEstimate - progress.getEstimatedLines() + estimatedLines;
                progress.setEstimatedLines(estimatedLines);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setFileSize(String filePath, long fileSize) {
        lock.writeLock().lock();
        try {
            FileProgress progress = files.get(filePath);
            if (progress != null) {
                progress.setFileSize(fileSize);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void startFile(String filePath) {
        lock.writeLock().lock();
        try {
            FileProgress progress = files.get(filePath);
            if (progress != null && progress.getState() == FileState.PENDING) {
                progress.setState(FileState.PROCESSING);
                progress.setStartTime(clock.getAsLong());
                notifyProgressLocked();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records the read position (plain files) or refines the average line size
     * (compressed files). Does not publish.
     */
    public void updateFilePosition(String filePath, long currentPosition, long linesProcessed) {
        lock.writeLock().lock();
        try {
            FileProgress progress = files.get(filePath);
            if (progress == null) {
                return;
            }
            if (progress.isCompressed()) {
                progress.updateAverageLineSize(linesProcessed);
            } else {
                progress.setCurrentPosition(currentPosition);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void updateFileProgress(String filePath, long processedLines) {
        lock.writeLock().lock();
        try {
            FileProgress progress = files.get(filePath);
            if (progress == null || progress.getState() == FileState.COMPLETED) {
                return;
            }
            totalActual = totalActual - progress.getProcessedLines() + processedLines;
            progress.setProcessedLines(processedLines);
            notifyProgressLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks the file completed. The completion event is published by whichever call
     * completes the last pending file; later calls never publish it again.
     */
    public void completeFile(String filePath, long finalProcessedLines) {
        completeFile(filePath, finalProcessedLines, null);
    }

    public void failFile(String filePath, String error) {
        lock.writeLock().lock();
        try {
            FileProgress progress = files.get(filePath);
            long lines = progress == null ? 0 : progress.getProcessedLines();
            completeFile(filePath, lines, error);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void completeFile(String filePath, long finalProcessedLines, String error) {
        lock.writeLock().lock();
        try {
            FileProgress progress = files.get(filePath);
            if (progress == null) {
                return;
            }
            totalActual = totalActual - progress.getProcessedLines() + finalProcessedLines;
            progress.setProcessedLines(finalProcessedLines);
            if (progress.getState() != FileState.COMPLETED) {
                progress.setState(FileState.COMPLETED);
                progress.setCompletedTime(clock.getAsLong());
            }
            if (error != null) {
                progress.setError(error);
            }
            logger.debug("Completed {} ({} lines)", filePath, finalProcessedLines);

            if (completionNotified) {
                return;
            }
            if (allCompletedLocked()) {
                completed = true;
                completionNotified = true;
                notifyCompletionLocked(totalActual > 0, firstErrorLocked());
            } else {
                notifyProgressLocked();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Ends the rebuild with a failed completion event unless one was already sent.
     * Used when the group fails before all of its files could be completed.
     */
    public void abort(String error) {
        lock.writeLock().lock();
        try {
            if (completionNotified) {
                return;
            }
            completed = true;
            completionNotified = true;
            notifyCompletionLocked(false, error);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ProgressStats getProgress() {
        lock.readLock().lock();
        try {
            return statsLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isCompleted() {
        lock.readLock().lock();
        try {
            return completed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, FileState> getFileStates() {
        lock.readLock().lock();
        try {
            Map<String, FileState> states = new LinkedHashMap<>();
            for (FileProgress progress : files.values()) {
                states.put(progress.getFilePath(), progress.getState());
            }
            return states;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<FileProgress> getFiles() {
        lock.readLock().lock();
        try {
            List<FileProgress> copy = new ArrayList<>(files.size());
            for (FileProgress progress : files.values()) {
                copy.add(new FileProgress(progress));
            }
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getLogGroupPath() {
        return logGroupPath;
    }

    private boolean allCompletedLocked() {
        for (FileProgress progress : files.values()) {
            if (progress.getState() != FileState.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private String firstErrorLocked() {
        for (FileProgress progress : files.values()) {
            if (progress.getError() != null) {
                return progress.getError();
            }
        }
        return null;
    }

    private double percentageLocked(int completedFiles) {
        double percentage = 0;
        if (totalEstimate > 0) {
            percentage = (double) totalActual / totalEstimate * 100;
        } else if (!files.isEmpty()) {
            percentage = (double) completedFiles / files.size() * 100;
        }
        return Math.min(percentage, 100);
    }

    private ProgressStats statsLocked() {
        int completedFiles = 0;
        int processingFiles = 0;
        for (FileProgress progress : files.values()) {
            if (progress.getState() == FileState.COMPLETED) {
                completedFiles++;
            } else if (progress.getState() == FileState.PROCESSING) {
                processingFiles++;
            }
        }
        return new ProgressStats(logGroupPath, percentageLocked(completedFiles), files.size(), completedFiles,
                processingFiles, totalActual, totalEstimate, startTime, completed);
    }

    private void notifyProgressLocked() {
        long now = clock.getAsLong();
        if (lastNotify != Long.MIN_VALUE && now - lastNotify < NOTIFY_INTERVAL_MS) {
            return;
        }
        lastNotify = now;

        ProgressStats stats = statsLocked();
        double percentage = Math.max(lastPublished, Math.min(stats.getPercentage(), RUNNING_CEILING));
        lastPublished = percentage;

        long elapsed = now - startTime;
        long remaining = 0;
        if (percentage > 0 && percentage < 100) {
            remaining = (long) (elapsed / percentage * (100 - percentage));
        }
        logger.debug("Progress {}", stats);
        eventBus.publish(EventType.INDEX_PROGRESS,
                new IndexProgressData(logGroupPath, percentage, "indexing", "running", elapsed, remaining));
    }

    private void notifyCompletionLocked(boolean success, String error) {
        long elapsed = clock.getAsLong() - startTime;
        long indexedBytes = 0;
        for (FileProgress progress : files.values()) {
            indexedBytes += progress.getIndexedBytes();
        }

        lastPublished = 100;
        eventBus.publish(EventType.INDEX_PROGRESS,
                new IndexProgressData(logGroupPath, 100, "indexing", "completed", elapsed, 0));
        eventBus.publish(EventType.INDEX_COMPLETE,
                new IndexCompleteData(logGroupPath, success, elapsed, totalActual, indexedBytes, error));
        eventBus.publish(EventType.INDEX_READY, new IndexReadyData(logGroupPath, success));

        logger.info("Indexing of group {} completed: {} files, {} lines in {}ms (success: {})", logGroupPath,
                files.size(), totalActual, elapsed, success);
    }
}
