package com.nginx.log.indexer;

import java.util.concurrent.CompletableFuture;

/**
 * A queued request to index one file, or a whole group when {@code fullReindex} is set
 * and the path is a main log path.
 */
public class IndexTask {

    public static final int PRIORITY_NORMAL = 1;

    /** Manual rebuilds; never debounced. */
    public static final int PRIORITY_REBUILD = 10;

    private final String filePath;
    private final int priority;
    private final boolean fullReindex;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    public IndexTask(String filePath, int priority, boolean fullReindex) {
        this.filePath = filePath;
        this.priority = priority;
        this.fullReindex = fullReindex;
    }

    public String getFilePath() {
        return filePath;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isFullReindex() {
        return fullReindex;
    }

    public boolean isDebounced() {
        return priority < PRIORITY_REBUILD;
    }

    /**
     * Completes when the task has run, was dropped, or was superseded by a newer
     * submission for the same file.
     */
    public CompletableFuture<Void> getCompletion() {
        return completion;
    }

    @Override
    public String toString() {
        return "IndexTask [filePath=" + filePath + ", priority=" + priority + ", fullReindex=" + fullReindex + "]";
    }
}
