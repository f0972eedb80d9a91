package com.nginx.log.indexer;

/**
 * Outcome of indexing one file.
 */
public class FileIndexStats {

    public final String filePath;
    public final long linesRead;
    public final long entriesIndexed;
    public final long startPosition;
    public final long endPosition;
    public final long durationMs;
    public final boolean cancelled;

    public FileIndexStats(String filePath, long linesRead, long entriesIndexed, long startPosition, long endPosition,
            long durationMs, boolean cancelled) {
        this.filePath = filePath;
        this.linesRead = linesRead;
        this.entriesIndexed = entriesIndexed;
        this.startPosition = startPosition;
        this.endPosition = endPosition;
        this.durationMs = durationMs;
        this.cancelled = cancelled;
    }

    public static FileIndexStats skipped(String filePath, long position) {
        return new FileIndexStats(filePath, 0, 0, position, position, 0, false);
    }

    @Override
    public String toString() {
        return "FileIndexStats [filePath=" + filePath + ", linesRead=" + linesRead + ", entriesIndexed=" + entriesIndexed
                + ", position=" + startPosition + "->" + endPosition + ", durationMs=" + durationMs
                + (cancelled ? ", cancelled" : "") + "]";
    }
}
