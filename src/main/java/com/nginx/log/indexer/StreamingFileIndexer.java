package com.nginx.log.indexer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.nginx.log.cursor.CursorStore;
import com.nginx.log.cursor.IndexStatus;
import com.nginx.log.cursor.LogIndexCursor;
import com.nginx.log.error.FileIndexException;
import com.nginx.log.error.FileIndexException.Reason;
import com.nginx.log.files.LogFileGroups;
import com.nginx.log.files.LogLineReader;
import com.nginx.log.files.SafeLogFileOpener;
import com.nginx.log.index.IndexBatch;
import com.nginx.log.index.LogDocument;
import com.nginx.log.index.LogIndex;
import com.nginx.log.parser.AccessLogParser;
import com.nginx.log.parser.model.AccessLogEntry;
import com.nginx.log.progress.ProgressTracker;

/**
 * Reads one file from a byte offset to EOF, parses lines in buffered slices, and
 * commits documents in batches. The cursor is advanced and saved at the end of the run,
 * including runs stopped by cancellation; the partial batch is always committed.
 */
public class StreamingFileIndexer {

    static final Logger logger = LoggerFactory.getLogger(StreamingFileIndexer.class);

    static final int LINE_BUFFER_SIZE = 10000;
    static final int PROGRESS_INTERVAL_LINES = 5000;

    private final SafeLogFileOpener opener;
    private final AccessLogParser parser;
    private final LogIndex index;
    private final CursorStore cursorStore;
    private final int batchSize;
    private final Runnable onIndexChanged;

    public StreamingFileIndexer(SafeLogFileOpener opener, AccessLogParser parser, LogIndex index,
            CursorStore cursorStore, int batchSize, Runnable onIndexChanged) {
        this.opener = opener;
        this.parser = parser;
        this.index = index;
        this.cursorStore = cursorStore;
        this.batchSize = Math.max(1, batchSize);
        this.onIndexChanged = onIndexChanged;
    }

    /**
     * Indexes {@code filePath} from {@code startPosition}, tagging every document with
     * {@code mainLogPath}. When a tracker is given the file is completed on it, also
     * when the file turns out to be unreadable.
     */
    public FileIndexStats indexFile(String filePath, String mainLogPath, LogIndexCursor cursor, long startPosition,
            ProgressTracker tracker, CancellationToken token) throws FileIndexException {
        try {
            FileIndexStats stats = doIndexFile(filePath, mainLogPath, cursor, startPosition, tracker, token);
            if (tracker != null) {
                tracker.updateFilePosition(filePath, stats.endPosition, stats.linesRead);
                tracker.completeFile(filePath, stats.linesRead);
            }
            return stats;
        } catch (FileIndexException e) {
            if (tracker != null) {
                tracker.failFile(filePath, e.getMessage());
            }
            throw e;
        }
    }

    private FileIndexStats doIndexFile(String filePath, String mainLogPath, LogIndexCursor cursor, long startPosition,
            ProgressTracker tracker, CancellationToken token) throws FileIndexException {
        if (LogFileGroups.isCompressed(filePath) && !LogFileGroups.isGzip(filePath)) {
            logger.warn("Skipping {}: only gzip compressed logs can be read", filePath);
            return FileIndexStats.skipped(filePath, startPosition);
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        long startTime = System.currentTimeMillis();
        cursor.setIndexingStatus(IndexStatus.INDEXING);
        long modTime = lastModified(filePath);

        Run run = new Run(filePath, mainLogPath, startPosition);
        IOException readError = null;
        long fileSize;
        boolean compressed;
        long position;
        boolean cancelled = false;

        LogLineReader reader = opener.open(filePath, startPosition);
        fileSize = reader.getFileSize();
        compressed = reader.isCompressed();
        long base = Math.min(startPosition, fileSize);
        if (tracker != null) {
            tracker.setFileSize(filePath, fileSize);
        }
        logger.info("Indexing {} -> {} from position {} ({} bytes)", filePath, mainLogPath, base, fileSize);

        try {
            List<String> lines = new ArrayList<>(LINE_BUFFER_SIZE);
            try {
                if (reader.startsMidLine()) {
                    reader.readLine();
                }
                String line;
                while (true) {
                    if (token.isCancelled()) {
                        cancelled = true;
                        break;
                    }
                    line = reader.readLine();
                    if (line == null) {
                        break;
                    }
                    String trimmed = line.trim();
                    if (trimmed.isEmpty()) {
                        continue;
                    }
                    lines.add(trimmed);
                    run.linesRead++;
                    if (lines.size() >= LINE_BUFFER_SIZE) {
                        processBatch(lines, run);
                        lines.clear();
                    }
                    if (tracker != null && run.linesRead % PROGRESS_INTERVAL_LINES == 0) {
                        tracker.updateFilePosition(filePath, base + reader.getBytesConsumed(), run.linesRead);
                        tracker.updateFileProgress(filePath, run.linesRead);
                    }
                }
            } catch (IOException e) {
                readError = e;
            }
            processBatch(lines, run);
            flush(run);
            position = base + reader.getBytesConsumed();
        } finally {
            closeReader(reader, filePath);
            if (run.committed > 0 && onIndexChanged != null) {
                onIndexChanged.run();
            }
        }

        long endPosition = compressed ? fileSize : position;
        if (cancelled && compressed) {
            // a gzip stream cannot be resumed, leave the cursor for a fresh run
            logger.info("Indexing of {} cancelled ({}), {} entries indexed", filePath, token.getReason(), run.entryCount);
        } else {
            cursor.updateProgress(modTime, groupSize(mainLogPath), endPosition,
                    cursor.getDocumentCount() + run.entryCount, null, null);
            if (run.entryCount > 0) {
                cursor.expandTimeRange(run.minTimestamp, run.maxTimestamp);
            }
        }
        cursor.markIndexDuration(startTime);
        if (readError != null) {
            cursor.setErrorStatus(readError.getMessage());
        } else if (!cancelled) {
            cursor.setCompletedStatus();
        }
        saveCursor(cursor);

        if (readError != null) {
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, filePath,
                    "failed to read " + filePath + " at position " + endPosition + ": " + readError.getMessage(), readError);
        }

        long duration = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        if (cancelled) {
            logger.info("Indexing of {} stopped at position {}: {}", filePath, endPosition, token.getReason());
        } else {
            logger.info("Indexed {} entries from {} lines of {} in {} ms (position {} -> {})", run.entryCount,
                    run.linesRead, filePath, duration, base, endPosition);
        }
        return new FileIndexStats(filePath, run.linesRead, run.entryCount, base, endPosition, duration, cancelled);
    }

    private void processBatch(List<String> lines, Run run) throws FileIndexException {
        if (lines.isEmpty()) {
            return;
        }
        List<AccessLogEntry> entries = parser.parseLines(lines);
        for (AccessLogEntry entry : entries) {
            String id = LogDocument.documentId(run.filePath, run.startPosition, run.entryCount);
            run.batch.index(new LogDocument(id, run.filePath, run.mainLogPath, entry));
            run.entryCount++;
            long ts = entry.getTimestamp();
            if (run.minTimestamp == 0 || ts < run.minTimestamp) {
                run.minTimestamp = ts;
            }
            if (ts > run.maxTimestamp) {
                run.maxTimestamp = ts;
            }
            if (run.batch.size() >= batchSize) {
                flush(run);
            }
        }
    }

    private void flush(Run run) throws FileIndexException {
        int size = run.batch.size();
        if (size == 0) {
            return;
        }
        try {
            run.batch.execute();
        } catch (IOException e) {
            throw new FileIndexException(Reason.BATCH_COMMIT_ERROR, run.filePath,
                    "failed to commit " + size + " documents from " + run.filePath, e);
        }
        run.committed += size;
        run.batch = index.newBatch();
    }

    private void saveCursor(LogIndexCursor cursor) {
        try {
            cursorStore.save(cursor);
        } catch (SQLException e) {
            logger.warn("Failed to save cursor for {} ({}): {}", cursor.getPath(), Reason.CURSOR_PERSIST_FAILURE,
                    e.getMessage());
        }
    }

    private static long lastModified(String filePath) throws FileIndexException {
        try {
            return Files.getLastModifiedTime(Paths.get(filePath)).toMillis();
        } catch (IOException e) {
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, filePath, "unable to stat " + filePath, e);
        }
    }

    private static void closeReader(LogLineReader reader, String filePath) {
        try {
            reader.close();
        } catch (IOException e) {
            logger.warn("Failed to close {}: {}", filePath, e.getMessage());
        }
    }

    /**
     * Total size of the files in a group; 0 for members that vanished.
     */
    public static long groupSize(String mainLogPath) {
        long total = 0;
        for (String file : LogFileGroups.findRelatedFiles(mainLogPath)) {
            try {
                total += Files.size(Paths.get(file));
            } catch (IOException e) {
                logger.debug("Unable to size {}: {}", file, e.getMessage());
            }
        }
        return total;
    }

    private class Run {
        final String filePath;
        final String mainLogPath;
        final long startPosition;
        IndexBatch batch = index.newBatch();
        long linesRead;
        long entryCount;
        long committed;
        long minTimestamp;
        long maxTimestamp;

        Run(String filePath, String mainLogPath, long startPosition) {
            this.filePath = filePath;
            this.mainLogPath = mainLogPath;
            this.startPosition = startPosition;
        }
    }
}
