package com.nginx.log.cursor;

import java.io.Closeable;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * Persistent per-file index cursors, keyed by absolute file path.
 */
public interface CursorStore extends Closeable {

    /**
     * The stored cursor, or a new enabled cursor grouped under the file's main log path.
     */
    LogIndexCursor getLogIndex(String path) throws SQLException;

    /** Insert or update by path. */
    void save(LogIndexCursor cursor) throws SQLException;

    /** Enabled cursors only. */
    List<LogIndexCursor> getAll() throws SQLException;

    List<LogIndexCursor> getByMainLogPath(String mainLogPath) throws SQLException;

    void delete(String path) throws SQLException;

    void deleteAll() throws SQLException;

    /**
     * Removes cursors whose last index time is older than {@code maxAge}.
     *
     * @return rows removed
     */
    int cleanupOld(Duration maxAge) throws SQLException;

    CursorStats getIndexStats() throws SQLException;

    void disable(String path) throws SQLException;

    void enable(String path) throws SQLException;
}
