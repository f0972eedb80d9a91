package com.nginx.log.cursor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nginx.log.files.LogFileGroups;

/**
 * {@link CursorStore} backed by a single SQLite table. One connection is shared and
 * access is serialized on this object.
 */
public class SqliteCursorStore implements CursorStore {

    static final Logger logger = LoggerFactory.getLogger(SqliteCursorStore.class);

    public static final String IN_MEMORY = ":memory:";

    private static final String COLUMNS = "path, main_log_path, enabled, last_modified, last_size, last_position, "
            + "last_indexed, index_start_time, index_duration, timerange_start, timerange_end, document_count, "
            + "index_status, error_message, error_time, retry_count, queue_position";

    private static final String UPSERT = "INSERT INTO nginx_log_indexes (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(path) DO UPDATE SET main_log_path = excluded.main_log_path, enabled = excluded.enabled, "
            + "last_modified = excluded.last_modified, last_size = excluded.last_size, "
            + "last_position = excluded.last_position, last_indexed = excluded.last_indexed, "
            + "index_start_time = excluded.index_start_time, index_duration = excluded.index_duration, "
            + "timerange_start = excluded.timerange_start, timerange_end = excluded.timerange_end, "
            + "document_count = excluded.document_count, index_status = excluded.index_status, "
            + "error_message = excluded.error_message, error_time = excluded.error_time, "
            + "retry_count = excluded.retry_count, queue_position = excluded.queue_position";

    private final Connection conn;

    public SqliteCursorStore(String dbPath) throws SQLException {
        if (!IN_MEMORY.equals(dbPath)) {
            createParentDirectory(dbPath);
        }
        conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
        initDb();
        logger.info("Cursor store opened at {}", dbPath);
    }

    public static SqliteCursorStore inMemory() throws SQLException {
        return new SqliteCursorStore(IN_MEMORY);
    }

    private static void createParentDirectory(String dbPath) throws SQLException {
        Path parent = Paths.get(dbPath).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SQLException("Unable to create directory for cursor database " + dbPath, e);
        }
    }

    private void initDb() throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS nginx_log_indexes ("
                    + "path TEXT PRIMARY KEY, "
                    + "main_log_path TEXT, "
                    + "enabled INTEGER NOT NULL DEFAULT 1, "
                    + "last_modified INTEGER NOT NULL DEFAULT 0, "
                    + "last_size INTEGER NOT NULL DEFAULT 0, "
                    + "last_position INTEGER NOT NULL DEFAULT 0, "
                    + "last_indexed INTEGER NOT NULL DEFAULT 0, "
                    + "index_start_time INTEGER, "
                    + "index_duration INTEGER, "
                    + "timerange_start INTEGER, "
                    + "timerange_end INTEGER, "
                    + "document_count INTEGER NOT NULL DEFAULT 0, "
                    + "index_status TEXT NOT NULL DEFAULT 'not_indexed', "
                    + "error_message TEXT, "
                    + "error_time INTEGER, "
                    + "retry_count INTEGER NOT NULL DEFAULT 0, "
                    + "queue_position INTEGER NOT NULL DEFAULT 0)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_nginx_log_indexes_main ON nginx_log_indexes (main_log_path)");
        }
    }

    @Override
    public synchronized LogIndexCursor getLogIndex(String path) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM nginx_log_indexes WHERE path = ?")) {
            pstmt.setString(1, path);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return read(rs);
                }
            }
        }
        return new LogIndexCursor(path);
    }

    @Override
    public synchronized void save(LogIndexCursor cursor) throws SQLException {
        if (cursor.getMainLogPath() == null || cursor.getMainLogPath().isEmpty()) {
            cursor.setMainLogPath(LogFileGroups.getMainLogPath(cursor.getPath()));
        }
        try (PreparedStatement pstmt = conn.prepareStatement(UPSERT)) {
            int i = 1;
            pstmt.setString(i++, cursor.getPath());
            pstmt.setString(i++, cursor.getMainLogPath());
            pstmt.setInt(i++, cursor.isEnabled() ? 1 : 0);
            pstmt.setLong(i++, cursor.getLastModified());
            pstmt.setLong(i++, cursor.getLastSize());
            pstmt.setLong(i++, cursor.getLastPosition());
            pstmt.setLong(i++, cursor.getLastIndexed());
            setNullableLong(pstmt, i++, cursor.getIndexStartTime());
            setNullableLong(pstmt, i++, cursor.getIndexDuration());
            setNullableLong(pstmt, i++, cursor.getTimeRangeStart());
            setNullableLong(pstmt, i++, cursor.getTimeRangeEnd());
            pstmt.setLong(i++, cursor.getDocumentCount());
            pstmt.setString(i++, cursor.getIndexStatus().getValue());
            pstmt.setString(i++, cursor.getErrorMessage());
            setNullableLong(pstmt, i++, cursor.getErrorTime());
            pstmt.setInt(i++, cursor.getRetryCount());
            pstmt.setInt(i, cursor.getQueuePosition());
            pstmt.executeUpdate();
        }
    }

    @Override
    public synchronized List<LogIndexCursor> getAll() throws SQLException {
        return query("SELECT " + COLUMNS + " FROM nginx_log_indexes WHERE enabled = 1 ORDER BY path", null);
    }

    @Override
    public synchronized List<LogIndexCursor> getByMainLogPath(String mainLogPath) throws SQLException {
        return query("SELECT " + COLUMNS + " FROM nginx_log_indexes WHERE main_log_path = ? ORDER BY path", mainLogPath);
    }

    @Override
    public synchronized void delete(String path) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement("DELETE FROM nginx_log_indexes WHERE path = ?")) {
            pstmt.setString(1, path);
            if (pstmt.executeUpdate() > 0) {
                logger.info("Deleted cursor for {}", path);
            }
        }
    }

    @Override
    public synchronized void deleteAll() throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            int rows = stmt.executeUpdate("DELETE FROM nginx_log_indexes");
            logger.info("Deleted all {} cursors", rows);
        }
    }

    @Override
    public synchronized int cleanupOld(Duration maxAge) throws SQLException {
        long cutoff = System.currentTimeMillis() - maxAge.toMillis();
        try (PreparedStatement pstmt = conn.prepareStatement("DELETE FROM nginx_log_indexes WHERE last_indexed < ?")) {
            pstmt.setLong(1, cutoff);
            int rows = pstmt.executeUpdate();
            if (rows > 0) {
                logger.info("Cleaned up {} old cursors", rows);
            }
            return rows;
        }
    }

    @Override
    public synchronized CursorStats getIndexStats() throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*), COALESCE(SUM(enabled), 0), "
                        + "COALESCE(SUM(document_count), 0) FROM nginx_log_indexes")) {
            rs.next();
            return new CursorStats(rs.getLong(1), rs.getLong(2), rs.getLong(3));
        }
    }

    @Override
    public void disable(String path) throws SQLException {
        setEnabled(path, false);
    }

    @Override
    public void enable(String path) throws SQLException {
        setEnabled(path, true);
    }

    private synchronized void setEnabled(String path, boolean enabled) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement("UPDATE nginx_log_indexes SET enabled = ? WHERE path = ?")) {
            pstmt.setInt(1, enabled ? 1 : 0);
            pstmt.setString(2, path);
            pstmt.executeUpdate();
            logger.info("{} cursor for {}", enabled ? "Enabled" : "Disabled", path);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            conn.close();
        } catch (SQLException e) {
            throw new IOException("Failed to close cursor store", e);
        }
    }

    private List<LogIndexCursor> query(String sql, String parameter) throws SQLException {
        List<LogIndexCursor> cursors = new ArrayList<>();
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            if (parameter != null) {
                pstmt.setString(1, parameter);
            }
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    cursors.add(read(rs));
                }
            }
        }
        return cursors;
    }

    private static LogIndexCursor read(ResultSet rs) throws SQLException {
        LogIndexCursor cursor = new LogIndexCursor();
        cursor.setPath(rs.getString("path"));
        cursor.setMainLogPath(rs.getString("main_log_path"));
        cursor.setEnabled(rs.getInt("enabled") != 0);
        cursor.setLastModified(rs.getLong("last_modified"));
        cursor.setLastSize(rs.getLong("last_size"));
        cursor.setLastPosition(rs.getLong("last_position"));
        cursor.setLastIndexed(rs.getLong("last_indexed"));
        cursor.setIndexStartTime(nullableLong(rs, "index_start_time"));
        cursor.setIndexDuration(nullableLong(rs, "index_duration"));
        cursor.setTimeRangeStart(nullableLong(rs, "timerange_start"));
        cursor.setTimeRangeEnd(nullableLong(rs, "timerange_end"));
        cursor.setDocumentCount(rs.getLong("document_count"));
        cursor.setIndexStatus(IndexStatus.fromValue(rs.getString("index_status")));
        cursor.setErrorMessage(rs.getString("error_message"));
        cursor.setErrorTime(nullableLong(rs, "error_time"));
        cursor.setRetryCount(rs.getInt("retry_count"));
        cursor.setQueuePosition(rs.getInt("queue_position"));
        return cursor;
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement pstmt, int index, Long value) throws SQLException {
        if (value == null) {
            pstmt.setNull(index, Types.INTEGER);
        } else {
            pstmt.setLong(index, value);
        }
    }
}
