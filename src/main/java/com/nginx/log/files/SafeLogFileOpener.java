package com.nginx.log.files;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nginx.log.error.FileIndexException;
import com.nginx.log.error.FileIndexException.Reason;

/**
 * Opens log files read-only after validating them against the whitelist, the size
 * cap and file permissions.
 */
public class SafeLogFileOpener {

    static final Logger logger = LoggerFactory.getLogger(SafeLogFileOpener.class);

    private final LogPathWhitelist whitelist;
    private final long maxFileSize;
    private final int maxLineLength;

    public SafeLogFileOpener(LogPathWhitelist whitelist, long maxFileSize) {
        this(whitelist, maxFileSize, LogLineReader.DEFAULT_MAX_LINE_LENGTH);
    }

    public SafeLogFileOpener(LogPathWhitelist whitelist, long maxFileSize, int maxLineLength) {
        this.whitelist = whitelist;
        this.maxFileSize = maxFileSize;
        this.maxLineLength = maxLineLength;
    }

    /**
     * Resolves and checks the file, returning its real path.
     */
    public Path validate(String filePath) throws FileIndexException {
        Path path = Paths.get(filePath).toAbsolutePath().normalize();
        if (!whitelist.isAllowed(path)) {
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, filePath, "path is not under the log whitelist: " + filePath);
        }

        Path real;
        try {
            real = path.toRealPath();
        } catch (NoSuchFileException e) {
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, filePath, "file does not exist: " + filePath, e);
        } catch (IOException e) {
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, filePath, "unable to resolve " + filePath, e);
        }

        if (Files.isSymbolicLink(path) && !whitelist.isAllowed(real)) {
            throw new FileIndexException(Reason.SYMLINK_ESCAPES_WHITELIST, filePath,
                    "symlink " + filePath + " points outside the whitelist: " + real);
        }
        if (!whitelist.isAllowed(real)) {
            throw new FileIndexException(Reason.SYMLINK_ESCAPES_WHITELIST, filePath,
                    "resolved path " + real + " is outside the whitelist");
        }
        if (!Files.isRegularFile(real)) {
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, filePath, "not a regular file: " + filePath);
        }
        if (!Files.isReadable(real)) {
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, filePath, "file is not readable: " + filePath);
        }

        long size;
        try {
            size = Files.size(real);
        } catch (IOException e) {
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, filePath, "unable to stat " + filePath, e);
        }
        if (size > maxFileSize) {
            throw new FileIndexException(Reason.FILE_TOO_LARGE, filePath,
                    String.format("file %s is %d bytes, limit is %d", filePath, size, maxFileSize));
        }
        return real;
    }

    /**
     * Opens the file positioned at {@code startPosition}. Gzip files are decompressed
     * and may only be read from the beginning.
     */
    public LogLineReader open(String filePath, long startPosition) throws FileIndexException {
        Path real = validate(filePath);
        boolean gzip = LogFileGroups.isGzip(filePath);
        if (gzip && startPosition > 0) {
            throw new FileIndexException(Reason.INCREMENTAL_ON_COMPRESSED, filePath,
                    "incremental indexing is not supported for compressed file " + filePath + ", a full rebuild is required");
        }

        FileChannel channel = null;
        try {
            channel = FileChannel.open(real, StandardOpenOption.READ);
            long size = channel.size();
            long position = Math.max(0, Math.min(startPosition, size));
            boolean midLine = false;
            if (position > 0) {
                ByteBuffer previous = ByteBuffer.allocate(1);
                channel.read(previous, position - 1);
                midLine = previous.get(0) != '\n';
                channel.position(position);
            }

            InputStream in = new BufferedInputStream(Channels.newInputStream(channel), 64 * 1024);
            if (gzip) {
                in = new GZIPInputStream(in, 64 * 1024);
            }
            logger.debug("Opened {} at {} (size {}, gzip {})", filePath, position, size, gzip);
            return new LogLineReader(in, maxLineLength, filePath, size, LogFileGroups.isCompressed(filePath), midLine);
        } catch (IOException e) {
            closeQuietly(channel, filePath);
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, filePath, "unable to open " + filePath + ": " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(FileChannel channel, String filePath) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Failed to close {}: {}", filePath, e.getMessage());
        }
    }
}
