package com.nginx.log.files;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Byte-counting line reader. Lines longer than the limit are skipped whole.
 * {@link #getBytesConsumed()} counts bytes of the underlying (decompressed) stream,
 * line terminators included.
 */
public class LogLineReader implements Closeable {

    static final Logger logger = LoggerFactory.getLogger(LogLineReader.class);

    public static final int DEFAULT_MAX_LINE_LENGTH = 1024 * 1024;

    private final InputStream in;
    private final int maxLineLength;
    private final String path;
    private final long fileSize;
    private final boolean compressed;
    private final boolean startsMidLine;

    private final byte[] buffer = new byte[64 * 1024];
    private int bufferPos;
    private int bufferLimit;
    private long bytesConsumed;
    private long skippedLines;

    LogLineReader(InputStream in, int maxLineLength, String path, long fileSize, boolean compressed, boolean startsMidLine) {
        this.in = in;
        this.maxLineLength = maxLineLength;
        this.path = path;
        this.fileSize = fileSize;
        this.compressed = compressed;
        this.startsMidLine = startsMidLine;
    }

    public LogLineReader(InputStream in) {
        this(in, DEFAULT_MAX_LINE_LENGTH, "", -1, false, false);
    }

    /**
     * Next line without its terminator, or null at end of stream.
     */
    public String readLine() throws IOException {
        while (true) {
            ByteArrayOutputStream line = new ByteArrayOutputStream(256);
            boolean tooLong = false;
            boolean sawAny = false;

            while (true) {
                if (bufferPos >= bufferLimit && !fill()) {
                    if (!sawAny) {
                        return null;
                    }
                    break;
                }
                sawAny = true;
                int start = bufferPos;
                int newline = -1;
                for (int i = bufferPos; i < bufferLimit; i++) {
                    if (buffer[i] == '\n') {
                        newline = i;
                        break;
                    }
                }
                int end = newline >= 0 ? newline : bufferLimit;
                if (!tooLong) {
                    int room = maxLineLength - line.size();
                    if (end - start > room) {
                        tooLong = true;
                    } else {
                        line.write(buffer, start, end - start);
                    }
                }
                bytesConsumed += (end - start) + (newline >= 0 ? 1 : 0);
                bufferPos = newline >= 0 ? newline + 1 : bufferLimit;
                if (newline >= 0) {
                    break;
                }
            }

            if (tooLong) {
                skippedLines++;
                logger.warn("Line exceeds {} bytes in {}, skipping", maxLineLength, path);
                continue;
            }

            byte[] bytes = line.toByteArray();
            int length = bytes.length;
            if (length > 0 && bytes[length - 1] == '\r') {
                length--;
            }
            return new String(bytes, 0, length, StandardCharsets.UTF_8);
        }
    }

    private boolean fill() throws IOException {
        int n = in.read(buffer, 0, buffer.length);
        if (n <= 0) {
            return false;
        }
        bufferPos = 0;
        bufferLimit = n;
        return true;
    }

    public long getBytesConsumed() {
        return bytesConsumed;
    }

    public long getSkippedLines() {
        return skippedLines;
    }

    public String getPath() {
        return path;
    }

    public long getFileSize() {
        return fileSize;
    }

    public boolean isCompressed() {
        return compressed;
    }

    /**
     * True when the reader was positioned inside a line, so the first line read is a
     * fragment.
     */
    public boolean startsMidLine() {
        return startsMidLine;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
