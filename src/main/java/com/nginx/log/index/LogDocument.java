package com.nginx.log.index;

import com.nginx.log.parser.model.AccessLogEntry;

/**
 * A parsed record as stored in the index. {@code file_path} holds the main log path of
 * the group so that all siblings share one exact value; the file the line was read
 * from is kept separately as {@code source_file}.
 */
public class LogDocument {

    private final String id;
    private final String sourceFile;
    private final String mainLogPath;
    private final AccessLogEntry entry;

    public LogDocument(String id, String mainLogPath, AccessLogEntry entry) {
        this(id, mainLogPath, mainLogPath, entry);
    }

    public LogDocument(String id, String sourceFile, String mainLogPath, AccessLogEntry entry) {
        this.id = id;
        this.sourceFile = sourceFile;
        this.mainLogPath = mainLogPath;
        this.entry = entry;
    }

    /**
     * {@code <path>_<startPosition>_<n>}; re-reading the same byte range yields the same ids.
     */
    public static String documentId(String path, long startPosition, long sequence) {
        return path + "_" + startPosition + "_" + sequence;
    }

    public String getId() {
        return id;
    }

    /**
     * Value of the {@code file_path} field, the group's main log path.
     */
    public String getFilePath() {
        return mainLogPath;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public String getMainLogPath() {
        return mainLogPath;
    }

    public AccessLogEntry getEntry() {
        return entry;
    }
}
