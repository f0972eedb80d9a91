package com.nginx.log.cursor;

import com.fasterxml.jackson.annotation.JsonProperty;

public class CursorStats {

    @JsonProperty("total_files")
    private final long totalFiles;

    @JsonProperty("enabled_files")
    private final long enabledFiles;

    @JsonProperty("total_documents")
    private final long totalDocuments;

    public CursorStats(long totalFiles, long enabledFiles, long totalDocuments) {
        this.totalFiles = totalFiles;
        this.enabledFiles = enabledFiles;
        this.totalDocuments = totalDocuments;
    }

    public long getTotalFiles() {
        return totalFiles;
    }

    public long getEnabledFiles() {
        return enabledFiles;
    }

    public long getTotalDocuments() {
        return totalDocuments;
    }
}
