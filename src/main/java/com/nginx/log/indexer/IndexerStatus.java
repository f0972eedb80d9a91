package com.nginx.log.indexer;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nginx.log.cursor.LogIndexCursor;

public class IndexerStatus {

    @JsonProperty("document_count")
    private final long documentCount;

    @JsonProperty("log_paths")
    private final List<String> logPaths;

    @JsonProperty("log_paths_count")
    private final int logPathsCount;

    @JsonProperty("files")
    private final List<LogIndexCursor> files;

    @JsonProperty("indexing")
    private final boolean indexing;

    public IndexerStatus(long documentCount, List<String> logPaths, List<LogIndexCursor> files, boolean indexing) {
        this.documentCount = documentCount;
        this.logPaths = logPaths;
        this.logPathsCount = logPaths.size();
        this.files = files;
        this.indexing = indexing;
    }

    public long getDocumentCount() {
        return documentCount;
    }

    public List<String> getLogPaths() {
        return logPaths;
    }

    public int getLogPathsCount() {
        return logPathsCount;
    }

    public List<LogIndexCursor> getFiles() {
        return files;
    }

    public boolean isIndexing() {
        return indexing;
    }
}
