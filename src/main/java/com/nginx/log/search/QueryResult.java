package com.nginx.log.search;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nginx.log.parser.model.AccessLogEntry;

public class QueryResult {

    @JsonProperty("entries")
    private final List<AccessLogEntry> entries;

    @JsonProperty("total")
    private final long total;

    @JsonProperty("took_ms")
    private final long tookMs;

    @JsonProperty("summary")
    private final SummaryStats summary;

    @JsonProperty("from_cache")
    private final boolean fromCache;

    public QueryResult(List<AccessLogEntry> entries, long total, long tookMs, SummaryStats summary, boolean fromCache) {
        this.entries = entries;
        this.total = total;
        this.tookMs = tookMs;
        this.summary = summary;
        this.fromCache = fromCache;
    }

    public List<AccessLogEntry> getEntries() {
        return entries;
    }

    public long getTotal() {
        return total;
    }

    public long getTookMs() {
        return tookMs;
    }

    public SummaryStats getSummary() {
        return summary;
    }

    public boolean isFromCache() {
        return fromCache;
    }
}
