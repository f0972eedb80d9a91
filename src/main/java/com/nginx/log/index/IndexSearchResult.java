package com.nginx.log.index;

import java.util.List;

public class IndexSearchResult {

    private final long total;
    private final List<IndexHit> hits;
    private final long tookMs;

    public IndexSearchResult(long total, List<IndexHit> hits, long tookMs) {
        this.total = total;
        this.hits = hits;
        this.tookMs = tookMs;
    }

    public long getTotal() {
        return total;
    }

    public List<IndexHit> getHits() {
        return hits;
    }

    public long getTookMs() {
        return tookMs;
    }
}
