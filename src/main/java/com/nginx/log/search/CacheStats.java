package com.nginx.log.search;

import com.fasterxml.jackson.annotation.JsonProperty;

public class CacheStats {

    @JsonProperty("entries")
    private final long entries;

    @JsonProperty("weighted_size")
    private final long weightedSize;

    public CacheStats(long entries, long weightedSize) {
        this.entries = entries;
        this.weightedSize = weightedSize;
    }

    public long getEntries() {
        return entries;
    }

    public long getWeightedSize() {
        return weightedSize;
    }

    @Override
    public String toString() {
        return "CacheStats [entries=" + entries + ", weightedSize=" + weightedSize + "]";
    }
}
