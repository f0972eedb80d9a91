package com.nginx.log.indexer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inclusive range of record timestamps, epoch seconds.
 */
public class TimeRange {

    @JsonProperty("start")
    private final long start;

    @JsonProperty("end")
    private final long end;

    public TimeRange(long start, long end) {
        this.start = start;
        this.end = end;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "TimeRange [" + start + ", " + end + "]";
    }
}
