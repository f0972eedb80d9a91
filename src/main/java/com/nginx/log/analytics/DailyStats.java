package com.nginx.log.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DailyStats {

    /** yyyy-MM-dd */
    @JsonProperty("date")
    private final String date;

    @JsonProperty("uv")
    private final long uv;

    @JsonProperty("pv")
    private final long pv;

    @JsonProperty("timestamp")
    private final long timestamp;

    public DailyStats(String date, long uv, long pv, long timestamp) {
        this.date = date;
        this.uv = uv;
        this.pv = pv;
        this.timestamp = timestamp;
    }

    public String getDate() {
        return date;
    }

    public long getUv() {
        return uv;
    }

    public long getPv() {
        return pv;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "DailyStats [date=" + date + ", uv=" + uv + ", pv=" + pv + "]";
    }
}
