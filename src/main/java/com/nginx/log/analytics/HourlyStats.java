package com.nginx.log.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public class HourlyStats {

    @JsonProperty("hour")
    private final int hour;

    @JsonProperty("uv")
    private final long uv;

    @JsonProperty("pv")
    private final long pv;

    /** Start of the hour, epoch seconds. */
    @JsonProperty("timestamp")
    private final long timestamp;

    public HourlyStats(int hour, long uv, long pv, long timestamp) {
        this.hour = hour;
        this.uv = uv;
        this.pv = pv;
        this.timestamp = timestamp;
    }

    public int getHour() {
        return hour;
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
        return "HourlyStats [hour=" + hour + ", uv=" + uv + ", pv=" + pv + "]";
    }
}
