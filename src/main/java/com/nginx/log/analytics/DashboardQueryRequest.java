package com.nginx.log.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nginx.log.search.QueryRequest;

/**
 * Dashboard scope. Times are epoch seconds, 0 when unset; an empty log path covers
 * every group.
 */
public class DashboardQueryRequest {

    @JsonProperty("start_time")
    private long startTime;

    @JsonProperty("end_time")
    private long endTime;

    @JsonProperty("log_path")
    private String logPath;

    public DashboardQueryRequest() {
    }

    public DashboardQueryRequest(long startTime, long endTime, String logPath) {
        this.startTime = startTime;
        this.endTime = endTime;
        this.logPath = logPath;
    }

    public QueryRequest toQueryRequest() {
        return new QueryRequest()
                .setStartTime(startTime)
                .setEndTime(endTime)
                .setLogPath(logPath)
                .setSortBy("timestamp")
                .setSortOrder("asc");
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public String getLogPath() {
        return logPath;
    }

    public void setLogPath(String logPath) {
        this.logPath = logPath;
    }

    @Override
    public String toString() {
        return "DashboardQueryRequest [startTime=" + startTime + ", endTime=" + endTime + ", logPath=" + logPath + "]";
    }
}
