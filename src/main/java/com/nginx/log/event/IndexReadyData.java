package com.nginx.log.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public class IndexReadyData {

    @JsonProperty("log_path")
    private final String logPath;

    @JsonProperty("success")
    private final boolean success;

    public IndexReadyData(String logPath, boolean success) {
        this.logPath = logPath;
        this.success = success;
    }

    public String getLogPath() {
        return logPath;
    }

    public boolean isSuccess() {
        return success;
    }
}
