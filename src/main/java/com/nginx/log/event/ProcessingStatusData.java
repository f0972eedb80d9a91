package com.nginx.log.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ProcessingStatusData {

    @JsonProperty("nginx_log_indexing")
    private final boolean nginxLogIndexing;

    public ProcessingStatusData(boolean nginxLogIndexing) {
        this.nginxLogIndexing = nginxLogIndexing;
    }

    public boolean isNginxLogIndexing() {
        return nginxLogIndexing;
    }
}
