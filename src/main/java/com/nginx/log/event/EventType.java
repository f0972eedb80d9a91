package com.nginx.log.event;

public enum EventType {

    INDEX_PROGRESS("nginx_log.index.progress"),
    INDEX_COMPLETE("nginx_log.index.complete"),
    INDEX_READY("nginx_log.index.ready"),
    PROCESSING_STATUS("processing_status");

    private final String topic;

    EventType(String topic) {
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }

    @Override
    public String toString() {
        return topic;
    }
}
