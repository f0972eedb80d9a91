package com.nginx.log.progress;

public enum FileState {

    PENDING, PROCESSING, COMPLETED;

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
