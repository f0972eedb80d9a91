package com.nginx.log.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public class UrlStats {

    @JsonProperty("url")
    private final String url;

    @JsonProperty("visits")
    private final long visits;

    @JsonProperty("percent")
    private final double percent;

    public UrlStats(String url, long visits, double percent) {
        this.url = url;
        this.visits = visits;
        this.percent = percent;
    }

    public String getUrl() {
        return url;
    }

    public long getVisits() {
        return visits;
    }

    public double getPercent() {
        return percent;
    }
}
