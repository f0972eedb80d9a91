package com.nginx.log.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Share of requests for one browser, operating system or device type.
 */
public class DistributionStats {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("count")
    private final long count;

    @JsonProperty("percent")
    private final double percent;

    public DistributionStats(String name, long count, double percent) {
        this.name = name;
        this.count = count;
        this.percent = percent;
    }

    public String getName() {
        return name;
    }

    public long getCount() {
        return count;
    }

    public double getPercent() {
        return percent;
    }

    @Override
    public String toString() {
        return name + "=" + count;
    }
}
