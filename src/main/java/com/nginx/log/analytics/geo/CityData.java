package com.nginx.log.analytics.geo;

import com.fasterxml.jackson.annotation.JsonProperty;

public class CityData {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("value")
    private final long value;

    /** Share of the province's requests. */
    @JsonProperty("percent")
    private final double percent;

    public CityData(String name, long value, double percent) {
        this.name = name;
        this.value = value;
        this.percent = percent;
    }

    public String getName() {
        return name;
    }

    public long getValue() {
        return value;
    }

    public double getPercent() {
        return percent;
    }
}
