package com.nginx.log.analytics.geo;

import com.fasterxml.jackson.annotation.JsonProperty;

public class WorldMapData {

    @JsonProperty("code")
    private final String regionCode;

    @JsonProperty("value")
    private final long value;

    @JsonProperty("percent")
    private final double percent;

    public WorldMapData(String regionCode, long value, double percent) {
        this.regionCode = regionCode;
        this.value = value;
        this.percent = percent;
    }

    public String getRegionCode() {
        return regionCode;
    }

    public long getValue() {
        return value;
    }

    public double getPercent() {
        return percent;
    }

    @Override
    public String toString() {
        return regionCode + "=" + value;
    }
}
