package com.nginx.log.analytics.geo;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public class ChinaMapData {

    /** Short province name, as the map names its areas. */
    @JsonProperty("name")
    private final String name;

    @JsonProperty("value")
    private final long value;

    @JsonProperty("percent")
    private final double percent;

    @JsonProperty("cities")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<CityData> cities;

    public ChinaMapData(String name, long value, double percent, List<CityData> cities) {
        this.name = name;
        this.value = value;
        this.percent = percent;
        this.cities = cities;
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

    public List<CityData> getCities() {
        return cities;
    }

    @Override
    public String toString() {
        return name + "=" + value + " " + cities;
    }
}
