package com.nginx.log.analytics.geo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class GeoStats {

    @JsonProperty("region_code")
    private final String regionCode;

    @JsonProperty("province")
    private final String province;

    @JsonProperty("city")
    private final String city;

    @JsonProperty("count")
    private final long count;

    @JsonProperty("percent")
    private final double percent;

    public GeoStats(String regionCode, String province, String city, long count, double percent) {
        this.regionCode = regionCode;
        this.province = province;
        this.city = city;
        this.count = count;
        this.percent = percent;
    }

    public String getRegionCode() {
        return regionCode;
    }

    public String getProvince() {
        return province;
    }

    public String getCity() {
        return city;
    }

    public long getCount() {
        return count;
    }

    public double getPercent() {
        return percent;
    }

    @Override
    public String toString() {
        return "GeoStats [regionCode=" + regionCode + ", province=" + province + ", count=" + count + "]";
    }
}
