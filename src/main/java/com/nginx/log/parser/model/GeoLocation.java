package com.nginx.log.parser.model;

import java.util.Objects;

public class GeoLocation {

    public static final GeoLocation UNKNOWN = new GeoLocation("", "", "");

    private final String regionCode;
    private final String province;
    private final String city;

    public GeoLocation(String regionCode, String province, String city) {
        this.regionCode = regionCode == null ? "" : regionCode;
        this.province = province == null ? "" : province;
        this.city = city == null ? "" : city;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GeoLocation that = (GeoLocation) o;
        return regionCode.equals(that.regionCode) && province.equals(that.province) && city.equals(that.city);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regionCode, province, city);
    }

    @Override
    public String toString() {
        return regionCode + "/" + province + "/" + city;
    }
}
