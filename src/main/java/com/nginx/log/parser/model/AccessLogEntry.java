package com.nginx.log.parser.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One parsed access log record. Serialized with the snake_case wire names used by
 * search responses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccessLogEntry {

    /** Unix seconds, UTC */
    @JsonProperty("timestamp")
    private long timestamp;

    @JsonProperty("ip")
    private String ip = "";

    @JsonProperty("region_code")
    private String regionCode = "";

    @JsonProperty("province")
    private String province = "";

    @JsonProperty("city")
    private String city = "";

    @JsonProperty("method")
    private String method = "";

    @JsonProperty("path")
    private String path = "";

    @JsonProperty("protocol")
    private String protocol = "";

    @JsonProperty("status")
    private int status;

    @JsonProperty("bytes_sent")
    private long bytesSent;

    @JsonProperty("referer")
    private String referer = "";

    @JsonProperty("user_agent")
    private String userAgent = "";

    @JsonProperty("browser")
    private String browser = "";

    @JsonProperty("browser_version")
    private String browserVersion = "";

    @JsonProperty("os")
    private String os = "";

    @JsonProperty("os_version")
    private String osVersion = "";

    @JsonProperty("device_type")
    private String deviceType = "";

    @JsonProperty("request_time")
    private double requestTime;

    @JsonProperty("upstream_time")
    private Double upstreamTime;

    @JsonProperty("raw")
    private String raw = "";

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = ip;
    }

    public String getRegionCode() {
        return regionCode;
    }

    public void setRegionCode(String regionCode) {
        this.regionCode = regionCode;
    }

    public String getProvince() {
        return province;
    }

    public void setProvince(String province) {
        this.province = province;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getProtocol() {
        return protocol;
    }

    public void setProtocol(String protocol) {
        this.protocol = protocol;
    }

    public int getStatus() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    public long getBytesSent() {
        return bytesSent;
    }

    public void setBytesSent(long bytesSent) {
        this.bytesSent = bytesSent;
    }

    public String getReferer() {
        return referer;
    }

    public void setReferer(String referer) {
        this.referer = referer;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getBrowser() {
        return browser;
    }

    public void setBrowser(String browser) {
        this.browser = browser;
    }

    public String getBrowserVersion() {
        return browserVersion;
    }

    public void setBrowserVersion(String browserVersion) {
        this.browserVersion = browserVersion;
    }

    public String getOs() {
        return os;
    }

    public void setOs(String os) {
        this.os = os;
    }

    public String getOsVersion() {
        return osVersion;
    }

    public void setOsVersion(String osVersion) {
        this.osVersion = osVersion;
    }

    public String getDeviceType() {
        return deviceType;
    }

    public void setDeviceType(String deviceType) {
        this.deviceType = deviceType;
    }

    public double getRequestTime() {
        return requestTime;
    }

    public void setRequestTime(double requestTime) {
        this.requestTime = requestTime;
    }

    public Double getUpstreamTime() {
        return upstreamTime;
    }

    public void setUpstreamTime(Double upstreamTime) {
        this.upstreamTime = upstreamTime;
    }

    public String getRaw() {
        return raw;
    }

    public void setRaw(String raw) {
        this.raw = raw;
    }

    /** Field-by-field copy. */
    public AccessLogEntry copy() {
        AccessLogEntry copy = new AccessLogEntry();
        copy.timestamp = timestamp;
        copy.ip = ip;
        copy.regionCode = regionCode;
        copy.province = province;
        copy.city = city;
        copy.method = method;
        copy.path = path;
        copy.protocol = protocol;
        copy.status = status;
        copy.bytesSent = bytesSent;
        copy.referer = referer;
        copy.userAgent = userAgent;
        copy.browser = browser;
        copy.browserVersion = browserVersion;
        copy.os = os;
        copy.osVersion = osVersion;
        copy.deviceType = deviceType;
        copy.requestTime = requestTime;
        copy.upstreamTime = upstreamTime;
        copy.raw = raw;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AccessLogEntry that = (AccessLogEntry) o;
        return timestamp == that.timestamp && status == that.status && bytesSent == that.bytesSent
                && Objects.equals(ip, that.ip) && Objects.equals(method, that.method)
                && Objects.equals(path, that.path) && Objects.equals(raw, that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, ip, method, path, status, bytesSent, raw);
    }

    @Override
    public String toString() {
        return "AccessLogEntry{" + timestamp + " " + ip + " " + method + " " + path + " " + status + "}";
    }
}
