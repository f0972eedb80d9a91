package com.nginx.log.search;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Search filters. Times are epoch seconds, 0 when unset. {@code browser}, {@code os}
 * and {@code device} take comma-separated alternatives; {@code path} may end with
 * {@code *} for a prefix match or contain {@code *} / {@code ?} wildcards.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class QueryRequest {

    @JsonProperty("start_time")
    private long startTime;

    @JsonProperty("end_time")
    private long endTime;

    @JsonProperty("query")
    private String query;

    @JsonProperty("ip")
    private String ip;

    @JsonProperty("method")
    private String method;

    @JsonProperty("status")
    private List<Integer> status = new ArrayList<>();

    @JsonProperty("path")
    private String path;

    @JsonProperty("user_agent")
    private String userAgent;

    @JsonProperty("referer")
    private String referer;

    @JsonProperty("browser")
    private String browser;

    @JsonProperty("os")
    private String os;

    @JsonProperty("device")
    private String device;

    @JsonProperty("log_path")
    private String logPath;

    /** 0 means unlimited, clamped to the configured maximum. */
    @JsonProperty("limit")
    private int limit;

    @JsonProperty("offset")
    private int offset;

    @JsonProperty("sort_by")
    private String sortBy;

    @JsonProperty("sort_order")
    private String sortOrder;

    @JsonProperty("include_summary")
    private boolean includeSummary = true;

    public long getStartTime() {
        return startTime;
    }

    public QueryRequest setStartTime(long startTime) {
        this.startTime = startTime;
        return this;
    }

    public long getEndTime() {
        return endTime;
    }

    public QueryRequest setEndTime(long endTime) {
        this.endTime = endTime;
        return this;
    }

    public String getQuery() {
        return query;
    }

    public QueryRequest setQuery(String query) {
        this.query = query;
        return this;
    }

    public String getIp() {
        return ip;
    }

    public QueryRequest setIp(String ip) {
        this.ip = ip;
        return this;
    }

    public String getMethod() {
        return method;
    }

    public QueryRequest setMethod(String method) {
        this.method = method;
        return this;
    }

    public List<Integer> getStatus() {
        return status;
    }

    public QueryRequest setStatus(List<Integer> status) {
        this.status = status == null ? new ArrayList<>() : new ArrayList<>(status);
        return this;
    }

    public String getPath() {
        return path;
    }

    public QueryRequest setPath(String path) {
        this.path = path;
        return this;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public QueryRequest setUserAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }

    public String getReferer() {
        return referer;
    }

    public QueryRequest setReferer(String referer) {
        this.referer = referer;
        return this;
    }

    public String getBrowser() {
        return browser;
    }

    public QueryRequest setBrowser(String browser) {
        this.browser = browser;
        return this;
    }

    public String getOs() {
        return os;
    }

    public QueryRequest setOs(String os) {
        this.os = os;
        return this;
    }

    public String getDevice() {
        return device;
    }

    public QueryRequest setDevice(String device) {
        this.device = device;
        return this;
    }

    public String getLogPath() {
        return logPath;
    }

    public QueryRequest setLogPath(String logPath) {
        this.logPath = logPath;
        return this;
    }

    public int getLimit() {
        return limit;
    }

    public QueryRequest setLimit(int limit) {
        this.limit = limit;
        return this;
    }

    public int getOffset() {
        return offset;
    }

    public QueryRequest setOffset(int offset) {
        this.offset = offset;
        return this;
    }

    public String getSortBy() {
        return sortBy;
    }

    public QueryRequest setSortBy(String sortBy) {
        this.sortBy = sortBy;
        return this;
    }

    public String getSortOrder() {
        return sortOrder;
    }

    public QueryRequest setSortOrder(String sortOrder) {
        this.sortOrder = sortOrder;
        return this;
    }

    public boolean isIncludeSummary() {
        return includeSummary;
    }

    public QueryRequest setIncludeSummary(boolean includeSummary) {
        this.includeSummary = includeSummary;
        return this;
    }
}
