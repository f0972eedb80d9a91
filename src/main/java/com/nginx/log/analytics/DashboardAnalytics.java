package com.nginx.log.analytics;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DashboardAnalytics {

    @JsonProperty("hourly_stats")
    private final List<HourlyStats> hourlyStats;

    @JsonProperty("daily_stats")
    private final List<DailyStats> dailyStats;

    @JsonProperty("top_urls")
    private final List<UrlStats> topUrls;

    @JsonProperty("browsers")
    private final List<DistributionStats> browsers;

    @JsonProperty("operating_systems")
    private final List<DistributionStats> operatingSystems;

    @JsonProperty("devices")
    private final List<DistributionStats> devices;

    @JsonProperty("summary")
    private final DashboardSummary summary;

    public DashboardAnalytics(List<HourlyStats> hourlyStats, List<DailyStats> dailyStats, List<UrlStats> topUrls,
            List<DistributionStats> browsers, List<DistributionStats> operatingSystems,
            List<DistributionStats> devices, DashboardSummary summary) {
        this.hourlyStats = hourlyStats;
        this.dailyStats = dailyStats;
        this.topUrls = topUrls;
        this.browsers = browsers;
        this.operatingSystems = operatingSystems;
        this.devices = devices;
        this.summary = summary;
    }

    public List<HourlyStats> getHourlyStats() {
        return hourlyStats;
    }

    public List<DailyStats> getDailyStats() {
        return dailyStats;
    }

    public List<UrlStats> getTopUrls() {
        return topUrls;
    }

    public List<DistributionStats> getBrowsers() {
        return browsers;
    }

    public List<DistributionStats> getOperatingSystems() {
        return operatingSystems;
    }

    public List<DistributionStats> getDevices() {
        return devices;
    }

    public DashboardSummary getSummary() {
        return summary;
    }
}
