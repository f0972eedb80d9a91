package com.nginx.log.analytics;

import java.util.List;

final class DashboardBuilder {

    static final int TOP_URLS = 10;

    private DashboardBuilder() {
    }

    static DashboardAnalytics build(TimeSeriesAccumulator timeSeries, FieldCountAccumulator paths,
            FieldCountAccumulator browsers, FieldCountAccumulator operatingSystems, FieldCountAccumulator devices,
            long totalUv, long totalPv) {
        List<HourlyStats> hourly = timeSeries.getHourlyStats();
        List<DailyStats> daily = timeSeries.getDailyStats();
        return new DashboardAnalytics(hourly, daily, paths.getTopUrls(TOP_URLS), browsers.getDistribution(),
                operatingSystems.getDistribution(), devices.getDistribution(),
                DashboardSummary.of(totalUv, totalPv, hourly, daily));
    }
}
