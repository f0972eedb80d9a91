package com.nginx.log.analytics;

import java.io.IOException;

import com.nginx.log.error.QueryException;

public interface DashboardAnalyticsProvider {

    /**
     * Hourly series for the day containing the end time (today when unset), daily series
     * over the requested range (the trailing 30 days when unset), top URLs, client
     * distributions and their summary.
     */
    DashboardAnalytics getDashboardAnalytics(DashboardQueryRequest request) throws IOException, QueryException;
}
