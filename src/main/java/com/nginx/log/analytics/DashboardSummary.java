package com.nginx.log.analytics;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DashboardSummary {

    @JsonProperty("total_uv")
    private final long totalUv;

    @JsonProperty("total_pv")
    private final long totalPv;

    @JsonProperty("avg_daily_uv")
    private final double avgDailyUv;

    @JsonProperty("avg_daily_pv")
    private final double avgDailyPv;

    @JsonProperty("peak_hour")
    private final int peakHour;

    @JsonProperty("peak_hour_traffic")
    private final long peakHourTraffic;

    public DashboardSummary(long totalUv, long totalPv, double avgDailyUv, double avgDailyPv, int peakHour,
            long peakHourTraffic) {
        this.totalUv = totalUv;
        this.totalPv = totalPv;
        this.avgDailyUv = avgDailyUv;
        this.avgDailyPv = avgDailyPv;
        this.peakHour = peakHour;
        this.peakHourTraffic = peakHourTraffic;
    }

    /**
     * Averages run over the days listed in {@code daily}; the peak hour is the first hour
     * with the most page views.
     */
    public static DashboardSummary of(long totalUv, long totalPv, List<HourlyStats> hourly, List<DailyStats> daily) {
        double avgUv = 0;
        double avgPv = 0;
        if (!daily.isEmpty()) {
            long sumUv = 0;
            long sumPv = 0;
            for (DailyStats day : daily) {
                sumUv += day.getUv();
                sumPv += day.getPv();
            }
            avgUv = (double) sumUv / daily.size();
            avgPv = (double) sumPv / daily.size();
        }
        int peakHour = 0;
        long peakTraffic = 0;
        for (HourlyStats hour : hourly) {
            if (hour.getPv() > peakTraffic) {
                peakHour = hour.getHour();
                peakTraffic = hour.getPv();
            }
        }
        return new DashboardSummary(totalUv, totalPv, avgUv, avgPv, peakHour, peakTraffic);
    }

    public long getTotalUv() {
        return totalUv;
    }

    public long getTotalPv() {
        return totalPv;
    }

    public double getAvgDailyUv() {
        return avgDailyUv;
    }

    public double getAvgDailyPv() {
        return avgDailyPv;
    }

    public int getPeakHour() {
        return peakHour;
    }

    public long getPeakHourTraffic() {
        return peakHourTraffic;
    }

    @Override
    public String toString() {
        return "DashboardSummary [totalUv=" + totalUv + ", totalPv=" + totalPv + ", peakHour=" + peakHour
                + ", peakHourTraffic=" + peakHourTraffic + "]";
    }
}
