package com.nginx.log.search;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Totals over every record matching a query, not just the returned page.
 */
public class SummaryStats {

    @JsonProperty("uv")
    private final long uv;

    @JsonProperty("pv")
    private final long pv;

    @JsonProperty("total_traffic")
    private final long totalTraffic;

    @JsonProperty("unique_pages")
    private final long uniquePages;

    @JsonProperty("avg_traffic_per_pv")
    private final double avgTrafficPerPv;

    public SummaryStats() {
        this(0, 0, 0, 0);
    }

    public SummaryStats(long uv, long pv, long totalTraffic, long uniquePages) {
        this.uv = uv;
        this.pv = pv;
        this.totalTraffic = totalTraffic;
        this.uniquePages = uniquePages;
        this.avgTrafficPerPv = pv > 0 ? (double) totalTraffic / pv : 0;
    }

    public long getUv() {
        return uv;
    }

    public long getPv() {
        return pv;
    }

    public long getTotalTraffic() {
        return totalTraffic;
    }

    public long getUniquePages() {
        return uniquePages;
    }

    public double getAvgTrafficPerPv() {
        return avgTrafficPerPv;
    }

    @Override
    public String toString() {
        return "SummaryStats [uv=" + uv + ", pv=" + pv + ", totalTraffic=" + totalTraffic + ", uniquePages="
                + uniquePages + "]";
    }
}
