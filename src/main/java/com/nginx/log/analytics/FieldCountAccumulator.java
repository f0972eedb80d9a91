package com.nginx.log.analytics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Strings;

/**
 * Accumulator for request counts per value of one field. Missing values are counted
 * as {@value #UNKNOWN} in distributions and left out of the top URL list.
 */
public class FieldCountAccumulator {

    public static final String UNKNOWN = "Unknown";

    private final Map<String, Long> counts = new HashMap<>();
    private long missing;
    private long total;

    public void accumulate(String value) {
        if (Strings.isNullOrEmpty(value)) {
            missing++;
        } else {
            counts.merge(value, 1L, Long::sum);
        }
        total++;
    }

    public long getTotal() {
        return total;
    }

    /**
     * Values by count descending, ties by name; {@code limit <= 0} returns all of them.
     */
    public List<Map.Entry<String, Long>> top(int limit) {
        return top(limit, true);
    }

    private List<Map.Entry<String, Long>> top(int limit, boolean includeMissing) {
        Map<String, Long> values = counts;
        if (includeMissing && missing > 0) {
            values = new HashMap<>(counts);
            values.merge(UNKNOWN, missing, Long::sum);
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(values.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        if (limit > 0 && entries.size() > limit) {
            return new ArrayList<>(entries.subList(0, limit));
        }
        return entries;
    }

    public double percent(long count) {
        return total == 0 ? 0.0 : count * 100.0 / total;
    }

    public List<DistributionStats> getDistribution() {
        List<DistributionStats> result = new ArrayList<>(counts.size() + 1);
        for (Map.Entry<String, Long> entry : top(0, true)) {
            result.add(new DistributionStats(entry.getKey(), entry.getValue(), percent(entry.getValue())));
        }
        return result;
    }

    public List<UrlStats> getTopUrls(int limit) {
        List<UrlStats> result = new ArrayList<>();
        for (Map.Entry<String, Long> entry : top(limit, false)) {
            result.add(new UrlStats(entry.getKey(), entry.getValue(), percent(entry.getValue())));
        }
        return result;
    }
}
