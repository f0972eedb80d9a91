package com.nginx.log.analytics;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import org.apache.lucene.search.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nginx.log.config.IndexerConfig;
import com.nginx.log.index.IndexFields;
import com.nginx.log.index.IndexHit;
import com.nginx.log.index.IndexSearchRequest;
import com.nginx.log.index.IndexSearchResult;
import com.nginx.log.index.LogIndex;
import com.nginx.log.search.LogQueryBuilder;

/**
 * Fetches every matching record in one search, up to the configured maximum, and
 * aggregates in memory. Suited to small indexes.
 */
public class NaiveDashboardAnalytics implements DashboardAnalyticsProvider {

    static final Logger logger = LoggerFactory.getLogger(NaiveDashboardAnalytics.class);

    static final Set<String> FIELDS = Set.of(IndexFields.TIMESTAMP, IndexFields.IP, IndexFields.PATH,
            IndexFields.BROWSER, IndexFields.OS, IndexFields.DEVICE_TYPE);

    private final LogIndex index;
    private final LogQueryBuilder queryBuilder = new LogQueryBuilder();
    private final int maxSize;
    private final ZoneId zone;
    private final Clock clock;

    public NaiveDashboardAnalytics(LogIndex index, IndexerConfig config) {
        this(index, config, ZoneOffset.UTC, Clock.systemUTC());
    }

    public NaiveDashboardAnalytics(LogIndex index, IndexerConfig config, ZoneId zone, Clock clock) {
        this.index = index;
        this.maxSize = config.getSearchMaxSize();
        this.zone = zone;
        this.clock = clock;
    }

    @Override
    public DashboardAnalytics getDashboardAnalytics(DashboardQueryRequest request) throws IOException {
        Query query = queryBuilder.build(request.toQueryRequest());
        IndexSearchResult result = index.search(new IndexSearchRequest(query, maxSize, 0)
                .setSort(IndexFields.TIMESTAMP, false)
                .setFields(FIELDS));
        if (result.getTotal() > result.getHits().size()) {
            logger.warn("Dashboard for {} covers only {} of {} matching records", request, result.getHits().size(),
                    result.getTotal());
        }

        TimeSeriesAccumulator timeSeries = new TimeSeriesAccumulator(request.getStartTime(), request.getEndTime(),
                zone, clock);
        FieldCountAccumulator paths = new FieldCountAccumulator();
        FieldCountAccumulator browsers = new FieldCountAccumulator();
        FieldCountAccumulator operatingSystems = new FieldCountAccumulator();
        FieldCountAccumulator devices = new FieldCountAccumulator();
        Set<String> ips = new HashSet<>();

        for (IndexHit hit : result.getHits()) {
            String ip = hit.getString(IndexFields.IP);
            timeSeries.accumulate(hit.getLong(IndexFields.TIMESTAMP), ip);
            if (!ip.isEmpty()) {
                ips.add(ip);
            }
            paths.accumulate(hit.getString(IndexFields.PATH));
            browsers.accumulate(hit.getString(IndexFields.BROWSER));
            operatingSystems.accumulate(hit.getString(IndexFields.OS));
            devices.accumulate(hit.getString(IndexFields.DEVICE_TYPE));
        }

        return DashboardBuilder.build(timeSeries, paths, browsers, operatingSystems, devices, ips.size(),
                result.getHits().size());
    }
}
