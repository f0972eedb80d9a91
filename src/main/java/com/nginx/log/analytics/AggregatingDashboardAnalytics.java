package com.nginx.log.analytics;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.apache.lucene.search.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.nginx.log.error.QueryException;
import com.nginx.log.index.IndexFields;
import com.nginx.log.index.LogIndex;
import com.nginx.log.search.LogQueryBuilder;
import com.nginx.log.search.QueryRequest;
import com.nginx.log.search.SearchService;
import com.nginx.log.search.SummaryStats;

/**
 * Streams the matching records once per statistic, loading only the fields that
 * statistic needs, so memory stays flat however large the index is. Totals come from
 * the search summary and share its cache.
 */
public class AggregatingDashboardAnalytics implements DashboardAnalyticsProvider {

    static final Logger logger = LoggerFactory.getLogger(AggregatingDashboardAnalytics.class);

    static final int PAGE_SIZE = 10000;

    private final LogIndex index;
    private final SearchService searchService;
    private final LogQueryBuilder queryBuilder = new LogQueryBuilder();
    private final ZoneId zone;
    private final Clock clock;

    public AggregatingDashboardAnalytics(LogIndex index, SearchService searchService) {
        this(index, searchService, ZoneOffset.UTC, Clock.systemUTC());
    }

    public AggregatingDashboardAnalytics(LogIndex index, SearchService searchService, ZoneId zone, Clock clock) {
        this.index = index;
        this.searchService = searchService;
        this.zone = zone;
        this.clock = clock;
    }

    @Override
    public DashboardAnalytics getDashboardAnalytics(DashboardQueryRequest request) throws IOException, QueryException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        QueryRequest queryRequest = request.toQueryRequest();
        Query query = queryBuilder.build(queryRequest);
        logger.info("Dashboard analytics for {} using {}", request, query);

        TimeSeriesAccumulator timeSeries = new TimeSeriesAccumulator(request.getStartTime(), request.getEndTime(),
                zone, clock);
        index.scan(query, Set.of(IndexFields.TIMESTAMP, IndexFields.IP), PAGE_SIZE,
                hit -> timeSeries.accumulate(hit.getLong(IndexFields.TIMESTAMP), hit.getString(IndexFields.IP)));

        FieldCountAccumulator paths = aggregateField(query, IndexFields.PATH);
        FieldCountAccumulator browsers = aggregateField(query, IndexFields.BROWSER);
        FieldCountAccumulator operatingSystems = aggregateField(query, IndexFields.OS);
        FieldCountAccumulator devices = aggregateField(query, IndexFields.DEVICE_TYPE);

        SummaryStats totals = searchService.getSummaryStats(queryRequest);
        DashboardAnalytics analytics = DashboardBuilder.build(timeSeries, paths, browsers, operatingSystems, devices,
                totals.getUv(), totals.getPv());
        logger.info("Dashboard analytics over {} records computed in {} ms", totals.getPv(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return analytics;
    }

    FieldCountAccumulator aggregateField(Query query, String field) throws IOException {
        FieldCountAccumulator accumulator = new FieldCountAccumulator();
        index.scan(query, Set.of(field), PAGE_SIZE, hit -> accumulator.accumulate(hit.getString(field)));
        logger.debug("Aggregated {} values of {} over {} records", field, accumulator.top(0).size(),
                accumulator.getTotal());
        return accumulator;
    }
}
