package com.nginx.log.search;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

import org.apache.lucene.search.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.nginx.log.config.IndexerConfig;
import com.nginx.log.error.QueryException;
import com.nginx.log.error.QueryException.Reason;
import com.nginx.log.index.IndexFields;
import com.nginx.log.index.IndexHit;
import com.nginx.log.index.IndexSearchRequest;
import com.nginx.log.index.IndexSearchResult;
import com.nginx.log.index.LogIndex;
import com.nginx.log.indexer.CancellationToken;
import com.nginx.log.indexer.IndexChangeListener;
import com.nginx.log.indexer.LogIndexer;
import com.nginx.log.parser.model.AccessLogEntry;
import com.nginx.log.search.guard.CircuitBreaker;
import com.nginx.log.search.guard.RateLimiterGuard;

/**
 * Filtered search over the log index with two caches: result pages keyed by the full
 * request, and summary statistics keyed by the query alone. A cached summary is only
 * reused while the document count, the newest log file mtime and its age say it is
 * current. Calls pass a rate limiter and a circuit breaker and are bounded by a timeout.
 */
public class SearchService implements IndexChangeListener, Closeable {

    static final Logger logger = LoggerFactory.getLogger(SearchService.class);

    static final int SUMMARY_PAGE_SIZE = 10000;
    static final int SUMMARY_ENTRY_WEIGHT = 1024;

    static final Set<String> RESPONSE_FIELDS = Set.of(IndexFields.TIMESTAMP, IndexFields.IP,
            IndexFields.REGION_CODE, IndexFields.PROVINCE, IndexFields.CITY, IndexFields.METHOD, IndexFields.PATH,
            IndexFields.PROTOCOL, IndexFields.STATUS, IndexFields.BYTES_SENT, IndexFields.REFERER,
            IndexFields.USER_AGENT, IndexFields.BROWSER, IndexFields.BROWSER_VERSION, IndexFields.OS,
            IndexFields.OS_VERSION, IndexFields.DEVICE_TYPE, IndexFields.REQUEST_TIME, IndexFields.UPSTREAM_TIME,
            IndexFields.RAW);

    static final Set<String> SUMMARY_FIELDS = Set.of(IndexFields.IP, IndexFields.PATH, IndexFields.BYTES_SENT);

    private static final Joiner KEY_JOINER = Joiner.on('_').useForNull("");

    private final LogIndex index;
    private final LogQueryBuilder queryBuilder = new LogQueryBuilder();
    private final Supplier<? extends Collection<String>> trackedFiles;
    private final LongSupplier clock;
    private final int maxSize;
    private final long searchTimeoutMs;
    private final long resultCacheMaxBytes;
    private final long summaryMaxAgeMs;

    private final Cache<String, CachedSearchResult> resultCache;
    private final Cache<String, CachedSummary> summaryCache;
    private final RateLimiterGuard rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final ExecutorService executor;

    public SearchService(LogIndex index, IndexerConfig config, Supplier<? extends Collection<String>> trackedFiles) {
        this(index, config, trackedFiles, System::currentTimeMillis);
    }

    SearchService(LogIndex index, IndexerConfig config, Supplier<? extends Collection<String>> trackedFiles,
            LongSupplier clock) {
        this.index = index;
        this.trackedFiles = trackedFiles;
        this.clock = clock;
        this.maxSize = config.getSearchMaxSize();
        this.searchTimeoutMs = config.getSearchTimeoutMs();
        this.resultCacheMaxBytes = config.getResultCacheMaxBytes();
        this.summaryMaxAgeMs = config.getStatsMaxAgeMs();
        this.resultCache = Caffeine.newBuilder()
                .maximumWeight(resultCacheMaxBytes)
                .weigher((String key, CachedSearchResult value) -> (int) Math.min(Integer.MAX_VALUE, value.cost))
                .build();
        this.summaryCache = Caffeine.newBuilder()
                .maximumWeight(config.getStatsCacheMaxBytes())
                .weigher((String key, CachedSummary value) -> SUMMARY_ENTRY_WEIGHT)
                .build();
        this.rateLimiter = new RateLimiterGuard(config.getSearchRateLimitPerSecond());
        this.circuitBreaker = new CircuitBreaker("log-search", config.getCircuitFailureThreshold(),
                config.getCircuitOpenMs(), clock);
        this.executor = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("log-search-%d").setDaemon(true).build());
    }

    /**
     * Search service over the indexer's index that drops cached summaries whenever the
     * indexer commits.
     */
    public static SearchService create(LogIndexer indexer, IndexerConfig config) {
        SearchService service = new SearchService(indexer.getIndex(), config, indexer::getTrackedFiles);
        indexer.addIndexChangeListener(service);
        return service;
    }

    public QueryResult searchLogs(QueryRequest request) throws QueryException, IOException {
        return searchLogs(request, CancellationToken.none());
    }

    public QueryResult searchLogs(QueryRequest request, CancellationToken token) throws QueryException, IOException {
        rateLimiter.acquire();
        circuitBreaker.acquirePermission();
        CancellationToken searchToken = token.child();
        Future<QueryResult> future = executor.submit(() -> doSearch(request, searchToken));
        try {
            QueryResult result = future.get(searchTimeoutMs, TimeUnit.MILLISECONDS);
            circuitBreaker.recordSuccess();
            return result;
        } catch (TimeoutException e) {
            searchToken.cancel("timed out after " + searchTimeoutMs + " ms");
            future.cancel(false);
            circuitBreaker.recordFailure();
            throw new QueryException(Reason.REQUEST_TIMEOUT, "search timed out after " + searchTimeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            searchToken.cancel("interrupted");
            circuitBreaker.release();
            throw new QueryException(Reason.CANCELLED, "search interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QueryException) {
                circuitBreaker.release();
                throw (QueryException) cause;
            }
            circuitBreaker.recordFailure();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("search failed", cause);
        }
    }

    private QueryResult doSearch(QueryRequest request, CancellationToken token) throws QueryException, IOException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        String cacheKey = cacheKey(request);
        Query query = queryBuilder.build(request);

        CachedSearchResult cached = resultCache.getIfPresent(cacheKey);
        if (cached != null) {
            logger.debug("Result cache hit for {}", cacheKey);
            SummaryStats summary = request.isIncludeSummary() ? summarize(query, token) : new SummaryStats();
            return new QueryResult(copyOf(cached.entries), cached.total, stopwatch.elapsed(TimeUnit.MILLISECONDS),
                    summary, true);
        }
        logger.debug("Result cache miss for {}", cacheKey);

        int size = request.getLimit() <= 0 ? maxSize : Math.min(request.getLimit(), maxSize);
        IndexSearchRequest searchRequest = new IndexSearchRequest(query, size, Math.max(0, request.getOffset()))
                .setSort(LogQueryBuilder.sortField(request.getSortBy()),
                        LogQueryBuilder.isDescending(request.getSortOrder()))
                .setFields(RESPONSE_FIELDS);
        IndexSearchResult result = index.search(searchRequest);
        checkCancelled(token);

        List<AccessLogEntry> entries = new ArrayList<>(result.getHits().size());
        for (IndexHit hit : result.getHits()) {
            entries.add(hit.toEntry());
        }
        entries = List.copyOf(entries);
        SummaryStats summary = request.isIncludeSummary() ? summarize(query, token) : new SummaryStats();

        long cost = entries.size() * 500L + 100;
        if (cost <= resultCacheMaxBytes / 100) {
            resultCache.put(cacheKey, new CachedSearchResult(copyOf(entries), result.getTotal(), cost));
        } else {
            logger.debug("Result for {} too large to cache ({} bytes)", cacheKey, cost);
        }
        return new QueryResult(entries, result.getTotal(), stopwatch.elapsed(TimeUnit.MILLISECONDS), summary, false);
    }

    /**
     * Summary over every match of {@code query}, served from the summary cache while the
     * cached entry is still valid.
     */
    public SummaryStats getSummaryStats(QueryRequest request) throws QueryException, IOException {
        return summarize(queryBuilder.build(request), CancellationToken.none());
    }

    SummaryStats summarize(Query query, CancellationToken token) throws QueryException, IOException {
        String key = summaryKey(query);
        CachedSummary cached = summaryCache.getIfPresent(key);
        if (cached != null) {
            if (isValid(cached)) {
                logger.debug("Summary cache hit for {}", key);
                return cached.stats;
            }
            logger.info("Summary cache entry {} is stale, recalculating", key);
            summaryCache.invalidate(key);
        }

        long docCount = index.docCount();
        long filesModTime = latestFilesModTime();
        SummaryStats stats = computeSummary(query, token);
        summaryCache.put(key, new CachedSummary(stats, docCount, filesModTime, clock.getAsLong()));
        return stats;
    }

    private SummaryStats computeSummary(Query query, CancellationToken token) throws QueryException, IOException {
        long pv = index.count(query);
        if (pv == 0) {
            return new SummaryStats();
        }
        Set<String> ips = new HashSet<>();
        Set<String> pages = new HashSet<>();
        long[] traffic = new long[1];
        try {
            index.scan(query, SUMMARY_FIELDS, SUMMARY_PAGE_SIZE, hit -> {
                if (token.isCancelled()) {
                    throw new CancellationException(token.getReason());
                }
                String ip = hit.getString(IndexFields.IP);
                if (!ip.isEmpty()) {
                    ips.add(ip);
                }
                String path = hit.getString(IndexFields.PATH);
                if (!path.isEmpty()) {
                    pages.add(path);
                }
                long bytes = hit.getLong(IndexFields.BYTES_SENT);
                if (bytes > 0) {
                    traffic[0] += bytes;
                }
            });
        } catch (CancellationException e) {
            throw new QueryException(Reason.CANCELLED, "summary calculation cancelled: " + e.getMessage(), e);
        }
        SummaryStats stats = new SummaryStats(ips.size(), pv, traffic[0], pages.size());
        logger.debug("Summary for {}: {}", query, stats);
        return stats;
    }

    private boolean isValid(CachedSummary cached) throws IOException {
        long docCount = index.docCount();
        long filesModTime = latestFilesModTime();
        long age = clock.getAsLong() - cached.computedAt;
        boolean valid = cached.docCount == docCount && filesModTime <= cached.filesModTime && age < summaryMaxAgeMs;
        if (!valid) {
            logger.debug("Summary invalid: docCount {} -> {}, modTime {} -> {}, age {} ms", cached.docCount, docCount,
                    cached.filesModTime, filesModTime, age);
        }
        return valid;
    }

    private long latestFilesModTime() {
        long latest = 0;
        for (String file : trackedFiles.get()) {
            try {
                latest = Math.max(latest, Files.getLastModifiedTime(Paths.get(file)).toMillis());
            } catch (IOException e) {
                logger.debug("Unable to stat {}: {}", file, e.getMessage());
            }
        }
        return latest;
    }

    private static void checkCancelled(CancellationToken token) throws QueryException {
        if (token.isCancelled()) {
            throw new QueryException(Reason.CANCELLED, "search cancelled: " + token.getReason());
        }
    }

    static String cacheKey(QueryRequest request) {
        return "search_" + KEY_JOINER.join(request.getStartTime(), request.getEndTime(), request.getQuery(),
                request.getIp(), request.getMethod(), request.getPath(), request.getUserAgent(), request.getReferer(),
                request.getBrowser(), request.getOs(), request.getDevice(), request.getLogPath(), request.getStatus(),
                request.getLimit(), request.getOffset(), request.getSortBy(), request.getSortOrder());
    }

    static String summaryKey(Query query) {
        return "stats_" + Hashing.sha256().hashString(query.toString(), StandardCharsets.UTF_8).toString().substring(0, 32);
    }

    @Override
    public void onIndexChanged() {
        summaryCache.invalidateAll();
        logger.debug("Summary cache invalidated");
    }

    @Override
    public void onIndexReset() {
        summaryCache.invalidateAll();
        resultCache.invalidateAll();
        logger.info("Search caches cleared after index reset");
    }

    public CacheStats getSummaryCacheStats() {
        summaryCache.cleanUp();
        long weighted = summaryCache.policy().eviction().map(e -> e.weightedSize().orElse(0L)).orElse(0L);
        return new CacheStats(summaryCache.estimatedSize(), weighted);
    }

    public CacheStats getResultCacheStats() {
        resultCache.cleanUp();
        long weighted = resultCache.policy().eviction().map(e -> e.weightedSize().orElse(0L)).orElse(0L);
        return new CacheStats(resultCache.estimatedSize(), weighted);
    }

    @VisibleForTesting
    CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // cached entries are never handed out directly
    private static List<AccessLogEntry> copyOf(List<AccessLogEntry> entries) {
        List<AccessLogEntry> copies = new ArrayList<>(entries.size());
        for (AccessLogEntry entry : entries) {
            copies.add(entry.copy());
        }
        return List.copyOf(copies);
    }

    static class CachedSearchResult {
        final List<AccessLogEntry> entries;
        final long total;
        final long cost;

        CachedSearchResult(List<AccessLogEntry> entries, long total, long cost) {
            this.entries = entries;
            this.total = total;
            this.cost = cost;
        }
    }

    static class CachedSummary {
        final SummaryStats stats;
        final long docCount;
        final long filesModTime;
        final long computedAt;

        CachedSummary(SummaryStats stats, long docCount, long filesModTime, long computedAt) {
            this.stats = stats;
            this.docCount = docCount;
            this.filesModTime = filesModTime;
            this.computedAt = computedAt;
        }
    }
}
