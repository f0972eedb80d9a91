package com.nginx.log.search;

import static com.nginx.log.index.TestEntries.entry;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.nginx.log.config.IndexerConfig;
import com.nginx.log.error.QueryException;
import com.nginx.log.index.IndexBatch;
import com.nginx.log.index.IndexDeletes;
import com.nginx.log.index.IndexFields;
import com.nginx.log.index.IndexHit;
import com.nginx.log.index.IndexSearchRequest;
import com.nginx.log.index.IndexSearchResult;
import com.nginx.log.index.LogDocument;
import com.nginx.log.index.LogIndex;
import com.nginx.log.index.LuceneLogIndex;
import com.nginx.log.index.TestEntries;
import com.nginx.log.indexer.CancellationToken;
import com.nginx.log.parser.model.AccessLogEntry;
import com.nginx.log.search.guard.CircuitBreaker;

public class SearchServiceTest {

    private static final String LOG = "/var/log/nginx/access.log";

    @TempDir
    Path tempDir;

    private LuceneLogIndex index;
    private IndexerConfig config;
    private AtomicLong clock;
    private List<String> trackedFiles;
    private SearchService service;

    @BeforeEach
    public void setUp() throws Exception {
        index = LuceneLogIndex.inMemory();
        TestEntries.indexAll(index, LOG,
                entry(1000, "1.1.1.1", "/a", 200),
                entry(1001, "1.1.1.2", "/b", 301),
                entry(1002, "1.1.1.1", "/a", 404),
                entry(1003, "1.1.1.3", "/c", 500),
                entry(1004, "1.1.1.2", "/b", 200));
        config = new IndexerConfig();
        clock = new AtomicLong(1_000_000L);
        Path log = Files.write(tempDir.resolve("access.log"), List.of("x"));
        trackedFiles = new ArrayList<>(List.of(log.toString()));
        service = new SearchService(index, config, () -> trackedFiles, clock::get);
    }

    @AfterEach
    public void tearDown() throws Exception {
        service.close();
        index.close();
    }

    @Test
    public void testStatusFilterSortedByTimeDescending() throws Exception {
        QueryResult result = service.searchLogs(new QueryRequest().setStatus(List.of(200, 404)));

        assertEquals(3, result.getTotal());
        assertEquals(3, result.getEntries().size());
        assertEquals(1004, result.getEntries().get(0).getTimestamp());
        assertEquals(1002, result.getEntries().get(1).getTimestamp());
        assertEquals(1000, result.getEntries().get(2).getTimestamp());
        assertFalse(result.isFromCache());
    }

    @Test
    public void testPaginationAndAscendingSort() throws Exception {
        QueryResult result = service.searchLogs(new QueryRequest().setLimit(2).setOffset(1).setSortOrder("asc"));

        assertEquals(5, result.getTotal());
        assertEquals(2, result.getEntries().size());
        assertEquals(1001, result.getEntries().get(0).getTimestamp());
        assertEquals(1002, result.getEntries().get(1).getTimestamp());
    }

    @Test
    public void testSummary() throws Exception {
        QueryResult result = service.searchLogs(new QueryRequest());
        SummaryStats summary = result.getSummary();

        assertEquals(5, summary.getPv());
        assertEquals(3, summary.getUv());
        assertEquals(3, summary.getUniquePages());
        assertEquals(500, summary.getTotalTraffic());
        assertEquals(100.0, summary.getAvgTrafficPerPv(), 0.0001);
        assertTrue(summary.getUv() <= summary.getPv());
        assertTrue(summary.getUniquePages() <= summary.getPv());
    }

    @Test
    public void testSummarySkipped() throws Exception {
        QueryResult result = service.searchLogs(new QueryRequest().setIncludeSummary(false));

        assertEquals(5, result.getTotal());
        assertEquals(0, result.getSummary().getPv());
        assertEquals(0, service.getSummaryCacheStats().getEntries());
    }

    @Test
    public void testNoMatches() throws Exception {
        QueryResult result = service.searchLogs(new QueryRequest().setIp("9.9.9.9"));

        assertEquals(0, result.getTotal());
        assertTrue(result.getEntries().isEmpty());
        assertEquals(0, result.getSummary().getPv());
        assertEquals(0.0, result.getSummary().getAvgTrafficPerPv());
    }

    @Test
    public void testResultCacheHit() throws Exception {
        QueryRequest request = new QueryRequest().setPath("/a");
        QueryResult first = service.searchLogs(request);
        QueryResult second = service.searchLogs(request);

        assertFalse(first.isFromCache());
        assertTrue(second.isFromCache());
        assertEquals(first.getTotal(), second.getTotal());
        assertEquals(first.getEntries(), second.getEntries());
        assertEquals(2, second.getSummary().getPv());

        assertFalse(service.searchLogs(new QueryRequest().setPath("/a").setLimit(1)).isFromCache());
    }

    @Test
    public void testCachedEntriesAreNotShared() throws Exception {
        QueryRequest request = new QueryRequest().setIp("1.1.1.3");
        QueryResult first = service.searchLogs(request);
        assertEquals("/c", first.getEntries().get(0).getPath());
        first.getEntries().get(0).setPath("/changed");

        QueryResult second = service.searchLogs(request);
        assertTrue(second.isFromCache());
        assertEquals("/c", second.getEntries().get(0).getPath());
        second.getEntries().get(0).setPath("/changed");

        QueryResult third = service.searchLogs(request);
        assertTrue(third.isFromCache());
        assertEquals("/c", third.getEntries().get(0).getPath());
    }

    @Test
    public void testLargeResultsAreNotCached() throws Exception {
        // 5 entries cost 2600, above 1% of 100000
        config.setResultCacheMaxBytes(100000);
        try (SearchService small = new SearchService(index, config, () -> trackedFiles, clock::get)) {
            small.searchLogs(new QueryRequest());
            assertFalse(small.searchLogs(new QueryRequest()).isFromCache());

            small.searchLogs(new QueryRequest().setIp("1.1.1.3"));
            assertTrue(small.searchLogs(new QueryRequest().setIp("1.1.1.3")).isFromCache());
        }
    }

    @Test
    public void testSummaryCachedWhileValid() throws Exception {
        Query query = new MatchAllDocsQuery();
        SummaryStats first = service.summarize(query, CancellationToken.none());
        SummaryStats second = service.summarize(query, CancellationToken.none());

        assertSame(first, second);
        assertEquals(1, service.getSummaryCacheStats().getEntries());
        assertEquals(SearchService.SUMMARY_ENTRY_WEIGHT, service.getSummaryCacheStats().getWeightedSize());
    }

    @Test
    public void testSummaryExpiresWithAge() throws Exception {
        Query query = new MatchAllDocsQuery();
        SummaryStats first = service.summarize(query, CancellationToken.none());

        clock.addAndGet(config.getStatsMaxAgeMs() - 1);
        assertSame(first, service.summarize(query, CancellationToken.none()));

        clock.addAndGet(1);
        assertNotSame(first, service.summarize(query, CancellationToken.none()));
    }

    @Test
    public void testSummaryInvalidatedByDocCount() throws Exception {
        Query query = new MatchAllDocsQuery();
        SummaryStats first = service.summarize(query, CancellationToken.none());

        IndexBatch batch = index.newBatch();
        batch.index(new LogDocument("extra", LOG, entry(1005, "1.1.1.9", "/z", 200)));
        batch.execute();

        SummaryStats second = service.summarize(query, CancellationToken.none());
        assertNotSame(first, second);
        assertEquals(6, second.getPv());
        assertEquals(4, second.getUv());
    }

    @Test
    public void testSummaryInvalidatedByNewerFile() throws Exception {
        Query query = new MatchAllDocsQuery();
        SummaryStats first = service.summarize(query, CancellationToken.none());

        Path log = Paths.get(trackedFiles.get(0));
        FileTime later = FileTime.fromMillis(Files.getLastModifiedTime(log).toMillis() + 10_000);
        Files.setLastModifiedTime(log, later);

        assertNotSame(first, service.summarize(query, CancellationToken.none()));
    }

    @Test
    public void testIndexChangeClearsSummaryCache() throws Exception {
        service.searchLogs(new QueryRequest().setIp("1.1.1.1"));
        assertEquals(1, service.getSummaryCacheStats().getEntries());

        service.onIndexChanged();
        assertEquals(0, service.getSummaryCacheStats().getEntries());
        assertTrue(service.searchLogs(new QueryRequest().setIp("1.1.1.1")).isFromCache());

        service.onIndexReset();
        assertFalse(service.searchLogs(new QueryRequest().setIp("1.1.1.1")).isFromCache());
    }

    @Test
    public void testGroupDeleteThenSearch() throws Exception {
        try (LuceneLogIndex groupIndex = LuceneLogIndex.inMemory();
                SearchService groupSearch = new SearchService(groupIndex, config, () -> List.of())) {
            String[] siblings = { LOG, LOG + ".1", LOG + ".2.gz" };
            IndexBatch batch = groupIndex.newBatch();
            for (int i = 0; i < 100; i++) {
                String source = siblings[i % siblings.length];
                AccessLogEntry e = entry(2000 + i, "10.0.0." + (i % 7), "/p" + i, 200);
                batch.index(new LogDocument(LogDocument.documentId(source, 0, i), source, LOG, e));
            }
            batch.execute();
            assertEquals(100, groupIndex.count(new MatchAllDocsQuery()));

            IndexDeletes.deleteByTerm(groupIndex, IndexFields.FILE_PATH, LOG);

            QueryResult result = groupSearch.searchLogs(new QueryRequest().setLogPath(LOG));
            assertEquals(0, result.getTotal());
            assertTrue(result.getEntries().isEmpty());
        }
    }

    @Test
    public void testRateLimited() throws Exception {
        config.setSearchRateLimitPerSecond(0.001);
        try (SearchService limited = new SearchService(index, config, () -> trackedFiles, clock::get)) {
            limited.searchLogs(new QueryRequest());
            QueryException e = assertThrows(QueryException.class, () -> limited.searchLogs(new QueryRequest()));
            assertEquals(QueryException.Reason.RATE_LIMITED, e.getReason());
        }
    }

    @Test
    public void testCircuitOpensAfterFailures() throws Exception {
        config.setCircuitFailureThreshold(2);
        try (SearchService failing = new SearchService(new FailingIndex(0), config, () -> List.of(), clock::get)) {
            assertThrows(IOException.class, () -> failing.searchLogs(new QueryRequest()));
            assertThrows(IOException.class, () -> failing.searchLogs(new QueryRequest()));
            assertEquals(CircuitBreaker.State.OPEN, failing.getCircuitBreaker().getState());

            QueryException e = assertThrows(QueryException.class, () -> failing.searchLogs(new QueryRequest()));
            assertEquals(QueryException.Reason.CIRCUIT_OPEN, e.getReason());
        }
    }

    @Test
    public void testTimeout() throws Exception {
        config.setSearchTimeoutMs(100);
        try (SearchService slow = new SearchService(new FailingIndex(1000), config, () -> List.of(), clock::get)) {
            QueryException e = assertThrows(QueryException.class, () -> slow.searchLogs(new QueryRequest()));
            assertEquals(QueryException.Reason.REQUEST_TIMEOUT, e.getReason());
        }
    }

    @Test
    public void testCacheKeyCoversPagination() {
        String a = SearchService.cacheKey(new QueryRequest().setPath("/a").setLimit(10));
        String b = SearchService.cacheKey(new QueryRequest().setPath("/a").setLimit(10).setOffset(10));
        String c = SearchService.cacheKey(new QueryRequest().setPath("/a").setLimit(10));

        assertNotEquals(a, b);
        assertEquals(a, c);
        assertTrue(SearchService.summaryKey(new MatchAllDocsQuery()).startsWith("stats_"));
    }

    /**
     * Index whose searches fail, or stall for {@code delayMs} first when it is positive.
     */
    static class FailingIndex implements LogIndex {

        private final long delayMs;

        FailingIndex(long delayMs) {
            this.delayMs = delayMs;
        }

        @Override
        public IndexBatch newBatch() {
            throw new UnsupportedOperationException();
        }

        @Override
        public IndexSearchResult search(IndexSearchRequest request) throws IOException {
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            throw new IOException("index unavailable");
        }

        @Override
        public long count(Query query) throws IOException {
            throw new IOException("index unavailable");
        }

        @Override
        public long docCount() {
            return 0;
        }

        @Override
        public void scan(Query query, Set<String> fields, int pageSize, Consumer<IndexHit> consumer)
                throws IOException {
            throw new IOException("index unavailable");
        }

        @Override
        public void reset() {
        }

        @Override
        public void close() {
        }
    }
}
