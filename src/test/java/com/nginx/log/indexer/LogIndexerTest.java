package com.nginx.log.indexer;

import static com.nginx.log.indexer.StreamingFileIndexerTest.BASE_TS;
import static com.nginx.log.indexer.StreamingFileIndexerTest.line;
import static com.nginx.log.indexer.StreamingFileIndexerTest.writeLines;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPOutputStream;

import org.apache.lucene.index.Term;
import org.apache.lucene.search.TermQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.nginx.log.config.IndexerConfig;
import com.nginx.log.cursor.LogIndexCursor;
import com.nginx.log.cursor.SqliteCursorStore;
import com.nginx.log.error.FileIndexException;
import com.nginx.log.event.EventBus;
import com.nginx.log.event.EventType;
import com.nginx.log.event.IndexCompleteData;
import com.nginx.log.event.LogIndexEvent;
import com.nginx.log.index.IndexFields;
import com.nginx.log.index.LuceneLogIndex;
import com.nginx.log.parser.AccessLogParser;
import com.nginx.log.parser.useragent.SimpleUserAgentParser;

public class LogIndexerTest {

    @TempDir
    Path tempDir;

    private final EventBus eventBus = new EventBus();
    private final List<LogIndexEvent> events = new CopyOnWriteArrayList<>();

    private LuceneLogIndex index;
    private SqliteCursorStore cursorStore;
    private AccessLogParser parser;
    private LogIndexer indexer;

    private String main;
    private String rotated;
    private String compressed;

    @BeforeEach
    public void setUp() throws Exception {
        eventBus.subscribe(events::add);
        index = LuceneLogIndex.inMemory();
        cursorStore = SqliteCursorStore.inMemory();
        parser = new AccessLogParser(new SimpleUserAgentParser(), null, 1);
        indexer = new LogIndexer(config(0), index, cursorStore, eventBus, parser);
        main = tempDir.resolve("access.log").toString();
        rotated = tempDir.resolve("access.log.1").toString();
        compressed = tempDir.resolve("access.log.2.gz").toString();
    }

    @AfterEach
    public void tearDown() throws Exception {
        indexer.close();
        parser.close();
        cursorStore.close();
        index.close();
    }

    private static IndexerConfig config(long minIntervalMs) {
        IndexerConfig config = new IndexerConfig();
        config.setMinIndexIntervalMs(minIntervalMs);
        config.setIndexWorkers(2);
        config.setSubmitTimeoutMs(1000);
        config.setTaskTimeoutMs(60_000);
        return config;
    }

    /** access.log holds lines 0-1, access.log.1 lines 2-4 and access.log.2.gz lines 5-6. */
    private void writeGroup() throws IOException {
        writeLines(tempDir.resolve("access.log"), 0, 2);
        writeLines(tempDir.resolve("access.log.1"), 2, 5);
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(tempDir.resolve("access.log.2.gz")))) {
            for (int i = 5; i < 7; i++) {
                out.write((line(i) + "\n").getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    private void touchLater(String path) throws IOException {
        Files.setLastModifiedTime(Paths.get(path), FileTime.fromMillis(System.currentTimeMillis() + 10_000));
    }

    private long countEvents(EventType type) {
        return events.stream().filter(e -> e.getType() == type).count();
    }

    @Test
    public void testIncrementalIndexing() throws Exception {
        AtomicInteger changes = new AtomicInteger();
        indexer.addIndexChangeListener(changes::incrementAndGet);
        writeLines(tempDir.resolve("access.log"), 0, 3);

        indexer.indexLogFile(main);
        assertEquals(3, index.docCount());
        assertEquals(1, changes.get());
        assertEquals(Collections.singletonList(main), indexer.getTrackedFiles());

        writeLines(tempDir.resolve("access.log"), 3, 5);
        touchLater(main);
        indexer.indexLogFile(main);
        assertEquals(5, index.docCount());

        LogIndexCursor cursor = cursorStore.getLogIndex(main);
        assertEquals(Files.size(tempDir.resolve("access.log")), cursor.getLastPosition());
        assertEquals(5, cursor.getDocumentCount());

        // unchanged file is skipped
        indexer.indexLogFile(main);
        assertEquals(5, index.docCount());
        assertFalse(indexer.isIndexing());
    }

    @Test
    public void testTruncatedFileIsRebuilt() throws Exception {
        writeLines(tempDir.resolve("access.log"), 0, 4);
        indexer.indexLogFile(main);
        assertEquals(4, index.docCount());

        Files.delete(tempDir.resolve("access.log"));
        writeLines(tempDir.resolve("access.log"), 10, 11);
        indexer.indexLogFile(main);

        assertEquals(1, index.docCount());
        assertEquals(Files.size(tempDir.resolve("access.log")), cursorStore.getLogIndex(main).getLastPosition());
    }

    @Test
    public void testFullGroupIndex() throws Exception {
        writeGroup();

        indexer.indexLogFileFull(main);

        assertEquals(7, index.docCount());
        assertEquals(7, index.count(new TermQuery(new Term(IndexFields.FILE_PATH, main))));
        assertEquals(3, index.count(new TermQuery(new Term(IndexFields.SOURCE_FILE, rotated))));
        assertEquals(1, countEvents(EventType.INDEX_COMPLETE));
        IndexCompleteData complete = events.stream().filter(e -> e.getType() == EventType.INDEX_COMPLETE)
                .findFirst().get().getData(IndexCompleteData.class);
        assertTrue(complete.isSuccess());
        assertEquals(main, complete.getLogPath());
        assertEquals(7, complete.getTotalLines());
        assertNull(indexer.getProgressTrackers().get(main));
        assertFalse(indexer.isIndexing());

        assertEquals(Files.size(tempDir.resolve("access.log.1")), cursorStore.getLogIndex(rotated).getLastPosition());
        assertEquals(Files.size(tempDir.resolve("access.log.2.gz")),
                cursorStore.getLogIndex(compressed).getLastPosition());
        assertEquals(main, cursorStore.getLogIndex(compressed).getMainLogPath());
    }

    @Test
    public void testFullIndexReplacesExistingDocuments() throws Exception {
        writeGroup();
        indexer.indexLogFileFull(main);
        indexer.indexLogFileFull(main);

        assertEquals(7, index.docCount());
        assertEquals(2, countEvents(EventType.INDEX_COMPLETE));
    }

    @Test
    public void testAddCompressedLogRebuildsGroup() throws Exception {
        writeGroup();

        indexer.addLogPath(compressed).get(30, TimeUnit.SECONDS);

        assertEquals(7, index.docCount());
        assertTrue(indexer.getTrackedFiles().containsAll(List.of(main, rotated, compressed)));
    }

    @Test
    public void testAddLogPathOutsideWhitelist() throws Exception {
        Path allowed = Files.createDirectory(tempDir.resolve("allowed"));
        writeLines(tempDir.resolve("access.log"), 0, 1);
        IndexerConfig config = config(0);
        config.setWhitelistDirs(List.of(allowed.toString()));

        try (LogIndexer restricted = new LogIndexer(config, index, cursorStore, eventBus, parser)) {
            assertThrows(FileIndexException.class, () -> restricted.addLogPath(main));
            assertTrue(restricted.getTrackedFiles().isEmpty());
        }
    }

    @Test
    public void testForceReindexFileGroup() throws Exception {
        writeGroup();

        CompletableFuture<Void> future = indexer.forceReindexFileGroup(main);
        future.get(30, TimeUnit.SECONDS);

        assertEquals(7, index.docCount());
        assertFalse(indexer.isIndexing());
        assertFalse(indexer.isIndexing(rotated));
    }

    @Test
    public void testForceReindexMissingGroupFails() throws Exception {
        CompletableFuture<Void> future = indexer.forceReindexFileGroup(tempDir.resolve("missing.log").toString());

        assertThrows(Exception.class, () -> future.get(30, TimeUnit.SECONDS));
        assertTrue(future.isCompletedExceptionally());
        assertFalse(indexer.isIndexing());
    }

    @Test
    public void testDeleteLogGroup() throws Exception {
        writeGroup();
        indexer.indexLogFileFull(main);

        assertEquals(7, indexer.deleteLogGroupFromIndex(main));
        assertEquals(0, index.docCount());
    }

    @Test
    public void testDeleteFileIndex() throws Exception {
        writeGroup();
        indexer.indexLogFileFull(main);

        assertEquals(3, indexer.deleteFileIndex(rotated));

        assertEquals(4, index.docCount());
        assertFalse(indexer.getTrackedFiles().contains(rotated));
        assertEquals(0, cursorStore.getLogIndex(rotated).getLastPosition());
    }

    @Test
    public void testDeleteAllIndexes() throws Exception {
        AtomicInteger resets = new AtomicInteger();
        indexer.addIndexChangeListener(new IndexChangeListener() {
            @Override
            public void onIndexChanged() {
            }

            @Override
            public void onIndexReset() {
                resets.incrementAndGet();
            }
        });
        writeGroup();
        indexer.indexLogFileFull(main);

        indexer.deleteAllIndexes();

        assertEquals(0, index.docCount());
        assertTrue(indexer.getTrackedFiles().isEmpty());
        assertTrue(cursorStore.getAll().isEmpty());
        assertEquals(1, resets.get());
    }

    @Test
    public void testCleanupOrphanedIndexes() throws Exception {
        writeGroup();
        indexer.indexLogFileFull(main);
        Files.delete(tempDir.resolve("access.log.1"));

        List<String> removed = indexer.cleanupOrphanedIndexes();

        assertEquals(Collections.singletonList(rotated), removed);
        assertEquals(4, index.docCount());
        assertTrue(indexer.cleanupOrphanedIndexes().isEmpty());
    }

    @Test
    public void testRebuildIndex() throws Exception {
        writeGroup();
        indexer.indexLogFileFull(main);

        indexer.rebuildIndex();

        assertEquals(7, index.docCount());
        assertFalse(indexer.isIndexing());
    }

    @Test
    public void testTimeRange() throws Exception {
        assertNull(indexer.getTimeRange());
        writeGroup();
        indexer.indexLogFileFull(main);

        TimeRange range = indexer.getTimeRange(main);
        assertEquals(BASE_TS, range.getStart());
        assertEquals(BASE_TS + 6 * 60, range.getEnd());
        assertEquals(range.getStart(), indexer.getTimeRange().getStart());
        assertNull(indexer.getTimeRange(tempDir.resolve("other.log").toString()));
    }

    @Test
    public void testIndexStatus() throws Exception {
        writeGroup();
        indexer.indexLogFileFull(main);

        IndexerStatus status = indexer.getIndexStatus();

        assertEquals(7, status.getDocumentCount());
        assertEquals(List.of(main, rotated, compressed).size(), status.getLogPathsCount());
        assertEquals(3, status.getFiles().size());
        assertFalse(status.isIndexing());
    }

    @Test
    public void testDebounceMergesSubmissions() throws Exception {
        writeLines(tempDir.resolve("access.log"), 0, 2);
        try (LogIndexer debounced = new LogIndexer(config(60_000), index, cursorStore, eventBus, parser)) {
            debounced.addLogPath(main).get(30, TimeUnit.SECONDS);
            assertEquals(2, index.docCount());

            CompletableFuture<Void> first = debounced.submit(new IndexTask(main, IndexTask.PRIORITY_NORMAL, false));
            CompletableFuture<Void> second = debounced.submit(new IndexTask(main, IndexTask.PRIORITY_NORMAL, false));
            assertEquals(1, debounced.getPendingDebounceCount());
            assertFalse(first.isDone());

            // rebuild priority is not debounced
            debounced.submit(new IndexTask(main, IndexTask.PRIORITY_REBUILD, true)).get(30, TimeUnit.SECONDS);
            assertEquals(1, debounced.getPendingDebounceCount());

            debounced.close();
            assertTrue(second.isCancelled());
            assertTrue(first.isCompletedExceptionally());
        }
    }

    @Test
    public void testSubmitAfterClose() throws Exception {
        indexer.close();

        CompletableFuture<Void> future = indexer.submit(new IndexTask(main, IndexTask.PRIORITY_REBUILD, true));

        assertTrue(future.isCompletedExceptionally());
    }
}
