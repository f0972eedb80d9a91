package com.nginx.log.indexer;

import static com.nginx.log.indexer.StreamingFileIndexerTest.writeLines;
import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.nginx.log.config.IndexerConfig;
import com.nginx.log.cursor.SqliteCursorStore;
import com.nginx.log.event.EventBus;
import com.nginx.log.index.LuceneLogIndex;
import com.nginx.log.parser.AccessLogParser;
import com.nginx.log.parser.useragent.SimpleUserAgentParser;

public class LogDirectoryWatcherTest {

    @TempDir
    Path tempDir;

    private LuceneLogIndex index;
    private SqliteCursorStore cursorStore;
    private AccessLogParser parser;
    private LogIndexer indexer;
    private LogDirectoryWatcher watcher;

    @BeforeEach
    public void setUp() throws Exception {
        index = LuceneLogIndex.inMemory();
        cursorStore = SqliteCursorStore.inMemory();
        parser = new AccessLogParser(new SimpleUserAgentParser(), null, 1);
        IndexerConfig config = new IndexerConfig();
        config.setMinIndexIntervalMs(0);
        config.setIndexWorkers(1);
        indexer = new LogIndexer(config, index, cursorStore, new EventBus(), parser);
        watcher = new LogDirectoryWatcher(indexer);
    }

    @AfterEach
    public void tearDown() throws Exception {
        watcher.close();
        indexer.close();
        parser.close();
        cursorStore.close();
        index.close();
    }

    private static void waitFor(long expectedDocs, LuceneLogIndex index) throws Exception {
        long deadline = System.currentTimeMillis() + 30_000;
        while (index.docCount() != expectedDocs && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertEquals(expectedDocs, index.docCount());
    }

    @Test
    public void testModifyQueuesIncrementalIndex() throws Exception {
        Path file = writeLines(tempDir.resolve("access.log"), 0, 2);
        indexer.indexLogFile(file.toString());
        assertEquals(2, index.docCount());

        writeLines(file, 2, 3);
        Files.setLastModifiedTime(file, FileTime.fromMillis(System.currentTimeMillis() + 10_000));
        watcher.handleEvent(ENTRY_MODIFY, file);

        waitFor(3, index);
    }

    @Test
    public void testUntrackedFileIsIgnored() throws Exception {
        Path file = writeLines(tempDir.resolve("error.log"), 0, 2);

        watcher.handleEvent(ENTRY_MODIFY, file);
        watcher.handleEvent(ENTRY_DELETE, file);

        assertTrue(indexer.getTrackedFiles().isEmpty());
        assertEquals(0, index.docCount());
    }

    @Test
    public void testDeleteRemovesDocuments() throws Exception {
        Path file = writeLines(tempDir.resolve("access.log"), 0, 2);
        indexer.indexLogFile(file.toString());
        Files.delete(file);

        watcher.handleEvent(ENTRY_DELETE, file);

        assertEquals(0, index.docCount());
        assertTrue(indexer.getTrackedFiles().isEmpty());
    }

    @Test
    public void testNewCompressedRotationRebuildsGroup() throws Exception {
        Path main = writeLines(tempDir.resolve("access.log"), 0, 2);
        indexer.indexLogFile(main.toString());
        Path rotated = tempDir.resolve("access.log.1.gz");
        try (GZIPOutputStream out = new GZIPOutputStream(Files.newOutputStream(rotated))) {
            out.write((StreamingFileIndexerTest.line(5) + "\n").getBytes(StandardCharsets.UTF_8));
        }

        watcher.handleEvent(ENTRY_CREATE, rotated);

        waitFor(3, index);
        assertTrue(indexer.getTrackedFiles().contains(rotated.toString()));
        CompletableFuture<Void> idle = indexer.forceReindexFileGroup(main.toString());
        idle.get(30, TimeUnit.SECONDS);
        assertEquals(3, index.docCount());
    }
}
