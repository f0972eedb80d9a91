package com.nginx.log.progress;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import com.nginx.log.event.EventBus;
import com.nginx.log.event.EventType;
import com.nginx.log.event.IndexCompleteData;
import com.nginx.log.event.IndexProgressData;
import com.nginx.log.event.LogIndexEvent;

public class ProgressTrackerTest {

    private static final String GROUP = "/var/log/nginx/access.log";

    private final EventBus eventBus = new EventBus();
    private final List<LogIndexEvent> events = new CopyOnWriteArrayList<>();

    {
        eventBus.subscribe(events::add);
    }

    private long count(EventType type) {
        return events.stream().filter(e -> e.getType() == type).count();
    }

    @Test
    public void testExactlyOnceCompletionUnderConcurrency() throws Exception {
        ProgressTracker tracker = new ProgressTracker(GROUP, eventBus);
        List<String> files = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            String file = GROUP + (i == 0 ? "" : "." + i);
            files.add(file);
            tracker.addFile(file, false);
            tracker.setFileEstimate(file, 100);
        }

        ExecutorService executor = Executors.newFixedThreadPool(5);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (String file : files) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int call = 0; call < 3; call++) {
                    tracker.completeFile(file, 100);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(1, count(EventType.INDEX_COMPLETE));
        assertEquals(1, count(EventType.INDEX_READY));
        assertTrue(tracker.isCompleted());

        IndexCompleteData complete = events.stream().filter(e -> e.getType() == EventType.INDEX_COMPLETE)
                .findFirst().get().getData(IndexCompleteData.class);
        assertTrue(complete.isSuccess());
        assertEquals(500, complete.getTotalLines());
        assertEquals(500 * 150, complete.getIndexedSizeBytes());
    }

    @Test
    public void testProgressIsMonotonicAndEndsAtHundred() {
        AtomicLong clock = new AtomicLong();
        ProgressTracker tracker = new ProgressTracker(GROUP, eventBus, () -> clock.addAndGet(3000));
        tracker.addFile(GROUP, false);
        tracker.addFile(GROUP + ".1", false);
        tracker.setFileEstimate(GROUP, 100);
        tracker.setFileEstimate(GROUP + ".1", 100);

        tracker.startFile(GROUP);
        tracker.startFile(GROUP + ".1");
        tracker.updateFileProgress(GROUP, 50);
        tracker.updateFileProgress(GROUP + ".1", 80);
        tracker.updateFileProgress(GROUP, 100);
        // the estimate was low, actual lines overshoot it
        tracker.updateFileProgress(GROUP + ".1", 140);
        tracker.completeFile(GROUP, 100);
        tracker.completeFile(GROUP + ".1", 150);

        List<IndexProgressData> progress = new ArrayList<>();
        for (LogIndexEvent event : events) {
            if (event.getType() == EventType.INDEX_PROGRESS) {
                progress.add(event.getData(IndexProgressData.class));
            }
        }
        assertTrue(progress.size() > 3);
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i).getProgress() >= progress.get(i - 1).getProgress());
        }
        for (int i = 0; i < progress.size() - 1; i++) {
            assertTrue(progress.get(i).getProgress() < 100);
            assertEquals("running", progress.get(i).getStatus());
        }
        IndexProgressData last = progress.get(progress.size() - 1);
        assertEquals(100.0, last.getProgress(), 0.0);
        assertEquals("completed", last.getStatus());

        // final progress, then complete, then ready
        int n = events.size();
        assertEquals(EventType.INDEX_PROGRESS, events.get(n - 3).getType());
        assertEquals(EventType.INDEX_COMPLETE, events.get(n - 2).getType());
        assertEquals(EventType.INDEX_READY, events.get(n - 1).getType());
    }

    @Test
    public void testProgressEventsAreThrottled() {
        AtomicLong clock = new AtomicLong(10_000);
        ProgressTracker tracker = new ProgressTracker(GROUP, eventBus, clock::get);
        tracker.addFile(GROUP, false);
        tracker.setFileEstimate(GROUP, 1000);

        tracker.startFile(GROUP);
        tracker.updateFileProgress(GROUP, 100);
        tracker.updateFileProgress(GROUP, 200);
        assertEquals(1, count(EventType.INDEX_PROGRESS));

        clock.addAndGet(1999);
        tracker.updateFileProgress(GROUP, 300);
        assertEquals(1, count(EventType.INDEX_PROGRESS));

        clock.addAndGet(1);
        tracker.updateFileProgress(GROUP, 400);
        assertEquals(2, count(EventType.INDEX_PROGRESS));

        IndexProgressData data = events.get(1).getData(IndexProgressData.class);
        assertEquals(40.0, data.getProgress(), 1e-9);
        assertEquals(2000, data.getElapsedMs());
        assertEquals(3000, data.getEstimatedRemainingMs());
        assertEquals("indexing", data.getStage());
    }

    @Test
    public void testFileCountFallbackWithoutEstimates() {
        ProgressTracker tracker = new ProgressTracker(GROUP, eventBus);
        tracker.addFile(GROUP, false);
        tracker.addFile(GROUP + ".1", false);

        tracker.completeFile(GROUP, 10);

        ProgressStats stats = tracker.getProgress();
        assertEquals(50.0, stats.getPercentage(), 1e-9);
        assertEquals(1, stats.getCompletedFiles());
        assertEquals(2, stats.getTotalFiles());
        assertFalse(stats.isCompleted());
        assertEquals(FileState.COMPLETED, tracker.getFileStates().get(GROUP));
        assertEquals(FileState.PENDING, tracker.getFileStates().get(GROUP + ".1"));
    }

    @Test
    public void testIndexedSizeUsesPositionAndAverageLineSize() {
        ProgressTracker tracker = new ProgressTracker(GROUP, eventBus);
        tracker.addFile(GROUP, false);
        tracker.addFile(GROUP + ".2.gz", true);
        tracker.setFileSize(GROUP + ".2.gz", 1000);

        tracker.updateFilePosition(GROUP, 4096, 30);
        tracker.updateFilePosition(GROUP + ".2.gz", 0, 10);
        FileProgress compressed = tracker.getFiles().get(1);
        assertEquals(300, compressed.getAvgLineSize());

        tracker.completeFile(GROUP, 30);
        tracker.completeFile(GROUP + ".2.gz", 10);

        IndexCompleteData complete = events.stream().filter(e -> e.getType() == EventType.INDEX_COMPLETE)
                .findFirst().get().getData(IndexCompleteData.class);
        assertEquals(4096 + 10 * 300, complete.getIndexedSizeBytes());
        assertEquals(40, complete.getTotalLines());
    }

    @Test
    public void testAverageLineSizeRejectsImplausibleEstimates() {
        ProgressTracker tracker = new ProgressTracker(GROUP, eventBus);
        tracker.addFile(GROUP + ".1.gz", true);
        tracker.setFileSize(GROUP + ".1.gz", 100);

        // 300 bytes over 100 lines is 3 bytes a line
        tracker.updateFilePosition(GROUP + ".1.gz", 0, 100);

        assertEquals(120, tracker.getFiles().get(0).getAvgLineSize());
    }

    @Test
    public void testFailedFilesStillCompleteTheGroup() {
        ProgressTracker tracker = new ProgressTracker(GROUP, eventBus);
        tracker.addFile(GROUP, false);
        tracker.addFile(GROUP + ".1", false);

        tracker.failFile(GROUP + ".1", "file too large");
        tracker.completeFile(GROUP, 0);

        IndexCompleteData complete = events.stream().filter(e -> e.getType() == EventType.INDEX_COMPLETE)
                .findFirst().get().getData(IndexCompleteData.class);
        assertFalse(complete.isSuccess());
        assertEquals("file too large", complete.getError());
    }

    @Test
    public void testAbortPublishesSingleFailedCompletion() {
        ProgressTracker tracker = new ProgressTracker(GROUP, eventBus);
        tracker.addFile(GROUP, false);

        tracker.abort("no files");
        tracker.abort("again");
        tracker.completeFile(GROUP, 10);

        assertEquals(1, count(EventType.INDEX_COMPLETE));
        assertTrue(tracker.isCompleted());
    }

    @Test
    public void testEstimateFileLines() {
        assertEquals(100, ProgressTracker.estimateFileLines(10_000, false));
        assertEquals(300, ProgressTracker.estimateFileLines(10_000, true));
        assertEquals(0, ProgressTracker.estimateFileLines(0, false));
    }
}
