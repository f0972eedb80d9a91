package com.nginx.log.indexer;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import org.apache.lucene.index.Term;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.nginx.log.config.IndexerConfig;
import com.nginx.log.cursor.CursorStore;
import com.nginx.log.cursor.LogIndexCursor;
import com.nginx.log.cursor.SqliteCursorStore;
import com.nginx.log.error.FileIndexException;
import com.nginx.log.error.FileIndexException.Reason;
import com.nginx.log.error.GroupIndexException;
import com.nginx.log.error.LogIndexException;
import com.nginx.log.event.EventBus;
import com.nginx.log.files.LogFileGroups;
import com.nginx.log.files.LogPathWhitelist;
import com.nginx.log.files.SafeLogFileOpener;
import com.nginx.log.index.IndexDeletes;
import com.nginx.log.index.IndexFields;
import com.nginx.log.index.IndexHit;
import com.nginx.log.index.IndexSearchRequest;
import com.nginx.log.index.IndexSearchResult;
import com.nginx.log.index.LogIndex;
import com.nginx.log.index.LuceneLogIndex;
import com.nginx.log.index.ShardedLogIndex;
import com.nginx.log.parser.AccessLogParser;
import com.nginx.log.parser.useragent.SimpleUserAgentParser;
import com.nginx.log.progress.ProgressTracker;
import com.nginx.log.progress.ProgressTrackerRegistry;

/**
 * Owns the index task queue. Submissions are debounced per file, drained by a
 * dispatcher thread and executed on a worker pool, with at most one task per file at a
 * time. Full group rebuilds index the group's files concurrently and report through a
 * {@link ProgressTracker}.
 */
public class LogIndexer implements Closeable {

    static final Logger logger = LoggerFactory.getLogger(LogIndexer.class);

    private final IndexerConfig config;
    private final LogIndex index;
    private final CursorStore cursorStore;
    private final AccessLogParser parser;
    private final ProgressTrackerRegistry trackers;
    private final IndexingStatusManager statusManager;
    private final SafeLogFileOpener opener;
    private final StreamingFileIndexer fileIndexer;
    private final LongSupplier clock;
    private final boolean ownsResources;

    private final List<IndexChangeListener> changeListeners = new CopyOnWriteArrayList<>();
    private final BlockingQueue<IndexTask> queue;
    private final ExecutorService workers;
    private final ExecutorService groupFileExecutor;
    private final ScheduledExecutorService scheduler;
    private final Thread dispatcher;
    private final CancellationToken shutdownToken = new CancellationToken();

    private final ConcurrentMap<String, ReentrantLock> fileLocks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> lastIndexTime = new ConcurrentHashMap<>();
    private final Map<String, PendingTask> debounceTimers = new HashMap<>();
    private final Map<String, String> trackedFiles = new ConcurrentHashMap<>();

    private volatile boolean closed;

    public LogIndexer(IndexerConfig config, LogIndex index, CursorStore cursorStore, EventBus eventBus,
            AccessLogParser parser) {
        this(config, index, cursorStore, eventBus, parser, System::currentTimeMillis, false);
    }

    LogIndexer(IndexerConfig config, LogIndex index, CursorStore cursorStore, EventBus eventBus,
            AccessLogParser parser, LongSupplier clock, boolean ownsResources) {
        this.config = config;
        this.index = index;
        this.cursorStore = cursorStore;
        this.parser = parser;
        this.clock = clock;
        this.ownsResources = ownsResources;
        this.trackers = new ProgressTrackerRegistry(eventBus);
        this.statusManager = new IndexingStatusManager(eventBus);
        this.opener = new SafeLogFileOpener(new LogPathWhitelist(config.getWhitelistDirs()), config.getMaxFileSizeBytes());
        this.fileIndexer = new StreamingFileIndexer(opener, parser, index, cursorStore, config.getBatchSize(),
                this::fireIndexChanged);

        int workerCount = Math.max(1, config.getIndexWorkers());
        this.queue = new ArrayBlockingQueue<>(Math.max(1, config.getQueueCapacity()));
        this.workers = Executors.newFixedThreadPool(workerCount,
                new ThreadFactoryBuilder().setNameFormat("log-indexer-%d").setDaemon(true).build());
        this.groupFileExecutor = Executors.newFixedThreadPool(workerCount,
                new ThreadFactoryBuilder().setNameFormat("log-indexer-group-%d").setDaemon(true).build());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("log-indexer-timer-%d").setDaemon(true).build());
        this.dispatcher = new Thread(this::dispatchLoop, "log-indexer-dispatcher");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
        logger.info("Log indexer started with {} workers, queue capacity {}", workerCount, config.getQueueCapacity());
    }

    /**
     * Opens the index and cursor store described by {@code config}; both are closed
     * with the indexer.
     */
    public static LogIndexer open(IndexerConfig config, EventBus eventBus) throws IOException, SQLException {
        Path indexDir = Paths.get(config.getIndexDir());
        LogIndex index = config.getShardCount() > 1
                ? ShardedLogIndex.open(indexDir, config.getShardCount())
                : LuceneLogIndex.open(indexDir);
        CursorStore cursorStore;
        try {
            cursorStore = new SqliteCursorStore(config.getCursorDbPath());
        } catch (SQLException e) {
            index.close();
            throw e;
        }
        AccessLogParser parser = new AccessLogParser(new SimpleUserAgentParser(), null, config.getParserWorkers());
        return new LogIndexer(config, index, cursorStore, eventBus, parser, System::currentTimeMillis, true);
    }

    public void addIndexChangeListener(IndexChangeListener listener) {
        changeListeners.add(listener);
    }

    public LogIndex getIndex() {
        return index;
    }

    public CursorStore getCursorStore() {
        return cursorStore;
    }

    public ProgressTrackerRegistry getProgressTrackers() {
        return trackers;
    }

    public IndexingStatusManager getStatusManager() {
        return statusManager;
    }

    // ---- queue ----

    /**
     * Starts tracking a file and queues it for indexing. New compressed files are
     * queued as a full rebuild of their group.
     */
    public CompletableFuture<Void> addLogPath(String logPath) throws FileIndexException {
        String path = absolute(logPath);
        opener.validate(path);
        String mainLogPath = LogFileGroups.getMainLogPath(path);
        String previous = trackedFiles.put(path, mainLogPath);
        if (previous == null) {
            logger.info("Tracking log file {} (group {})", path, mainLogPath);
        }

        boolean fullReindex = LogFileGroups.isCompressed(path);
        if (!fullReindex) {
            LogIndexCursor cursor = loadCursor(path);
            fullReindex = cursor.shouldFullReindex(modTime(path), StreamingFileIndexer.groupSize(mainLogPath));
        }
        return submit(new IndexTask(path, IndexTask.PRIORITY_NORMAL, fullReindex));
    }

    /**
     * Queues a task, debouncing it unless it has rebuild priority.
     */
    public CompletableFuture<Void> submit(IndexTask task) {
        if (closed) {
            task.getCompletion().completeExceptionally(new RejectedExecutionException("log indexer is closed"));
        } else if (task.isDebounced()) {
            debounce(task);
        } else {
            enqueue(task);
        }
        return task.getCompletion();
    }

    private void debounce(IndexTask task) {
        String path = task.getFilePath();
        long interval = config.getMinIndexIntervalMs();
        IndexTask next = task;
        synchronized (debounceTimers) {
            PendingTask pending = debounceTimers.remove(path);
            long delay;
            if (pending != null) {
                pending.timer.cancel(false);
                next = supersede(pending.task, task);
                delay = interval;
            } else {
                Long last = lastIndexTime.get(path);
                delay = last == null ? 0 : interval - (clock.getAsLong() - last);
            }
            if (delay > 0) {
                PendingTask scheduled = new PendingTask(next);
                scheduled.timer = scheduler.schedule(() -> fire(path, scheduled), delay, TimeUnit.MILLISECONDS);
                debounceTimers.put(path, scheduled);
                logger.debug("Debounced {} for {} ms", path, delay);
                return;
            }
        }
        enqueue(next);
    }

    /**
     * A newer submission replaces a pending one; the replaced task completes with it and
     * a pending full rebuild is never downgraded.
     */
    private static IndexTask supersede(IndexTask previous, IndexTask task) {
        IndexTask next = task;
        if (previous.isFullReindex() && !task.isFullReindex()) {
            next = new IndexTask(task.getFilePath(), task.getPriority(), true);
            next.getCompletion().whenComplete((v, e) -> complete(task, e));
        }
        next.getCompletion().whenComplete((v, e) -> complete(previous, e));
        return next;
    }

    private static void complete(IndexTask task, Throwable error) {
        if (error == null) {
            task.getCompletion().complete(null);
        } else {
            task.getCompletion().completeExceptionally(error);
        }
    }

    private void fire(String path, PendingTask pending) {
        synchronized (debounceTimers) {
            if (debounceTimers.get(path) == pending) {
                debounceTimers.remove(path);
            }
        }
        enqueue(pending.task);
    }

    private void enqueue(IndexTask task) {
        if (task.isDebounced()) {
            lastIndexTime.put(task.getFilePath(), clock.getAsLong());
        }
        try {
            if (!queue.offer(task, config.getSubmitTimeoutMs(), TimeUnit.MILLISECONDS)) {
                logger.warn("Index queue is full, dropping task for {}", task.getFilePath());
                task.getCompletion().completeExceptionally(
                        new RejectedExecutionException("index queue is full, dropped " + task.getFilePath()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.getCompletion().completeExceptionally(e);
        }
    }

    private void dispatchLoop() {
        while (!shutdownToken.isCancelled()) {
            IndexTask task;
            try {
                task = queue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                break;
            }
            if (task == null) {
                continue;
            }
            IndexTask current = task;
            try {
                workers.submit(() -> processTask(current));
            } catch (RejectedExecutionException e) {
                current.getCompletion().cancel(false);
            }
        }
        logger.info("Log indexer dispatcher stopped");
    }

    void processTask(IndexTask task) {
        String path = task.getFilePath();
        String lockKey = task.isFullReindex() ? LogFileGroups.getMainLogPath(path) : path;
        CancellationToken token = shutdownToken.child();
        ScheduledFuture<?> timeout = scheduler.schedule(
                () -> token.cancel("timed out after " + config.getTaskTimeoutMs() + " ms"),
                config.getTaskTimeoutMs(), TimeUnit.MILLISECONDS);
        ReentrantLock lock = fileLock(lockKey);
        lock.lock();
        try {
            if (token.isCancelled()) {
                logger.warn("Index task for {} cancelled before start: {}", path, token.getReason());
                task.getCompletion().cancel(false);
                return;
            }
            logger.info("Processing index task for {} (priority: {}, full reindex: {})", path, task.getPriority(),
                    task.isFullReindex());
            if (task.isFullReindex()) {
                indexGroup(LogFileGroups.getMainLogPath(path), token);
                task.getCompletion().complete(null);
            } else {
                CompletableFuture<Void> rebuild = indexIncremental(path, token);
                if (rebuild == null) {
                    task.getCompletion().complete(null);
                } else {
                    rebuild.whenComplete((v, e) -> complete(task, e));
                }
            }
        } catch (LogIndexException | IOException | RuntimeException e) {
            logger.error("Failed to index {}", path, e);
            task.getCompletion().completeExceptionally(e);
        } finally {
            timeout.cancel(false);
            lock.unlock();
        }
    }

    @VisibleForTesting
    int getPendingDebounceCount() {
        synchronized (debounceTimers) {
            return debounceTimers.size();
        }
    }

    // ---- indexing ----

    /**
     * Indexes what was appended to {@code path} since the last run, switching to a full
     * rebuild of the group when the file looks rotated or replaced.
     */
    public void indexLogFile(String path) throws LogIndexException, IOException {
        String absolute = absolute(path);
        ReentrantLock lock = fileLock(absolute);
        CompletableFuture<Void> rebuild;
        lock.lock();
        try {
            rebuild = indexIncremental(absolute, shutdownToken.child());
        } finally {
            lock.unlock();
        }
        if (rebuild != null) {
            awaitRebuild(LogFileGroups.getMainLogPath(absolute), rebuild);
        }
    }

    private static void awaitRebuild(String mainLogPath, CompletableFuture<Void> rebuild) throws GroupIndexException {
        try {
            rebuild.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GroupIndexException(mainLogPath, "interrupted waiting for rebuild of " + mainLogPath, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof GroupIndexException) {
                throw (GroupIndexException) e.getCause();
            }
            throw new GroupIndexException(mainLogPath, "rebuild of " + mainLogPath + " failed", e.getCause());
        }
    }

    /**
     * Rebuilds the whole group {@code path} belongs to.
     */
    public void indexLogFileFull(String path) throws GroupIndexException {
        String mainLogPath = LogFileGroups.getMainLogPath(absolute(path));
        ReentrantLock lock = fileLock(mainLogPath);
        lock.lock();
        try {
            indexGroup(mainLogPath, shutdownToken.child());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues a full rebuild of a group. The future completes once the group has been
     * indexed, exceptionally if the rebuild failed as a whole.
     */
    public CompletableFuture<Void> forceReindexFileGroup(String mainLogPath) {
        String main = absolute(mainLogPath);
        logger.info("Force reindexing log group {}", main);
        for (String file : LogFileGroups.findRelatedFiles(main)) {
            statusManager.setIndexing(file, true);
        }
        statusManager.updateIndexingStatus();
        CompletableFuture<Void> completion = submit(new IndexTask(main, IndexTask.PRIORITY_REBUILD, true));
        completion.whenComplete((v, e) -> {
            if (e != null) {
                for (String file : LogFileGroups.findRelatedFiles(main)) {
                    statusManager.setIndexing(file, false);
                }
                statusManager.updateIndexingStatus();
            }
        });
        return completion;
    }

    /**
     * Runs with the file lock held. Returns null when the file was handled inline, or the
     * queued group rebuild it was handed off to.
     */
    private CompletableFuture<Void> indexIncremental(String path, CancellationToken token)
            throws LogIndexException, IOException {
        String mainLogPath = LogFileGroups.getMainLogPath(path);
        trackedFiles.putIfAbsent(path, mainLogPath);
        statusManager.setIndexing(path, true);
        statusManager.updateIndexingStatus();
        try {
            opener.validate(path);
            LogIndexCursor cursor = loadCursor(path);
            long modTime = modTime(path);
            long fileSize = Files.size(Paths.get(path));
            long groupSize = StreamingFileIndexer.groupSize(mainLogPath);

            if (!cursor.needsIndexing(modTime, groupSize)) {
                logger.info("Skipping {}: log group unchanged since last index", path);
                return null;
            }
            if (cursor.shouldFullReindex(modTime, groupSize) || cursor.getLastPosition() > fileSize) {
                logger.info("{} was rotated or replaced, queueing rebuild of group {}", path, mainLogPath);
                return submit(new IndexTask(mainLogPath, IndexTask.PRIORITY_REBUILD, true));
            }
            logger.info("Incremental indexing of {} from position {}", path, cursor.getLastPosition());
            fileIndexer.indexFile(path, mainLogPath, cursor, cursor.getLastPosition(), null, token);
            return null;
        } finally {
            statusManager.setIndexing(path, false);
            statusManager.updateIndexingStatus();
        }
    }

    private void indexGroup(String mainLogPath, CancellationToken token) throws GroupIndexException {
        List<String> files = LogFileGroups.findRelatedFiles(mainLogPath);
        if (files.isEmpty()) {
            throw new GroupIndexException(mainLogPath, "no files found for log group " + mainLogPath, null);
        }
        logger.info("Full reindex of log group {} with {} files: {}", mainLogPath, files.size(), files);

        ProgressTracker tracker = trackers.createFresh(mainLogPath);
        for (String file : files) {
            boolean compressed = LogFileGroups.isCompressed(file);
            tracker.addFile(file, compressed);
            tracker.setFileEstimate(file, ProgressTracker.estimateFileLines(sizeOf(file), compressed));
            statusManager.setIndexing(file, true);
            trackedFiles.putIfAbsent(file, mainLogPath);
        }
        statusManager.updateIndexingStatus();

        try {
            try {
                IndexDeletes.deleteByTerm(index, IndexFields.FILE_PATH, mainLogPath);
            } catch (IOException e) {
                tracker.abort("failed to delete existing documents: " + e.getMessage());
                throw new GroupIndexException(mainLogPath, "failed to delete existing documents of " + mainLogPath, e);
            }
            fireIndexChanged();
            resetCursors(files, mainLogPath);

            List<Future<FileIndexStats>> futures = new ArrayList<>(files.size());
            for (String file : files) {
                futures.add(groupFileExecutor.submit(() -> indexGroupMember(file, mainLogPath, tracker, token)));
            }

            int failures = 0;
            long entries = 0;
            Throwable firstFailure = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    entries += futures.get(i).get().entriesIndexed;
                } catch (ExecutionException e) {
                    failures++;
                    if (firstFailure == null) {
                        firstFailure = e.getCause();
                    }
                    logger.error("Failed to index {} in group {}: {}", files.get(i), mainLogPath, e.getCause().getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel("interrupted");
                    tracker.abort("interrupted");
                    throw new GroupIndexException(mainLogPath, "interrupted while indexing " + mainLogPath, e);
                }
            }
            if (!tracker.isCompleted()) {
                tracker.abort("not all files of the group completed");
            }
            if (failures == files.size()) {
                throw new GroupIndexException(mainLogPath, "no file of log group " + mainLogPath + " could be indexed",
                        firstFailure);
            }
            logger.info("Completed full reindex of log group {}: {} entries from {} files ({} failed)", mainLogPath,
                    entries, files.size(), failures);
        } finally {
            trackers.remove(mainLogPath, tracker);
            for (String file : files) {
                statusManager.setIndexing(file, false);
            }
            statusManager.updateIndexingStatus();
        }
    }

    private FileIndexStats indexGroupMember(String file, String mainLogPath, ProgressTracker tracker,
            CancellationToken token) throws FileIndexException {
        // the group lock already covers the main log file
        ReentrantLock lock = file.equals(mainLogPath) ? null : fileLock(file);
        if (lock != null) {
            lock.lock();
        }
        try {
            tracker.startFile(file);
            LogIndexCursor cursor = loadCursorQuietly(file);
            cursor.setMainLogPath(mainLogPath);
            return fileIndexer.indexFile(file, mainLogPath, cursor, 0, tracker, token);
        } catch (RuntimeException e) {
            tracker.failFile(file, e.getMessage());
            throw e;
        } finally {
            if (lock != null) {
                lock.unlock();
            }
        }
    }

    private void resetCursors(List<String> files, String mainLogPath) {
        for (String file : files) {
            try {
                LogIndexCursor cursor = cursorStore.getLogIndex(file);
                cursor.reset();
                cursor.setMainLogPath(mainLogPath);
                cursorStore.save(cursor);
            } catch (SQLException e) {
                logger.warn("Failed to reset cursor for {}: {}", file, e.getMessage());
            }
        }
    }

    /**
     * Drops the index and every cursor position, then rebuilds all known groups: those of
     * stored cursors, tracked files and the configured main access log. Waits for every
     * group; a failed group does not stop the others.
     */
    public void rebuildIndex() throws IOException {
        logger.info("Starting index rebuild");
        Set<String> groups = new TreeSet<>(trackedFiles.values());
        List<LogIndexCursor> cursors = loadAllCursors();
        for (LogIndexCursor cursor : cursors) {
            groups.add(cursor.getMainLogPath() != null ? cursor.getMainLogPath()
                    : LogFileGroups.getMainLogPath(cursor.getPath()));
        }
        String mainAccessLog = config.getMainAccessLog();
        if (mainAccessLog != null && !mainAccessLog.isEmpty()) {
            String main = absolute(mainAccessLog);
            if (new LogPathWhitelist(config.getWhitelistDirs()).isAllowed(main)) {
                for (String file : LogFileGroups.findRelatedFiles(main)) {
                    groups.add(LogFileGroups.getMainLogPath(file));
                }
            } else {
                logger.warn("Main access log {} is outside the log whitelist", main);
            }
        }

        index.reset();
        for (LogIndexCursor cursor : cursors) {
            cursor.reset();
            saveQuietly(cursor);
        }
        trackers.clear();
        fireIndexReset();

        logger.info("Queueing rebuild of {} log groups", groups.size());
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (String group : groups) {
            futures.add(forceReindexFileGroup(group).handle((v, e) -> {
                if (e != null) {
                    logger.warn("Rebuild of log group {} failed: {}", group, e.getMessage());
                }
                return null;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        statusManager.updateIndexingStatus();
        logger.info("Index rebuild completed for {} log groups", groups.size());
    }

    // ---- deletion ----

    public long deleteLogGroupFromIndex(String mainLogPath) throws IOException {
        logger.info("Deleting all index entries for log group {}", mainLogPath);
        long deleted = IndexDeletes.deleteByTerm(index, IndexFields.FILE_PATH, mainLogPath);
        if (deleted > 0) {
            fireIndexChanged();
        }
        return deleted;
    }

    /**
     * Removes the documents read from one file along with its cursor; used when the file
     * disappears.
     */
    public long deleteFileIndex(String path) throws IOException {
        String absolute = absolute(path);
        long deleted = IndexDeletes.deleteByTerm(index, IndexFields.SOURCE_FILE, absolute);
        trackedFiles.remove(absolute);
        try {
            cursorStore.delete(absolute);
        } catch (SQLException e) {
            logger.warn("Failed to delete cursor for {}: {}", absolute, e.getMessage());
        }
        fireIndexChanged();
        logger.info("Deleted {} index entries for {}", deleted, absolute);
        return deleted;
    }

    public void deleteAllIndexes() throws IOException {
        logger.info("Deleting all index entries");
        index.reset();
        trackedFiles.clear();
        trackers.clear();
        try {
            cursorStore.deleteAll();
        } catch (SQLException e) {
            logger.warn("Failed to clear cursors: {}", e.getMessage());
        }
        fireIndexReset();
    }

    /**
     * Deletes index entries and cursors of tracked or persisted files that no longer exist.
     *
     * @return the removed paths
     */
    public List<String> cleanupOrphanedIndexes() throws IOException {
        Set<String> candidates = new TreeSet<>(trackedFiles.keySet());
        for (LogIndexCursor cursor : loadAllCursors()) {
            candidates.add(cursor.getPath());
        }
        List<String> orphaned = new ArrayList<>();
        for (String path : candidates) {
            if (!Files.exists(Paths.get(path))) {
                orphaned.add(path);
            }
        }
        if (orphaned.isEmpty()) {
            logger.info("No orphaned index entries found");
            return orphaned;
        }
        logger.info("Cleaning up {} orphaned files: {}", orphaned.size(), orphaned);
        for (String path : orphaned) {
            deleteFileIndex(path);
        }
        return orphaned;
    }

    // ---- status ----

    public List<String> getTrackedFiles() {
        return new ArrayList<>(new TreeSet<>(trackedFiles.keySet()));
    }

    public boolean isIndexing() {
        return statusManager.isIndexing();
    }

    public boolean isIndexing(String path) {
        return statusManager.isIndexing(absolute(path));
    }

    public IndexerStatus getIndexStatus() throws IOException {
        Map<String, LogIndexCursor> files = new TreeMap<>();
        for (String path : trackedFiles.keySet()) {
            files.put(path, loadCursorQuietly(path));
        }
        return new IndexerStatus(index.docCount(), getTrackedFiles(), new ArrayList<>(files.values()),
                statusManager.isIndexing());
    }

    public TimeRange getTimeRange() throws IOException {
        return timeRange(new MatchAllDocsQuery());
    }

    /**
     * Oldest and newest record of a group, or null when it has no documents.
     */
    public TimeRange getTimeRange(String logPath) throws IOException {
        if (logPath == null || logPath.isEmpty()) {
            return getTimeRange();
        }
        return timeRange(new TermQuery(new Term(IndexFields.FILE_PATH, logPath)));
    }

    private TimeRange timeRange(Query query) throws IOException {
        Set<String> fields = Set.of(IndexFields.TIMESTAMP);
        IndexSearchResult first = index.search(new IndexSearchRequest(query, 1, 0)
                .setSort(IndexFields.TIMESTAMP, false).setFields(fields));
        if (first.getHits().isEmpty()) {
            return null;
        }
        IndexSearchResult last = index.search(new IndexSearchRequest(query, 1, 0)
                .setSort(IndexFields.TIMESTAMP, true).setFields(fields));
        IndexHit oldest = first.getHits().get(0);
        IndexHit newest = last.getHits().isEmpty() ? oldest : last.getHits().get(0);
        return new TimeRange(oldest.getLong(IndexFields.TIMESTAMP), newest.getLong(IndexFields.TIMESTAMP));
    }

    // ---- helpers ----

    private void fireIndexChanged() {
        for (IndexChangeListener listener : changeListeners) {
            try {
                listener.onIndexChanged();
            } catch (RuntimeException e) {
                logger.warn("Index change listener failed: {}", e.getMessage());
            }
        }
    }

    private void fireIndexReset() {
        for (IndexChangeListener listener : changeListeners) {
            try {
                listener.onIndexReset();
            } catch (RuntimeException e) {
                logger.warn("Index change listener failed: {}", e.getMessage());
            }
        }
    }

    private ReentrantLock fileLock(String path) {
        return fileLocks.computeIfAbsent(path, p -> new ReentrantLock());
    }

    private LogIndexCursor loadCursor(String path) throws FileIndexException {
        try {
            return cursorStore.getLogIndex(path);
        } catch (SQLException e) {
            throw new FileIndexException(Reason.CURSOR_PERSIST_FAILURE, path, "failed to load cursor for " + path, e);
        }
    }

    private LogIndexCursor loadCursorQuietly(String path) {
        try {
            return cursorStore.getLogIndex(path);
        } catch (SQLException e) {
            logger.warn("Failed to load cursor for {}, starting fresh: {}", path, e.getMessage());
            return new LogIndexCursor(path);
        }
    }

    private List<LogIndexCursor> loadAllCursors() {
        try {
            return cursorStore.getAll();
        } catch (SQLException e) {
            logger.warn("Failed to load cursors: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private void saveQuietly(LogIndexCursor cursor) {
        try {
            cursorStore.save(cursor);
        } catch (SQLException e) {
            logger.warn("Failed to save cursor for {}: {}", cursor.getPath(), e.getMessage());
        }
    }

    private static long modTime(String path) throws FileIndexException {
        try {
            return Files.getLastModifiedTime(Paths.get(path)).toMillis();
        } catch (IOException e) {
            throw new FileIndexException(Reason.FILE_ACCESS_DENIED, path, "unable to stat " + path, e);
        }
    }

    private static long sizeOf(String path) {
        try {
            return Files.size(Paths.get(path));
        } catch (IOException e) {
            logger.debug("Unable to size {}: {}", path, e.getMessage());
            return 0;
        }
    }

    private static String absolute(String path) {
        return Paths.get(path).toAbsolutePath().normalize().toString();
    }

    /**
     * Stops accepting work, cancels running tasks at their next line boundary, waits for
     * the workers and closes owned resources, the index last.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        shutdownToken.cancel("log indexer closing");
        dispatcher.interrupt();

        List<IndexTask> abandoned = new ArrayList<>();
        synchronized (debounceTimers) {
            for (PendingTask pending : debounceTimers.values()) {
                pending.timer.cancel(false);
                abandoned.add(pending.task);
            }
            debounceTimers.clear();
        }
        queue.drainTo(abandoned);
        for (IndexTask task : abandoned) {
            task.getCompletion().cancel(false);
        }

        scheduler.shutdownNow();
        workers.shutdown();
        groupFileExecutor.shutdown();
        try {
            if (!workers.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warn("Index workers did not terminate gracefully");
                workers.shutdownNow();
            }
            groupFileExecutor.awaitTermination(10, TimeUnit.SECONDS);
            dispatcher.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            logger.warn("Interrupted while stopping log indexer");
            workers.shutdownNow();
            groupFileExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (ownsResources) {
            parser.close();
            try {
                cursorStore.close();
            } finally {
                index.close();
            }
        }
        logger.info("Log indexer closed");
    }

    private static class PendingTask {
        final IndexTask task;
        ScheduledFuture<?> timer;

        PendingTask(IndexTask task) {
            this.task = task;
        }
    }
}
