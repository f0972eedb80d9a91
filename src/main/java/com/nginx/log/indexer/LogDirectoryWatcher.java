package com.nginx.log.indexer;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nginx.log.error.FileIndexException;
import com.nginx.log.files.LogFileGroups;

/**
 * Watches the directories of tracked log files. Writes to a tracked file queue a
 * debounced incremental task, a new compressed rotation of a tracked group is added
 * for a full rebuild, and a deleted file has its documents removed.
 */
public class LogDirectoryWatcher implements Closeable {

    static final Logger logger = LoggerFactory.getLogger(LogDirectoryWatcher.class);

    private final LogIndexer indexer;
    private final WatchService watchService;
    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();
    private final Thread thread;
    private volatile boolean running;

    public LogDirectoryWatcher(LogIndexer indexer) throws IOException {
        this.indexer = indexer;
        this.watchService = FileSystems.getDefault().newWatchService();
        this.thread = new Thread(this::run, "log-directory-watcher");
        this.thread.setDaemon(true);
    }

    public void watch(Path directory) throws IOException {
        Path dir = directory.toAbsolutePath().normalize();
        if (directories.containsValue(dir)) {
            return;
        }
        WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
        directories.put(key, dir);
        logger.info("Watching {}", dir);
    }

    /**
     * Registers the directory of every file the indexer tracks.
     */
    public void watchTrackedFiles() throws IOException {
        for (String file : indexer.getTrackedFiles()) {
            Path parent = Paths.get(file).getParent();
            if (parent != null) {
                watch(parent);
            }
        }
    }

    public void start() {
        running = true;
        thread.start();
    }

    private void run() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException | ClosedWatchServiceException e) {
                break;
            }
            Path dir = directories.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == OVERFLOW) {
                        logger.warn("Watch events overflowed for {}", dir);
                        continue;
                    }
                    handleEvent(event.kind(), dir.resolve((Path) event.context()));
                }
            }
            if (!key.reset()) {
                directories.remove(key);
                logger.warn("Stopped watching {}", dir);
            }
        }
        logger.info("Log directory watcher stopped");
    }

    void handleEvent(WatchEvent.Kind<?> kind, Path file) {
        String path = file.toAbsolutePath().normalize().toString();
        boolean tracked = indexer.getTrackedFiles().contains(path);
        try {
            if (kind == ENTRY_DELETE) {
                if (tracked) {
                    logger.info("{} was deleted, removing its documents", path);
                    indexer.deleteFileIndex(path);
                }
            } else if (tracked && !LogFileGroups.isCompressed(path)) {
                indexer.submit(new IndexTask(path, IndexTask.PRIORITY_NORMAL, false));
            } else if (kind == ENTRY_CREATE && LogFileGroups.isCompressed(path) && isTrackedGroup(path)) {
                logger.info("New compressed log {} detected", path);
                indexer.addLogPath(path);
            }
        } catch (FileIndexException e) {
            logger.warn("Unable to add {}: {}", path, e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to handle {} event for {}", kind.name(), path, e);
        }
    }

    private boolean isTrackedGroup(String path) {
        String mainLogPath = LogFileGroups.getMainLogPath(path);
        return indexer.getTrackedFiles().stream().anyMatch(f -> LogFileGroups.getMainLogPath(f).equals(mainLogPath));
    }

    @Override
    public void close() throws IOException {
        running = false;
        watchService.close();
        thread.interrupt();
    }
}
