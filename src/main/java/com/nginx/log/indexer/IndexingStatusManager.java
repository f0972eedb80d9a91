package com.nginx.log.indexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nginx.log.event.EventBus;
import com.nginx.log.event.EventType;
import com.nginx.log.event.ProcessingStatusData;

/**
 * Tracks which files are being indexed and publishes a {@code processing_status} event
 * whenever the global "anything indexing" flag flips.
 */
public class IndexingStatusManager {

    static final Logger logger = LoggerFactory.getLogger(IndexingStatusManager.class);

    private final EventBus eventBus;
    private final Set<String> indexingFiles = ConcurrentHashMap.newKeySet();
    private boolean lastPublished;

    public IndexingStatusManager(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public void setIndexing(String path, boolean indexing) {
        if (indexing) {
            indexingFiles.add(path);
        } else {
            indexingFiles.remove(path);
        }
    }

    public boolean isIndexing() {
        return !indexingFiles.isEmpty();
    }

    public boolean isIndexing(String path) {
        return indexingFiles.contains(path);
    }

    public List<String> getIndexingFiles() {
        return new ArrayList<>(indexingFiles);
    }

    /**
     * Publishes the global flag if it changed since the last call.
     */
    public synchronized void updateIndexingStatus() {
        boolean indexing = isIndexing();
        if (indexing == lastPublished) {
            return;
        }
        lastPublished = indexing;
        logger.info("Log indexing {}", indexing ? "started" : "finished");
        eventBus.publish(EventType.PROCESSING_STATUS, new ProcessingStatusData(indexing));
    }

    public synchronized void clear() {
        indexingFiles.clear();
        updateIndexingStatus();
    }
}
