package com.nginx.log.progress;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nginx.log.event.EventBus;

/**
 * Trackers by main log path.
 */
public class ProgressTrackerRegistry {

    static final Logger logger = LoggerFactory.getLogger(ProgressTrackerRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ProgressTracker> trackers = new HashMap<>();
    private final EventBus eventBus;

    public ProgressTrackerRegistry(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public ProgressTracker getOrCreate(String logGroupPath) {
        lock.writeLock().lock();
        try {
            return trackers.computeIfAbsent(logGroupPath, path -> new ProgressTracker(path, eventBus));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces any tracker left from an earlier run of the same group.
     */
    public ProgressTracker createFresh(String logGroupPath) {
        lock.writeLock().lock();
        try {
            ProgressTracker tracker = new ProgressTracker(logGroupPath, eventBus);
            trackers.put(logGroupPath, tracker);
            return tracker;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ProgressTracker get(String logGroupPath) {
        lock.readLock().lock();
        try {
            return trackers.get(logGroupPath);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes the tracker only if it is still the registered one.
     */
    public void remove(String logGroupPath, ProgressTracker tracker) {
        lock.writeLock().lock();
        try {
            if (trackers.get(logGroupPath) == tracker) {
                trackers.remove(logGroupPath);
                logger.debug("Removed progress tracker for {}", logGroupPath);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(String logGroupPath) {
        lock.writeLock().lock();
        try {
            trackers.remove(logGroupPath);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            trackers.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return trackers.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
