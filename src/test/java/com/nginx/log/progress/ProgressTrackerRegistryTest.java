package com.nginx.log.progress;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.nginx.log.event.EventBus;

public class ProgressTrackerRegistryTest {

    @Test
    public void testGetOrCreateReturnsSameTracker() {
        ProgressTrackerRegistry registry = new ProgressTrackerRegistry(new EventBus());

        ProgressTracker first = registry.getOrCreate("/var/log/nginx/access.log");
        assertSame(first, registry.getOrCreate("/var/log/nginx/access.log"));
        assertSame(first, registry.get("/var/log/nginx/access.log"));
        assertNull(registry.get("/var/log/nginx/other.log"));
    }

    @Test
    public void testStaleRemovalKeepsFreshTracker() {
        ProgressTrackerRegistry registry = new ProgressTrackerRegistry(new EventBus());
        ProgressTracker stale = registry.getOrCreate("/var/log/nginx/access.log");
        ProgressTracker fresh = registry.createFresh("/var/log/nginx/access.log");

        registry.remove("/var/log/nginx/access.log", stale);
        assertSame(fresh, registry.get("/var/log/nginx/access.log"));

        registry.remove("/var/log/nginx/access.log", fresh);
        assertEquals(0, registry.size());
    }

    @Test
    public void testClear() {
        ProgressTrackerRegistry registry = new ProgressTrackerRegistry(new EventBus());
        registry.getOrCreate("a");
        registry.getOrCreate("b");
        registry.clear();
        assertEquals(0, registry.size());
    }
}
