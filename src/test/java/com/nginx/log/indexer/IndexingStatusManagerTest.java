package com.nginx.log.indexer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.Test;

import com.nginx.log.event.EventBus;
import com.nginx.log.event.EventType;
import com.nginx.log.event.ProcessingStatusData;

public class IndexingStatusManagerTest {

    @Test
    public void testPublishesOnlyOnChange() {
        EventBus bus = new EventBus();
        List<Boolean> published = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.PROCESSING_STATUS,
                e -> published.add(e.getData(ProcessingStatusData.class).isNginxLogIndexing()));
        IndexingStatusManager manager = new IndexingStatusManager(bus);

        manager.updateIndexingStatus();
        assertTrue(published.isEmpty());

        manager.setIndexing("/var/log/nginx/access.log", true);
        manager.setIndexing("/var/log/nginx/access.log.1", true);
        manager.updateIndexingStatus();
        manager.updateIndexingStatus();
        assertEquals(List.of(true), published);
        assertTrue(manager.isIndexing("/var/log/nginx/access.log.1"));
        assertEquals(2, manager.getIndexingFiles().size());

        manager.setIndexing("/var/log/nginx/access.log", false);
        manager.updateIndexingStatus();
        assertEquals(List.of(true), published);
        assertTrue(manager.isIndexing());

        manager.clear();
        assertEquals(List.of(true, false), published);
        assertFalse(manager.isIndexing());
    }
}
