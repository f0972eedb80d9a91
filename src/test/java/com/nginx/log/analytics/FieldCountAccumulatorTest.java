package com.nginx.log.analytics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class FieldCountAccumulatorTest {

    @Test
    public void testDistribution() {
        FieldCountAccumulator acc = new FieldCountAccumulator();
        acc.accumulate("Chrome");
        acc.accumulate("Firefox");
        acc.accumulate("Chrome");
        acc.accumulate("");
        acc.accumulate(null);
        acc.accumulate("Chrome");

        List<DistributionStats> dist = acc.getDistribution();
        assertEquals(3, dist.size());
        assertEquals("Chrome", dist.get(0).getName());
        assertEquals(3, dist.get(0).getCount());
        assertEquals(50.0, dist.get(0).getPercent(), 0.0001);
        assertEquals(FieldCountAccumulator.UNKNOWN, dist.get(1).getName());
        assertEquals(2, dist.get(1).getCount());
        assertEquals("Firefox", dist.get(2).getName());
        assertEquals(6, acc.getTotal());
    }

    @Test
    public void testTopUrlsLimit() {
        FieldCountAccumulator acc = new FieldCountAccumulator();
        for (int i = 0; i < 15; i++) {
            for (int j = 0; j <= i; j++) {
                acc.accumulate("/page/" + i);
            }
        }

        List<UrlStats> top = acc.getTopUrls(10);
        assertEquals(10, top.size());
        assertEquals("/page/14", top.get(0).getUrl());
        assertEquals(15, top.get(0).getVisits());
        assertEquals("/page/5", top.get(9).getUrl());
        assertEquals(15 * 100.0 / 120, top.get(0).getPercent(), 0.0001);
    }

    @Test
    public void testTopUrlsSkipEmptyPaths() {
        FieldCountAccumulator acc = new FieldCountAccumulator();
        acc.accumulate("");
        acc.accumulate("");
        acc.accumulate("");
        acc.accumulate(null);
        acc.accumulate("/index.html");
        acc.accumulate("/index.html");
        acc.accumulate("/about");
        acc.accumulate("/about");

        List<UrlStats> top = acc.getTopUrls(10);
        assertEquals(2, top.size());
        assertEquals("/about", top.get(0).getUrl());
        assertEquals("/index.html", top.get(1).getUrl());
        assertEquals(25.0, top.get(0).getPercent(), 0.0001);
        for (UrlStats url : top) {
            assertNotEquals(FieldCountAccumulator.UNKNOWN, url.getUrl());
        }
        assertEquals(8, acc.getTotal());
    }

    @Test
    public void testEmpty() {
        FieldCountAccumulator acc = new FieldCountAccumulator();

        assertTrue(acc.getDistribution().isEmpty());
        assertEquals(0.0, acc.percent(0));
    }
}
