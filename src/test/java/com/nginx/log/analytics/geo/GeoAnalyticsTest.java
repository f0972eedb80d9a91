package com.nginx.log.analytics.geo;

import static com.nginx.log.index.TestEntries.entry;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.nginx.log.analytics.DashboardQueryRequest;
import com.nginx.log.files.LogPathWhitelist;
import com.nginx.log.index.LuceneLogIndex;
import com.nginx.log.index.TestEntries;
import com.nginx.log.parser.model.AccessLogEntry;

public class GeoAnalyticsTest {

    private static final String LOG = "/var/log/nginx/access.log";

    private LuceneLogIndex index;
    private GeoAnalytics geo;

    @BeforeEach
    public void setUp() throws Exception {
        index = LuceneLogIndex.inMemory();
        TestEntries.indexAll(index, LOG,
                located(1, "CN", "北京", "北京"),
                located(2, "CN", "广东", "深圳"),
                located(3, "CN", "广东", "深圳"),
                located(4, "HK", "", ""),
                located(5, "TW", "", ""),
                located(6, "US", "", ""),
                located(7, "", "", ""));
        geo = new GeoAnalytics(index);
    }

    @AfterEach
    public void tearDown() throws Exception {
        index.close();
    }

    private static AccessLogEntry located(int i, String region, String province, String city) {
        AccessLogEntry entry = entry(1000 + i, "10.0.0." + i, "/", 200);
        entry.setRegionCode(region);
        entry.setProvince(province);
        entry.setCity(city);
        return entry;
    }

    @Test
    public void testWorldMap() throws Exception {
        List<WorldMapData> map = geo.getWorldMap(new DashboardQueryRequest());

        assertEquals(2, map.size());
        assertEquals("CN", map.get(0).getRegionCode());
        assertEquals(5, map.get(0).getValue());
        assertEquals(5 * 100.0 / 7, map.get(0).getPercent(), 0.0001);
        assertEquals("US", map.get(1).getRegionCode());
        assertEquals(100.0 / 7, map.get(1).getPercent(), 0.0001);
    }

    @Test
    public void testChinaMap() throws Exception {
        List<ChinaMapData> map = geo.getChinaMap(new DashboardQueryRequest());

        assertEquals(4, map.size());
        ChinaMapData guangdong = map.get(0);
        assertEquals("广东", guangdong.getName());
        assertEquals(2, guangdong.getValue());
        assertEquals(40.0, guangdong.getPercent(), 0.0001);
        assertEquals(1, guangdong.getCities().size());
        assertEquals("深圳", guangdong.getCities().get(0).getName());
        assertEquals(100.0, guangdong.getCities().get(0).getPercent(), 0.0001);

        ChinaMapData hongKong = find(map, "香港");
        assertEquals(1, hongKong.getValue());
        assertEquals("香港", hongKong.getCities().get(0).getName());
        assertEquals("台北", find(map, "台湾").getCities().get(0).getName());
        assertEquals("北京", find(map, "北京").getCities().get(0).getName());
    }

    @Test
    public void testGeoStats() throws Exception {
        List<GeoStats> stats = geo.getGeoStats(new DashboardQueryRequest(), 0);

        assertEquals(6, stats.size());
        assertEquals("CN", stats.get(0).getRegionCode());
        assertEquals("广东", stats.get(0).getProvince());
        assertEquals(2, stats.get(0).getCount());
        assertTrue(stats.stream().anyMatch(s -> GeoAnalytics.UNKNOWN_REGION.equals(s.getRegionCode())));

        assertEquals(2, geo.getGeoStats(new DashboardQueryRequest(), 2).size());
    }

    @Test
    public void testLogPathFilterAndWhitelist() throws Exception {
        assertTrue(geo.getWorldMap(new DashboardQueryRequest(0, 0, "/var/log/nginx/other.log")).isEmpty());
        assertEquals(2, geo.getWorldMap(new DashboardQueryRequest(0, 0, LOG)).size());

        GeoAnalytics restricted = new GeoAnalytics(index, new LogPathWhitelist(List.of("/srv/logs")));
        assertThrows(IllegalArgumentException.class,
                () -> restricted.getWorldMap(new DashboardQueryRequest(0, 0, LOG)));
    }

    @Test
    public void testWorldMapRegion() {
        assertEquals("CN", GeoAnalytics.worldMapRegion("HK"));
        assertEquals("CN", GeoAnalytics.worldMapRegion("MO"));
        assertEquals("CN", GeoAnalytics.worldMapRegion("TW"));
        assertEquals("JP", GeoAnalytics.worldMapRegion("JP"));
    }

    private static ChinaMapData find(List<ChinaMapData> map, String name) {
        return map.stream().filter(d -> d.getName().equals(name)).findFirst().orElseThrow();
    }
}
