package com.nginx.log.analytics.geo;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause.Occur;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.nginx.log.analytics.DashboardQueryRequest;
import com.nginx.log.files.LogPathWhitelist;
import com.nginx.log.index.IndexFields;
import com.nginx.log.index.IndexHit;
import com.nginx.log.index.LogIndex;
import com.nginx.log.search.LogQueryBuilder;

/**
 * Request counts by region for the world map, by province and city for the China map,
 * and as a flat region list.
 */
public class GeoAnalytics {

    static final Logger logger = LoggerFactory.getLogger(GeoAnalytics.class);

    public static final String UNKNOWN_REGION = "UNKNOWN";

    static final Set<String> CHINESE_REGIONS = Set.of("CN", "HK", "MO", "TW");
    static final int PAGE_SIZE = 10000;

    private static final Set<String> GEO_FIELDS = Set.of(IndexFields.REGION_CODE, IndexFields.PROVINCE,
            IndexFields.CITY);

    private final LogIndex index;
    private final LogPathWhitelist whitelist;
    private final LogQueryBuilder queryBuilder = new LogQueryBuilder();

    public GeoAnalytics(LogIndex index) {
        this(index, LogPathWhitelist.allowAll());
    }

    public GeoAnalytics(LogIndex index, LogPathWhitelist whitelist) {
        this.index = index;
        this.whitelist = whitelist;
    }

    /**
     * Hong Kong, Macao and Taiwan are counted under CN. Requests without a region are left
     * off the map but still count towards the percentages.
     */
    public List<WorldMapData> getWorldMap(DashboardQueryRequest request) throws IOException {
        Map<String, Long> counts = new HashMap<>();
        long[] total = new long[1];
        index.scan(baseQuery(request), Set.of(IndexFields.REGION_CODE), PAGE_SIZE, hit -> {
            total[0]++;
            String region = regionCode(hit);
            if (UNKNOWN_REGION.equals(region)) {
                return;
            }
            counts.merge(worldMapRegion(region), 1L, Long::sum);
        });

        List<WorldMapData> result = new ArrayList<>(counts.size());
        counts.forEach((region, count) -> result.add(new WorldMapData(region, count, percent(count, total[0]))));
        result.sort(Comparator.comparingLong(WorldMapData::getValue).reversed()
                .thenComparing(WorldMapData::getRegionCode));
        logger.debug("World map for {}: {} regions over {} requests", request, result.size(), total[0]);
        return result;
    }

    /**
     * Provinces of mainland China plus the special regions, each with its cities.
     */
    public List<ChinaMapData> getChinaMap(DashboardQueryRequest request) throws IOException {
        BooleanQuery.Builder regions = new BooleanQuery.Builder();
        for (String region : CHINESE_REGIONS) {
            regions.add(new TermQuery(new Term(IndexFields.REGION_CODE, region)), Occur.SHOULD);
        }
        Query query = new BooleanQuery.Builder()
                .add(baseQuery(request), Occur.FILTER)
                .add(regions.build(), Occur.FILTER)
                .build();

        Map<String, ProvinceCount> provinces = new LinkedHashMap<>();
        long[] total = new long[1];
        index.scan(query, GEO_FIELDS, PAGE_SIZE, hit -> {
            String region = hit.getString(IndexFields.REGION_CODE);
            String province = value(hit, IndexFields.PROVINCE);
            String city = value(hit, IndexFields.CITY);
            switch (region) {
            case "HK":
                province = ProvinceNames.HONG_KONG;
                city = city.isEmpty() ? "香港" : city;
                break;
            case "MO":
                province = ProvinceNames.MACAO;
                city = city.isEmpty() ? "澳门" : city;
                break;
            case "TW":
                province = ProvinceNames.TAIWAN;
                city = city.isEmpty() ? "台北" : city;
                break;
            default:
                province = province.isEmpty() ? ProvinceNames.UNKNOWN : ProvinceNames.normalize(province);
            }
            ProvinceCount count = provinces.computeIfAbsent(province, p -> new ProvinceCount());
            count.requests++;
            if (!city.isEmpty() && !city.equals(province)) {
                count.cities.merge(city, 1L, Long::sum);
            }
            total[0]++;
        });

        List<ChinaMapData> result = new ArrayList<>(provinces.size());
        provinces.forEach((province, count) -> result.add(new ChinaMapData(ProvinceNames.shortName(province),
                count.requests, percent(count.requests, total[0]), count.cityData())));
        result.sort(Comparator.comparingLong(ChinaMapData::getValue).reversed()
                .thenComparing(ChinaMapData::getName));
        return result;
    }

    /**
     * Counts keyed by region, or by region and province for Chinese regions, busiest
     * first. {@code limit <= 0} returns every key.
     */
    public List<GeoStats> getGeoStats(DashboardQueryRequest request, int limit) throws IOException {
        Map<String, GeoCount> counts = new LinkedHashMap<>();
        long[] total = new long[1];
        index.scan(baseQuery(request), GEO_FIELDS, PAGE_SIZE, hit -> {
            String region = regionCode(hit);
            String province = value(hit, IndexFields.PROVINCE);
            String key = CHINESE_REGIONS.contains(region) && !province.isEmpty() ? region + "-" + province : region;
            counts.computeIfAbsent(key, k -> new GeoCount(region, province, value(hit, IndexFields.CITY))).count++;
            total[0]++;
        });

        List<GeoStats> result = new ArrayList<>(counts.size());
        for (GeoCount count : counts.values()) {
            result.add(new GeoStats(count.region, count.province, count.city, count.count,
                    percent(count.count, total[0])));
        }
        result.sort(Comparator.comparingLong(GeoStats::getCount).reversed());
        if (limit > 0 && result.size() > limit) {
            return new ArrayList<>(result.subList(0, limit));
        }
        return result;
    }

    static String worldMapRegion(String region) {
        return "HK".equals(region) || "MO".equals(region) || "TW".equals(region) ? "CN" : region;
    }

    private Query baseQuery(DashboardQueryRequest request) {
        String logPath = request.getLogPath();
        if (!Strings.isNullOrEmpty(logPath) && !whitelist.isAllowed(logPath)) {
            throw new IllegalArgumentException("log path " + logPath + " is not under the whitelist");
        }
        return queryBuilder.build(request.toQueryRequest());
    }

    private static String regionCode(IndexHit hit) {
        String region = value(hit, IndexFields.REGION_CODE);
        return region.isEmpty() ? UNKNOWN_REGION : region;
    }

    /**
     * Stored value, with the placeholder {@code 0} some lookups emit treated as missing.
     */
    private static String value(IndexHit hit, String field) {
        String value = hit.getString(field);
        return "0".equals(value) ? "" : value;
    }

    private static double percent(long count, long total) {
        return total == 0 ? 0.0 : count * 100.0 / total;
    }

    private static class ProvinceCount {
        long requests;
        final Map<String, Long> cities = new HashMap<>();

        List<CityData> cityData() {
            List<CityData> result = new ArrayList<>(cities.size());
            cities.forEach((city, count) -> result.add(new CityData(city, count, percent(count, requests))));
            result.sort(Comparator.comparingLong(CityData::getValue).reversed().thenComparing(CityData::getName));
            return result;
        }
    }

    private static class GeoCount {
        final String region;
        final String province;
        final String city;
        long count;

        GeoCount(String region, String province, String city) {
            this.region = region;
            this.province = province;
            this.city = city;
        }
    }
}
