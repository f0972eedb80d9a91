package com.nginx.log.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indexer, cache and search settings. Defaults are overlaid from a properties source.
 */
public class IndexerConfig {

    static final Logger logger = LoggerFactory.getLogger(IndexerConfig.class);

    public static final String DEFAULT_RESOURCE = "nginx-log-indexer.properties";

    private static final int CPU_COUNT = Runtime.getRuntime().availableProcessors();

    private String indexDir = "./data/log-index";
    private int shardCount = 1;
    private int batchSize = 1000;
    private int queueCapacity = 1000;
    private long minIndexIntervalMs = 30_000L;
    private long taskTimeoutMs = 10 * 60 * 1000L;
    private long submitTimeoutMs = 30_000L;
    private long maxFileSizeBytes = 20L * 1024 * 1024 * 1024;
    private int indexWorkers = CPU_COUNT;
    private List<String> whitelistDirs = new ArrayList<>();
    private String mainAccessLog = "";
    private String cursorDbPath = "./data/log-cursors.db";
    private long resultCacheMaxBytes = 128L * 1024 * 1024;
    private long statsCacheMaxBytes = 64L * 1024 * 1024;
    private long statsMaxAgeMs = 5 * 60 * 1000L;
    private int searchMaxSize = 10_000_000;
    private int searchDefaultSize = 50_000;
    private long searchTimeoutMs = 30_000L;
    private double searchRateLimitPerSecond = 0;
    private int circuitFailureThreshold = 5;
    private long circuitOpenMs = 30_000L;
    private int parserWorkers = CPU_COUNT;

    /**
     * Loads the classpath defaults resource if present.
     */
    public static IndexerConfig load() {
        IndexerConfig config = new IndexerConfig();
        try (InputStream in = IndexerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                config.loadFromProperties(props);
            }
        } catch (IOException e) {
            logger.warn("Unable to read {}, using defaults: {}", DEFAULT_RESOURCE, e.getMessage());
        }
        return config;
    }

    public static IndexerConfig load(String configFile) throws IOException {
        IndexerConfig config = load();
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configFile)) {
            props.load(in);
        }
        config.loadFromProperties(props);
        return config;
    }

    /**
     * Overlay values from properties. Missing or blank keys keep the current value.
     */
    public void loadFromProperties(Properties props) {
        indexDir = getString(props, "index.dir", indexDir);
        shardCount = getInt(props, "index.shards", shardCount);
        batchSize = getInt(props, "index.batch.size", batchSize);
        queueCapacity = getInt(props, "index.queue.capacity", queueCapacity);
        minIndexIntervalMs = getLong(props, "index.min.interval.ms", minIndexIntervalMs);
        taskTimeoutMs = getLong(props, "index.task.timeout.ms", taskTimeoutMs);
        submitTimeoutMs = getLong(props, "index.submit.timeout.ms", submitTimeoutMs);
        maxFileSizeBytes = getLong(props, "index.max.file.size.bytes", maxFileSizeBytes);
        indexWorkers = getInt(props, "index.workers", indexWorkers);
        mainAccessLog = getString(props, "main.access.log", mainAccessLog);
        cursorDbPath = getString(props, "cursor.db.path", cursorDbPath);
        resultCacheMaxBytes = getLong(props, "cache.result.max.bytes", resultCacheMaxBytes);
        statsCacheMaxBytes = getLong(props, "cache.stats.max.bytes", statsCacheMaxBytes);
        statsMaxAgeMs = getLong(props, "cache.stats.max.age.ms", statsMaxAgeMs);
        searchMaxSize = getInt(props, "search.max.size", searchMaxSize);
        searchDefaultSize = getInt(props, "search.default.size", searchDefaultSize);
        searchTimeoutMs = getLong(props, "search.timeout.ms", searchTimeoutMs);
        searchRateLimitPerSecond = getDouble(props, "search.rate.limit.per.second", searchRateLimitPerSecond);
        circuitFailureThreshold = getInt(props, "search.circuit.failure.threshold", circuitFailureThreshold);
        circuitOpenMs = getLong(props, "search.circuit.open.ms", circuitOpenMs);
        parserWorkers = getInt(props, "parser.workers", parserWorkers);

        String dirs = props.getProperty("whitelist.dirs");
        if (dirs != null && !dirs.trim().isEmpty()) {
            whitelistDirs.clear();
            addDirs(dirs);
        }
    }

    private void addDirs(String dirList) {
        for (String dir : dirList.split(",")) {
            String trimmed = dir.trim();
            if (!trimmed.isEmpty()) {
                whitelistDirs.add(trimmed);
            }
        }
    }

    private static String getString(Properties props, String key, String current) {
        String value = props.getProperty(key);
        return value == null || value.trim().isEmpty() ? current : value.trim();
    }

    private static int getInt(Properties props, String key, int current) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return current;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value for {}: {}", key, value);
            return current;
        }
    }

    private static long getLong(Properties props, String key, long current) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return current;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value for {}: {}", key, value);
            return current;
        }
    }

    private static double getDouble(Properties props, String key, double current) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return current;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value for {}: {}", key, value);
            return current;
        }
    }

    public String getIndexDir() {
        return indexDir;
    }

    public void setIndexDir(String indexDir) {
        this.indexDir = indexDir;
    }

    public int getShardCount() {
        return shardCount;
    }

    public void setShardCount(int shardCount) {
        this.shardCount = shardCount;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getMinIndexIntervalMs() {
        return minIndexIntervalMs;
    }

    public void setMinIndexIntervalMs(long minIndexIntervalMs) {
        this.minIndexIntervalMs = minIndexIntervalMs;
    }

    public long getTaskTimeoutMs() {
        return taskTimeoutMs;
    }

    public void setTaskTimeoutMs(long taskTimeoutMs) {
        this.taskTimeoutMs = taskTimeoutMs;
    }

    public long getSubmitTimeoutMs() {
        return submitTimeoutMs;
    }

    public void setSubmitTimeoutMs(long submitTimeoutMs) {
        this.submitTimeoutMs = submitTimeoutMs;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public int getIndexWorkers() {
        return indexWorkers;
    }

    public void setIndexWorkers(int indexWorkers) {
        this.indexWorkers = indexWorkers;
    }

    public List<String> getWhitelistDirs() {
        return new ArrayList<>(whitelistDirs);
    }

    public void setWhitelistDirs(List<String> whitelistDirs) {
        this.whitelistDirs = new ArrayList<>(whitelistDirs);
    }

    public String getMainAccessLog() {
        return mainAccessLog;
    }

    public void setMainAccessLog(String mainAccessLog) {
        this.mainAccessLog = mainAccessLog;
    }

    public String getCursorDbPath() {
        return cursorDbPath;
    }

    public void setCursorDbPath(String cursorDbPath) {
        this.cursorDbPath = cursorDbPath;
    }

    public long getResultCacheMaxBytes() {
        return resultCacheMaxBytes;
    }

    public void setResultCacheMaxBytes(long resultCacheMaxBytes) {
        this.resultCacheMaxBytes = resultCacheMaxBytes;
    }

    public long getStatsCacheMaxBytes() {
        return statsCacheMaxBytes;
    }

    public void setStatsCacheMaxBytes(long statsCacheMaxBytes) {
        this.statsCacheMaxBytes = statsCacheMaxBytes;
    }

    public long getStatsMaxAgeMs() {
        return statsMaxAgeMs;
    }

    public void setStatsMaxAgeMs(long statsMaxAgeMs) {
        this.statsMaxAgeMs = statsMaxAgeMs;
    }

    public int getSearchMaxSize() {
        return searchMaxSize;
    }

    public void setSearchMaxSize(int searchMaxSize) {
        this.searchMaxSize = searchMaxSize;
    }

    public int getSearchDefaultSize() {
        return searchDefaultSize;
    }

    public void setSearchDefaultSize(int searchDefaultSize) {
        this.searchDefaultSize = searchDefaultSize;
    }

    public long getSearchTimeoutMs() {
        return searchTimeoutMs;
    }

    public void setSearchTimeoutMs(long searchTimeoutMs) {
        this.searchTimeoutMs = searchTimeoutMs;
    }

    public double getSearchRateLimitPerSecond() {
        return searchRateLimitPerSecond;
    }

    public void setSearchRateLimitPerSecond(double searchRateLimitPerSecond) {
        this.searchRateLimitPerSecond = searchRateLimitPerSecond;
    }

    public int getCircuitFailureThreshold() {
        return circuitFailureThreshold;
    }

    public void setCircuitFailureThreshold(int circuitFailureThreshold) {
        this.circuitFailureThreshold = circuitFailureThreshold;
    }

    public long getCircuitOpenMs() {
        return circuitOpenMs;
    }

    public void setCircuitOpenMs(long circuitOpenMs) {
        this.circuitOpenMs = circuitOpenMs;
    }

    public int getParserWorkers() {
        return parserWorkers;
    }

    public void setParserWorkers(int parserWorkers) {
        this.parserWorkers = parserWorkers;
    }
}
