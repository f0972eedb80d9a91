package com.nginx.log.parser;

import java.io.Closeable;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToLongFunction;
import java.util.regex.Matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import com.google.common.net.InetAddresses;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.nginx.log.error.LineParseException;
import com.nginx.log.error.LineParseException.Reason;
import com.nginx.log.parser.model.AccessLogEntry;
import com.nginx.log.parser.model.GeoLocation;
import com.nginx.log.parser.model.UserAgentInfo;

/**
 * Parses nginx access log lines into {@link AccessLogEntry} records, enriching each
 * one through the optional user agent and geoip collaborators.
 */
public class AccessLogParser implements Closeable {

    static final Logger logger = LoggerFactory.getLogger(AccessLogParser.class);

    public static final String INVALID_IP = "invalid";
    public static final String UNKNOWN_METHOD = "UNKNOWN";

    static final int MAX_FIELD_LENGTH = 2048;
    static final int MAX_IP_INPUT_LENGTH = 256;
    static final int PARALLEL_THRESHOLD = 100;
    static final int MAX_LOGGED_ERRORS = 3;

    private static final Set<String> VALID_METHODS = Set.of(
            "GET", "POST", "PUT", "DELETE", "HEAD", "OPTIONS", "PATCH", "TRACE", "CONNECT");

    private static final DateTimeFormatter NGINX_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive().appendPattern("dd/MMM/yyyy:HH:mm:ss Z").toFormatter(Locale.ENGLISH);
    private static final DateTimeFormatter NGINX_TIME_NO_ZONE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive().appendPattern("dd/MMM/yyyy:HH:mm:ss").toFormatter(Locale.ENGLISH);
    private static final DateTimeFormatter SQL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);

    private static final List<ToLongFunction<String>> TIMESTAMP_LAYOUTS = List.of(
            s -> ZonedDateTime.parse(s, NGINX_TIME).toEpochSecond(),
            s -> LocalDateTime.parse(s, NGINX_TIME_NO_ZONE).toEpochSecond(ZoneOffset.UTC),
            s -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toEpochSecond(),
            s -> LocalDateTime.parse(s, SQL_TIME).toEpochSecond(ZoneOffset.UTC));

    private static final Escaper HTML = HtmlEscapers.htmlEscaper();

    private final UserAgentParser userAgentParser;
    private final GeoIpLookup geoIpLookup;
    private final int workers;
    private final AtomicLong totalParseErrors = new AtomicLong();

    private volatile ExecutorService executor;

    public AccessLogParser() {
        this(null, null, Runtime.getRuntime().availableProcessors());
    }

    public AccessLogParser(UserAgentParser userAgentParser, GeoIpLookup geoIpLookup) {
        this(userAgentParser, geoIpLookup, Runtime.getRuntime().availableProcessors());
    }

    public AccessLogParser(UserAgentParser userAgentParser, GeoIpLookup geoIpLookup, int workers) {
        this.userAgentParser = userAgentParser;
        this.geoIpLookup = geoIpLookup;
        this.workers = Math.max(1, workers);
    }

    /**
     * Parse one line, trying each {@link LogFormat} in priority order.
     */
    public AccessLogEntry parseLine(String line) throws LineParseException {
        if (line == null) {
            throw new LineParseException(Reason.EMPTY_LINE, "empty log line");
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            throw new LineParseException(Reason.EMPTY_LINE, "empty log line");
        }
        for (LogFormat format : LogFormat.values()) {
            Matcher m = format.getPattern().matcher(trimmed);
            if (m.find()) {
                return parseMatch(m, format, trimmed);
            }
        }
        throw new LineParseException(Reason.UNSUPPORTED_LOG_FORMAT, "unsupported log format");
    }

    private AccessLogEntry parseMatch(Matcher m, LogFormat format, String rawLine) throws LineParseException {
        AccessLogEntry entry = new AccessLogEntry();
        entry.setRaw(sanitize(rawLine));

        List<String> fields = format.getFields();
        for (int i = 0; i < fields.size() && i < m.groupCount(); i++) {
            String value = m.group(i + 1);
            if (value == null) {
                continue;
            }
            switch (fields.get(i)) {
            case "ip":
                entry.setIp(sanitize(extractRealIp(value)));
                if (geoIpLookup != null && !INVALID_IP.equals(entry.getIp())) {
                    GeoLocation location = geoIpLookup.lookup(entry.getIp());
                    if (location != null) {
                        entry.setRegionCode(location.getRegionCode());
                        entry.setProvince(location.getProvince());
                        entry.setCity(location.getCity());
                    }
                }
                break;
            case "timestamp":
                entry.setTimestamp(parseTimestamp(value));
                break;
            case "request":
                parseRequest(value, entry);
                break;
            case "status":
                entry.setStatus(parseStatus(value));
                break;
            case "bytes_sent":
                entry.setBytesSent(parseBytes(value));
                break;
            case "referer":
                entry.setReferer(sanitize(value));
                break;
            case "user_agent":
                entry.setUserAgent(sanitize(value));
                if (userAgentParser != null) {
                    UserAgentInfo info = userAgentParser.parse(value);
                    entry.setBrowser(sanitize(info.getBrowser()));
                    entry.setBrowserVersion(sanitize(info.getBrowserVersion()));
                    entry.setOs(sanitize(info.getOs()));
                    entry.setOsVersion(sanitize(info.getOsVersion()));
                    entry.setDeviceType(sanitize(info.getDeviceType()));
                }
                break;
            case "request_time":
                Double requestTime = parseSeconds(value);
                if (requestTime != null) {
                    entry.setRequestTime(requestTime);
                }
                break;
            case "upstream_time":
                entry.setUpstreamTime(parseSeconds(value));
                break;
            default:
                // remote_user, x_forwarded_for and connection are not indexed
                break;
            }
        }
        return entry;
    }

    /**
     * Picks the client address out of a plain or X-Forwarded-For style value: the first
     * public address, else the first valid one, else {@value #INVALID_IP}.
     */
    public static String extractRealIp(String value) {
        if (value == null) {
            return INVALID_IP;
        }
        String input = value.length() > MAX_IP_INPUT_LENGTH ? value.substring(0, MAX_IP_INPUT_LENGTH) : value;

        if (input.contains(",")) {
            String[] candidates = input.split(",");
            for (String candidate : candidates) {
                String ip = candidate.trim();
                if (isValidIp(ip) && isPublicIp(ip)) {
                    return ip;
                }
            }
            for (String candidate : candidates) {
                String ip = candidate.trim();
                if (isValidIp(ip)) {
                    return ip;
                }
            }
            return INVALID_IP;
        }

        String ip = input.trim();
        return isValidIp(ip) ? ip : INVALID_IP;
    }

    /**
     * Literal address check only, never resolves host names.
     */
    static boolean isValidIp(String ip) {
        return ip != null && !ip.isEmpty() && InetAddresses.isInetAddress(ip);
    }

    static boolean isPublicIp(String ip) {
        if (!isValidIp(ip)) {
            return false;
        }
        InetAddress address = InetAddresses.forString(ip);
        if (address.isLoopbackAddress() || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return false;
        }
        if (address instanceof Inet6Address) {
            // fc00::/7 unique local
            byte first = address.getAddress()[0];
            if ((first & 0xfe) == 0xfc) {
                return false;
            }
        }
        return true;
    }

    /**
     * Epoch seconds for the nginx time layout and its fallbacks.
     */
    static long parseTimestamp(String value) throws LineParseException {
        String ts = value.trim();
        DateTimeParseException last = null;
        for (ToLongFunction<String> layout : TIMESTAMP_LAYOUTS) {
            try {
                return layout.applyAsLong(ts);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        LineParseException failure = new LineParseException(Reason.INVALID_TIMESTAMP, "invalid timestamp '" + value + "'");
        failure.initCause(last);
        throw failure;
    }

    private void parseRequest(String request, AccessLogEntry entry) {
        String[] parts = request.trim().split("\\s+");
        if (parts.length >= 1 && !parts[0].isEmpty()) {
            String method = parts[0].toUpperCase(Locale.ROOT);
            entry.setMethod(VALID_METHODS.contains(method) ? method : UNKNOWN_METHOD);
        }
        if (parts.length >= 2) {
            entry.setPath(sanitize(parts[1]));
        }
        if (parts.length >= 3) {
            entry.setProtocol(sanitize(parts[2]));
        }
    }

    private static int parseStatus(String value) {
        try {
            int status = Integer.parseInt(value);
            return status >= 0 && status <= 999 ? status : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static long parseBytes(String value) {
        if ("-".equals(value)) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(value));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Double parseSeconds(String value) {
        if ("-".equals(value)) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * HTML-escape and cap length. Empty and "-" pass through unchanged.
     */
    public static String sanitize(String input) {
        if (input == null || input.isEmpty() || "-".equals(input)) {
            return input == null ? "" : input;
        }
        String escaped = HTML.escape(input);
        return escaped.length() > MAX_FIELD_LENGTH ? escaped.substring(0, MAX_FIELD_LENGTH) : escaped;
    }

    /**
     * Parse a batch preserving input order. Failed lines and records without a
     * timestamp are dropped. Small batches are parsed on the calling thread.
     */
    public List<AccessLogEntry> parseLines(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return new ArrayList<>();
        }
        AccessLogEntry[] results = new AccessLogEntry[lines.size()];
        if (lines.size() < PARALLEL_THRESHOLD || workers == 1) {
            parseSingleThreaded(lines, results);
        } else {
            parseParallel(lines, results);
        }

        List<AccessLogEntry> entries = new ArrayList<>(results.length);
        for (AccessLogEntry entry : results) {
            if (entry != null && entry.getTimestamp() != 0) {
                entries.add(entry);
            }
        }
        return entries;
    }

    private void parseSingleThreaded(List<String> lines, AccessLogEntry[] results) {
        AtomicInteger loggedErrors = new AtomicInteger();
        ParseWorker worker = new ParseWorker(this, lines, results, new AtomicInteger(), loggedErrors);
        ProcessingStats stats = worker.call();
        recordErrors(stats.parseErrors, lines.size());
    }

    private void parseParallel(List<String> lines, AccessLogEntry[] results) {
        ExecutorService pool = getExecutor();
        AtomicInteger nextIndex = new AtomicInteger();
        AtomicInteger loggedErrors = new AtomicInteger();

        List<Future<ProcessingStats>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            futures.add(pool.submit(new ParseWorker(this, lines, results, nextIndex, loggedErrors)));
        }

        long errors = 0;
        for (Future<ProcessingStats> future : futures) {
            try {
                errors += future.get().parseErrors;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while parsing batch", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Parse worker failed", e.getCause());
            }
        }
        recordErrors(errors, lines.size());
    }

    private void recordErrors(long errors, int batchSize) {
        if (errors == 0) {
            return;
        }
        totalParseErrors.addAndGet(errors);
        if (errors > MAX_LOGGED_ERRORS) {
            logger.warn("{} of {} lines failed to parse in batch", errors, batchSize);
        }
    }

    /**
     * Called by workers; only the first few failures of a batch are logged.
     */
    void reportParseError(String line, LineParseException e, AtomicInteger loggedErrors) {
        if (e.getReason() == Reason.EMPTY_LINE) {
            return;
        }
        if (loggedErrors.incrementAndGet() <= MAX_LOGGED_ERRORS) {
            String display = line.length() > 200 ? line.substring(0, 200) + "..." : line;
            logger.warn("Failed to parse line ({}): {}", e.getReasonName(), display);
        }
    }

    private ExecutorService getExecutor() {
        ExecutorService pool = executor;
        if (pool == null) {
            synchronized (this) {
                pool = executor;
                if (pool == null) {
                    pool = Executors.newFixedThreadPool(workers,
                            new ThreadFactoryBuilder().setNameFormat("log-parser-%d").setDaemon(true).build());
                    executor = pool;
                }
            }
        }
        return pool;
    }

    public long getTotalParseErrors() {
        return totalParseErrors.get();
    }

    @VisibleForTesting
    int getWorkers() {
        return workers;
    }

    @Override
    public void close() {
        ExecutorService pool = executor;
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
