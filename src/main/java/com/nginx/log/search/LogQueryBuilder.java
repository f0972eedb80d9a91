package com.nginx.log.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause.Occur;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.RegexpQuery;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.util.QueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.html.HtmlEscapers;
import com.nginx.log.index.IndexFields;

/**
 * Turns a {@link QueryRequest} into a Lucene query. Clauses are added most selective
 * first and combined as a conjunction.
 */
public class LogQueryBuilder {

    static final Logger logger = LoggerFactory.getLogger(LogQueryBuilder.class);

    static final long MAX_TIME_RANGE_SECONDS = 400L * 24 * 3600;

    private static final String REGEXP_RESERVED = ".?+*|{}[]()\"\\#@&<>~^$";

    private static final Splitter VALUE_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private static final Map<String, String> SORT_FIELDS = ImmutableMap.<String, String>builder()
            .put("timestamp", IndexFields.TIMESTAMP)
            .put("ip", IndexFields.IP)
            .put("method", IndexFields.METHOD)
            .put("path", IndexFields.PATH)
            .put("status", IndexFields.STATUS)
            .put("bytes_sent", IndexFields.BYTES_SENT)
            .put("browser", IndexFields.BROWSER)
            .put("os", IndexFields.OS)
            .put("device_type", IndexFields.DEVICE_TYPE)
            .build();

    private final QueryBuilder textQueries;

    public LogQueryBuilder() {
        this(new StandardAnalyzer());
    }

    /**
     * @param analyzer must match the analyzer the text fields were indexed with
     */
    public LogQueryBuilder(Analyzer analyzer) {
        this.textQueries = new QueryBuilder(analyzer);
    }

    public Query build(QueryRequest request) {
        List<Query> clauses = new ArrayList<>();

        if (!Strings.isNullOrEmpty(request.getIp())) {
            clauses.add(new TermQuery(new Term(IndexFields.IP, request.getIp().trim())));
        }
        if (!Strings.isNullOrEmpty(request.getMethod())) {
            clauses.add(new TermQuery(new Term(IndexFields.METHOD, request.getMethod().trim().toUpperCase(Locale.ROOT))));
        }
        Query status = statusQuery(request.getStatus());
        if (status != null) {
            clauses.add(status);
        }
        Query time = timeRangeQuery(request.getStartTime(), request.getEndTime());
        if (time != null) {
            clauses.add(time);
        }
        if (!Strings.isNullOrEmpty(request.getPath())) {
            clauses.add(pathQuery(request.getPath().trim()));
        }
        addIfPresent(clauses, anyOf(IndexFields.BROWSER, request.getBrowser()));
        addIfPresent(clauses, anyOf(IndexFields.OS, request.getOs()));
        addIfPresent(clauses, anyOf(IndexFields.DEVICE_TYPE, request.getDevice()));
        if (!Strings.isNullOrEmpty(request.getQuery())) {
            addIfPresent(clauses, textQuery(request.getQuery().trim()));
        }
        if (!Strings.isNullOrEmpty(request.getUserAgent())) {
            addIfPresent(clauses, match(IndexFields.USER_AGENT, request.getUserAgent()));
        }
        if (!Strings.isNullOrEmpty(request.getReferer())) {
            addIfPresent(clauses, phrase(IndexFields.REFERER, request.getReferer()));
        }
        if (!Strings.isNullOrEmpty(request.getLogPath())) {
            clauses.add(new TermQuery(new Term(IndexFields.FILE_PATH, request.getLogPath())));
        }

        if (clauses.isEmpty()) {
            return new MatchAllDocsQuery();
        }
        if (clauses.size() == 1) {
            return clauses.get(0);
        }
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (Query clause : clauses) {
            builder.add(clause, Occur.MUST);
        }
        return builder.build();
    }

    /**
     * Index field for a client sort name; unknown names sort by timestamp.
     */
    public static String sortField(String sortBy) {
        if (sortBy == null) {
            return IndexFields.TIMESTAMP;
        }
        return SORT_FIELDS.getOrDefault(sortBy, IndexFields.TIMESTAMP);
    }

    /**
     * Descending unless {@code asc} is asked for.
     */
    public static boolean isDescending(String sortOrder) {
        return !"asc".equalsIgnoreCase(sortOrder);
    }

    static Query timeRangeQuery(long startTime, long endTime) {
        if (startTime == 0 || endTime == 0) {
            logger.debug("No time range given, searching all data");
            return null;
        }
        long span = endTime - startTime;
        if (span >= MAX_TIME_RANGE_SECONDS) {
            logger.info("Time range too wide ({} seconds), ignoring time filter", span);
            return null;
        }
        // point ranges include both bounds, so records stamped exactly endTime match
        return LongPoint.newRangeQuery(IndexFields.TIMESTAMP, startTime, endTime);
    }

    static Query statusQuery(List<Integer> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return null;
        }
        if (statuses.size() == 1) {
            int value = statuses.get(0);
            return IntPoint.newRangeQuery(IndexFields.STATUS, value, value);
        }
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (int value : statuses) {
            builder.add(IntPoint.newRangeQuery(IndexFields.STATUS, value, value), Occur.SHOULD);
        }
        return builder.build();
    }

    /**
     * Paths are stored HTML-escaped, so the filter is escaped the same way before matching.
     */
    static Query pathQuery(String path) {
        String escaped = HtmlEscapers.htmlEscaper().escape(path);
        String head = escaped.endsWith("*") ? escaped.substring(0, escaped.length() - 1) : escaped;
        boolean wildcardInHead = head.indexOf('*') >= 0 || head.indexOf('?') >= 0;
        if (escaped.endsWith("*") && !wildcardInHead) {
            return new PrefixQuery(new Term(IndexFields.PATH, head));
        }
        if (wildcardInHead) {
            return new RegexpQuery(new Term(IndexFields.PATH, globToRegexp(escaped)));
        }
        return new TermQuery(new Term(IndexFields.PATH, escaped));
    }

    static String globToRegexp(String glob) {
        StringBuilder regexp = new StringBuilder(glob.length() + 8);
        for (char c : glob.toCharArray()) {
            if (c == '*') {
                regexp.append(".*");
            } else if (c == '?') {
                regexp.append('.');
            } else {
                if (REGEXP_RESERVED.indexOf(c) >= 0) {
                    regexp.append('\\');
                }
                regexp.append(c);
            }
        }
        return regexp.toString();
    }

    static Query anyOf(String field, String values) {
        if (Strings.isNullOrEmpty(values)) {
            return null;
        }
        List<String> parts = VALUE_SPLITTER.splitToList(values);
        if (parts.isEmpty()) {
            return null;
        }
        if (parts.size() == 1) {
            return new TermQuery(new Term(field, parts.get(0)));
        }
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (String part : parts) {
            builder.add(new TermQuery(new Term(field, part)), Occur.SHOULD);
        }
        return builder.build();
    }

    /**
     * Quoted input is a phrase over the raw line, anything else matches any of its words.
     */
    Query textQuery(String text) {
        if (text.length() > 1 && text.startsWith("\"") && text.endsWith("\"")) {
            return phrase(IndexFields.RAW, text.substring(1, text.length() - 1));
        }
        return match(IndexFields.RAW, text);
    }

    private Query match(String field, String text) {
        Query query = textQueries.createBooleanQuery(field, text);
        if (query == null) {
            logger.debug("Filter {}={} has no searchable terms, ignored", field, text);
        }
        return query;
    }

    private Query phrase(String field, String text) {
        Query query = textQueries.createPhraseQuery(field, text);
        if (query == null) {
            logger.debug("Phrase {}={} has no searchable terms, ignored", field, text);
        }
        return query;
    }

    private static void addIfPresent(List<Query> clauses, Query query) {
        if (query != null) {
            clauses.add(query);
        }
    }
}
