package com.nginx.log.search;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanClause.Occur;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.RegexpQuery;
import org.apache.lucene.search.TermQuery;
import org.junit.jupiter.api.Test;

import com.nginx.log.index.IndexFields;

public class LogQueryBuilderTest {

    private final LogQueryBuilder builder = new LogQueryBuilder();

    @Test
    public void testEmptyRequestMatchesAll() {
        assertTrue(builder.build(new QueryRequest()) instanceof MatchAllDocsQuery);
    }

    @Test
    public void testSingleClauseIsNotWrapped() {
        Query query = builder.build(new QueryRequest().setIp("10.0.0.1"));

        assertTrue(query instanceof TermQuery);
        TermQuery term = (TermQuery) query;
        assertEquals(IndexFields.IP, term.getTerm().field());
        assertEquals("10.0.0.1", term.getTerm().text());
    }

    @Test
    public void testClausesAreConjunction() {
        Query query = builder.build(new QueryRequest().setIp("10.0.0.1").setMethod("get").setLogPath("/var/log/a.log"));

        assertTrue(query instanceof BooleanQuery);
        List<BooleanClause> clauses = ((BooleanQuery) query).clauses();
        assertEquals(3, clauses.size());
        for (BooleanClause clause : clauses) {
            assertEquals(Occur.MUST, clause.getOccur());
        }
        TermQuery method = (TermQuery) clauses.get(1).getQuery();
        assertEquals("GET", method.getTerm().text());
        TermQuery logPath = (TermQuery) clauses.get(2).getQuery();
        assertEquals(IndexFields.FILE_PATH, logPath.getTerm().field());
    }

    @Test
    public void testStatusQuery() {
        assertNull(LogQueryBuilder.statusQuery(null));
        assertNull(LogQueryBuilder.statusQuery(List.of()));
        assertFalse(LogQueryBuilder.statusQuery(List.of(200)) instanceof BooleanQuery);

        Query multi = LogQueryBuilder.statusQuery(List.of(200, 404));
        assertTrue(multi instanceof BooleanQuery);
        List<BooleanClause> clauses = ((BooleanQuery) multi).clauses();
        assertEquals(2, clauses.size());
        assertEquals(Occur.SHOULD, clauses.get(0).getOccur());
    }

    @Test
    public void testTimeRange() {
        assertNull(LogQueryBuilder.timeRangeQuery(0, 1000));
        assertNull(LogQueryBuilder.timeRangeQuery(1000, 0));
        assertNotNull(LogQueryBuilder.timeRangeQuery(1000, 2000));
        assertNull(LogQueryBuilder.timeRangeQuery(1000, 1000 + LogQueryBuilder.MAX_TIME_RANGE_SECONDS));
    }

    @Test
    public void testPathQuery() {
        Query exact = LogQueryBuilder.pathQuery("/api/users");
        assertTrue(exact instanceof TermQuery);

        Query prefix = LogQueryBuilder.pathQuery("/api/*");
        assertTrue(prefix instanceof PrefixQuery);
        assertEquals("/api/", ((PrefixQuery) prefix).getPrefix().text());

        Query glob = LogQueryBuilder.pathQuery("/api/*/detail*");
        assertTrue(glob instanceof RegexpQuery);

        TermQuery escaped = (TermQuery) LogQueryBuilder.pathQuery("/a&b");
        assertEquals("/a&amp;b", escaped.getTerm().text());
        assertTrue(LogQueryBuilder.pathQuery("/search?q=a") instanceof RegexpQuery);
    }

    @Test
    public void testGlobToRegexp() {
        assertEquals("/a.b.*", LogQueryBuilder.globToRegexp("/a?b*"));
        assertEquals("/x\\.html.*", LogQueryBuilder.globToRegexp("/x.html*"));
    }

    @Test
    public void testAnyOf() {
        assertNull(LogQueryBuilder.anyOf(IndexFields.BROWSER, null));
        assertNull(LogQueryBuilder.anyOf(IndexFields.BROWSER, " , "));
        assertTrue(LogQueryBuilder.anyOf(IndexFields.BROWSER, "Chrome") instanceof TermQuery);

        Query query = LogQueryBuilder.anyOf(IndexFields.BROWSER, "Chrome, Firefox");
        assertTrue(query instanceof BooleanQuery);
        assertEquals(2, ((BooleanQuery) query).clauses().size());
    }

    @Test
    public void testTextQuery() {
        assertTrue(builder.textQuery("\"GET /index\"") instanceof PhraseQuery);
        assertNotNull(builder.textQuery("curl"));
        assertNull(builder.textQuery("!!!"));
        assertTrue(builder.build(new QueryRequest().setQuery("!!!")) instanceof MatchAllDocsQuery);
    }

    @Test
    public void testSortHelpers() {
        assertEquals(IndexFields.TIMESTAMP, LogQueryBuilder.sortField(null));
        assertEquals(IndexFields.TIMESTAMP, LogQueryBuilder.sortField("bogus"));
        assertEquals(IndexFields.BYTES_SENT, LogQueryBuilder.sortField("bytes_sent"));
        assertTrue(LogQueryBuilder.isDescending(null));
        assertTrue(LogQueryBuilder.isDescending("desc"));
        assertFalse(LogQueryBuilder.isDescending("ASC"));
    }
}
