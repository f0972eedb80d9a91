package com.nginx.log.index;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.lucene.index.Term;
import org.apache.lucene.search.TermQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes every document holding an exact keyword value, one page of ids at a time.
 */
public final class IndexDeletes {

    static final Logger logger = LoggerFactory.getLogger(IndexDeletes.class);

    public static final int DEFAULT_PAGE_SIZE = 10000;

    private static final Set<String> ID_ONLY = Set.of(IndexFields.ID);

    private IndexDeletes() {
    }

    public static long deleteByTerm(LogIndex index, String field, String value) throws IOException {
        return deleteByTerm(index, field, value, DEFAULT_PAGE_SIZE);
    }

    /**
     * @return number of documents deleted
     */
    public static long deleteByTerm(LogIndex index, String field, String value, int pageSize) throws IOException {
        TermQuery query = new TermQuery(new Term(field, value));
        long deleted = 0;
        Set<String> previousPage = Set.of();
        while (true) {
            IndexSearchResult page = index.search(new IndexSearchRequest(query, pageSize, 0).setFields(ID_ONLY));
            List<IndexHit> hits = page.getHits();
            if (hits.isEmpty()) {
                break;
            }
            Set<String> ids = new HashSet<>();
            IndexBatch batch = index.newBatch();
            for (IndexHit hit : hits) {
                ids.add(hit.getId());
                batch.delete(hit.getId());
            }
            if (ids.equals(previousPage)) {
                throw new IOException("Deleting " + field + "=" + value + " made no progress");
            }
            batch.execute();
            deleted += hits.size();
            previousPage = ids;
        }
        logger.info("Deleted {} documents with {}={}", deleted, field, value);
        return deleted;
    }
}
