package com.nginx.log.index;

import java.io.Closeable;
import java.io.IOException;
import java.util.Set;
import java.util.function.Consumer;

import org.apache.lucene.search.Query;

/**
 * Full-text and numeric index of access log records.
 */
public interface LogIndex extends Closeable {

    IndexBatch newBatch();

    IndexSearchResult search(IndexSearchRequest request) throws IOException;

    long count(Query query) throws IOException;

    long docCount() throws IOException;

    /**
     * Visits every match in index order, loading stored fields page by page.
     *
     * @param fields stored fields to load, null for all
     */
    void scan(Query query, Set<String> fields, int pageSize, Consumer<IndexHit> consumer) throws IOException;

    /**
     * Drops every document and starts over with empty storage.
     */
    void reset() throws IOException;
}
