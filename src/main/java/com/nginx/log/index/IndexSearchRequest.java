package com.nginx.log.index;

import java.util.Set;

import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;

public class IndexSearchRequest {

    private Query query = new MatchAllDocsQuery();
    private int size = 10;
    private int from;
    private String sortField = IndexFields.TIMESTAMP;
    private boolean descending = true;
    private Set<String> fields;

    public IndexSearchRequest() {
    }

    public IndexSearchRequest(Query query, int size, int from) {
        this.query = query;
        this.size = size;
        this.from = from;
    }

    public Query getQuery() {
        return query;
    }

    public IndexSearchRequest setQuery(Query query) {
        this.query = query;
        return this;
    }

    /**
     * 0 means count only.
     */
    public int getSize() {
        return size;
    }

    public IndexSearchRequest setSize(int size) {
        this.size = size;
        return this;
    }

    public int getFrom() {
        return from;
    }

    public IndexSearchRequest setFrom(int from) {
        this.from = from;
        return this;
    }

    public String getSortField() {
        return sortField;
    }

    public boolean isDescending() {
        return descending;
    }

    public IndexSearchRequest setSort(String sortField, boolean descending) {
        this.sortField = sortField;
        this.descending = descending;
        return this;
    }

    /**
     * Stored fields to load, or null for all of them.
     */
    public Set<String> getFields() {
        return fields;
    }

    public IndexSearchRequest setFields(Set<String> fields) {
        this.fields = fields;
        return this;
    }

    @Override
    public String toString() {
        return "IndexSearchRequest [query=" + query + ", size=" + size + ", from=" + from + ", sort=" + sortField
                + (descending ? " desc" : " asc") + "]";
    }
}
