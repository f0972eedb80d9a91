package com.nginx.log.index;

import java.util.Map;

import com.nginx.log.parser.model.AccessLogEntry;

/**
 * A matching document: its stored values plus the values it was sorted by.
 */
public class IndexHit {

    private final String id;
    private final Map<String, Object> values;
    private final Object[] sortValues;

    public IndexHit(String id, Map<String, Object> values, Object[] sortValues) {
        this.id = id;
        this.values = values;
        this.sortValues = sortValues;
    }

    public String getId() {
        return id;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public Object[] getSortValues() {
        return sortValues;
    }

    public String getString(String field) {
        Object value = values.get(field);
        return value == null ? "" : value.toString();
    }

    public long getLong(String field) {
        Object value = values.get(field);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    public AccessLogEntry toEntry() {
        return IndexFields.toEntry(values);
    }
}
