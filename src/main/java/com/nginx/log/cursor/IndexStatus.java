package com.nginx.log.cursor;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a file cursor: not_indexed, queued, indexing, then indexed or error.
 */
public enum IndexStatus {

    NOT_INDEXED, QUEUED, INDEXING, INDEXED, ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IndexStatus fromValue(String value) {
        if (value == null || value.isEmpty()) {
            return NOT_INDEXED;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return getValue();
    }
}
