package com.nginx.log.error;

/**
 * Scope of a failure: a single line, a single file, a whole log group or a query.
 */
public enum ErrorCategory {
    LINE,
    FILE,
    GROUP,
    QUERY
}
