package com.nginx.log.parser;

/**
 * Counters returned by a parse worker.
 */
public class ProcessingStats {
    public final long parsed;
    public final long parseErrors;

    public ProcessingStats(long parsed, long parseErrors) {
        this.parsed = parsed;
        this.parseErrors = parseErrors;
    }
}
