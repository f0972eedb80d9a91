package com.nginx.log.search.guard;

import com.google.common.util.concurrent.RateLimiter;
import com.nginx.log.error.QueryException;
import com.nginx.log.error.QueryException.Reason;

/**
 * Token bucket in front of the search path. A rate of 0 or less disables it.
 */
public class RateLimiterGuard {

    private final double permitsPerSecond;
    private final RateLimiter rateLimiter;

    public RateLimiterGuard(double permitsPerSecond) {
        this.permitsPerSecond = permitsPerSecond;
        this.rateLimiter = permitsPerSecond > 0 ? RateLimiter.create(permitsPerSecond) : null;
    }

    public boolean isEnabled() {
        return rateLimiter != null;
    }

    /**
     * Takes a permit without waiting.
     */
    public void acquire() throws QueryException {
        if (rateLimiter != null && !rateLimiter.tryAcquire()) {
            throw new QueryException(Reason.RATE_LIMITED,
                    "search rate limit of " + permitsPerSecond + " requests per second exceeded");
        }
    }
}
