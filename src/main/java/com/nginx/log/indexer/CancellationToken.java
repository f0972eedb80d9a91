package com.nginx.log.indexer;

/**
 * Cooperative cancellation flag checked by long-running operations at line or page
 * boundaries. A child token is cancelled whenever its parent is.
 */
public class CancellationToken {

    private final CancellationToken parent;
    private volatile boolean cancelled;
    private volatile String reason;

    public CancellationToken() {
        this(null);
    }

    public CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    public void cancel(String reason) {
        if (!cancelled) {
            this.reason = reason;
            cancelled = true;
        }
    }

    public void cancel() {
        cancel("cancelled");
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public String getReason() {
        if (cancelled) {
            return reason;
        }
        return parent != null ? parent.getReason() : null;
    }
}
