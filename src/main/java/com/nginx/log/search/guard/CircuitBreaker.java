package com.nginx.log.search.guard;

import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nginx.log.error.QueryException;
import com.nginx.log.error.QueryException.Reason;

/**
 * Opens after {@code failureThreshold} consecutive failures and rejects calls for
 * {@code openMs}. The first call after that runs as a half-open trial: success closes
 * the breaker, failure opens it again. A threshold of 0 or less never opens.
 */
public class CircuitBreaker {

    static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final long openMs;
    private final LongSupplier clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private long openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, long openMs) {
        this(name, failureThreshold, openMs, System::currentTimeMillis);
    }

    public CircuitBreaker(String name, int failureThreshold, long openMs, LongSupplier clock) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.openMs = openMs;
        this.clock = clock;
    }

    public synchronized void acquirePermission() throws QueryException {
        if (state == State.OPEN) {
            if (clock.getAsLong() - openedAt < openMs) {
                throw new QueryException(Reason.CIRCUIT_OPEN, "circuit " + name + " is open");
            }
            state = State.HALF_OPEN;
            trialInFlight = false;
            logger.info("Circuit {} half-open, allowing a trial call", name);
        }
        if (state == State.HALF_OPEN) {
            if (trialInFlight) {
                throw new QueryException(Reason.CIRCUIT_OPEN, "circuit " + name + " is half-open, trial call in progress");
            }
            trialInFlight = true;
        }
    }

    public synchronized void recordSuccess() {
        if (state != State.CLOSED) {
            logger.info("Circuit {} closed", name);
        }
        state = State.CLOSED;
        consecutiveFailures = 0;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        if (failureThreshold <= 0) {
            return;
        }
        if (state == State.HALF_OPEN) {
            open();
            return;
        }
        consecutiveFailures++;
        if (state == State.CLOSED && consecutiveFailures >= failureThreshold) {
            open();
        }
    }

    /**
     * Ends a call that neither succeeded nor failed, e.g. one cancelled by its caller.
     */
    public synchronized void release() {
        trialInFlight = false;
    }

    private void open() {
        state = State.OPEN;
        openedAt = clock.getAsLong();
        trialInFlight = false;
        logger.warn("Circuit {} opened after {} consecutive failures", name, consecutiveFailures);
    }

    public synchronized State getState() {
        return state;
    }
}
