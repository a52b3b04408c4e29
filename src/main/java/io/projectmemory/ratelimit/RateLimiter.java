package io.projectmemory.ratelimit;

/**
 * Process-wide abuse protection, independent of the connection pool. A denied call must be
 * rejected before any pooled connection is acquired.
 */
public interface RateLimiter extends AutoCloseable {

    /**
     * Records {@code cost} operations if they fit into the current window.
     *
     * @param cost number of operations to record, at least 1
     * @return the decision; nothing is recorded when it is denied
     */
    RateLimitDecision allow(int cost);

    default RateLimitDecision allow() {
        return allow(1);
    }

    /** Current window state without recording anything. */
    RateLimitDecision peek();

    /** Forgets all recorded operations. */
    void reset();

    /** Releases resources; persistent implementations flush here. */
    @Override
    void close();
}
