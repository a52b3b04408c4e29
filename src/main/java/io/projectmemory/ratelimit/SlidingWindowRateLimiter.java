package io.projectmemory.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window limiter: an operation counts against the quota for exactly one window length
 * after it was recorded. Thread-safe; all state is guarded by the instance monitor.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final int maxOperations;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> operations = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxOperations, Duration window, Clock clock) {
        if (maxOperations < 1) {
            throw new IllegalArgumentException("maxOperations must be at least 1");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxOperations = maxOperations;
        this.window = window;
        this.clock = clock;
    }

    @Override
    public RateLimitDecision allow(int cost) {
        if (cost < 1) {
            throw new IllegalArgumentException("cost must be at least 1");
        }
        Instant now = clock.instant();
        synchronized (this) {
            evictExpired(now);
            int used = operations.size();
            if (used + cost > maxOperations) {
                Instant oldest = operations.peekFirst();
                Duration retryAfter = oldest == null ? window : Duration.between(now, oldest.plus(window));
                log.debug("Rate limit denied: {}/{} used in window", used, maxOperations);
                return RateLimitDecision.denied(maxOperations, used, retryAfter);
            }
            for (int i = 0; i < cost; i++) {
                operations.addLast(now);
            }
            used += cost;
            onRecorded(now, cost);
            return RateLimitDecision.allowed(maxOperations, used);
        }
    }

    @Override
    public synchronized RateLimitDecision peek() {
        evictExpired(clock.instant());
        return RateLimitDecision.allowed(maxOperations, operations.size());
    }

    @Override
    public synchronized void reset() {
        operations.clear();
        log.info("Rate limiter reset");
    }

    @Override
    public void close() {
        // nothing to flush
    }

    public int maxOperations() {
        return maxOperations;
    }

    public Duration window() {
        return window;
    }

    protected Clock clock() {
        return clock;
    }

    /** Called under the monitor after operations were recorded. */
    protected void onRecorded(Instant timestamp, int cost) {
    }

    /** Replaces the in-memory history, used when restoring persisted state. */
    protected synchronized void restore(Iterable<Instant> timestamps) {
        operations.clear();
        for (Instant ts : timestamps) {
            operations.addLast(ts);
        }
        evictExpired(clock.instant());
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(window);
        while (!operations.isEmpty() && !operations.peekFirst().isAfter(cutoff)) {
            operations.pollFirst();
        }
    }
}
