package io.projectmemory.ratelimit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;

/**
 * Outcome of a rate limiter check.
 *
 * @param allowed            whether the operation may proceed
 * @param limit              operations allowed per window
 * @param remaining          operations still available in the current window
 * @param utilizationPercent share of the window already used, 0-100
 * @param retryAfterMillis   when denied, how long until the oldest operation leaves the window
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RateLimitDecision(
        boolean allowed,
        int limit,
        int remaining,
        double utilizationPercent,
        long retryAfterMillis
) {

    static RateLimitDecision allowed(int limit, int used) {
        return new RateLimitDecision(true, limit, Math.max(0, limit - used), utilization(used, limit), 0L);
    }

    static RateLimitDecision denied(int limit, int used, Duration retryAfter) {
        return new RateLimitDecision(false, limit, Math.max(0, limit - used), utilization(used, limit),
                Math.max(0L, retryAfter.toMillis()));
    }

    private static double utilization(int used, int limit) {
        if (limit <= 0) return 0.0;
        return Math.round(Math.min(used, limit) * 1000.0 / limit) / 10.0;
    }
}
