package io.projectmemory.error;

import java.util.Map;

/** The sliding-window quota is exhausted. Callers should back off for {@code retry_after_ms}. */
public class RateLimitExceededException extends MemoryException {

    public RateLimitExceededException(int limit, int remaining, double utilizationPercent, long retryAfterMillis) {
        super(ErrorKind.RATE_LIMIT_EXCEEDED,
                "Rate limit of %d operations per window exceeded".formatted(limit),
                Map.of("remaining", remaining,
                        "utilization_percent", utilizationPercent,
                        "retry_after_ms", retryAfterMillis));
    }
}
