package io.projectmemory.memory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-table maximum row counts.
 *
 * @param maxDecisions   decisions kept before the oldest is evicted
 * @param maxPatterns    distinct pattern names accepted
 * @param maxContextKeys distinct context keys accepted
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MemoryLimits(int maxDecisions, int maxPatterns, int maxContextKeys) {

    public int limitFor(MemoryTable table) {
        return switch (table) {
            case DECISIONS -> maxDecisions;
            case PATTERNS -> maxPatterns;
            case CONTEXT -> maxContextKeys;
        };
    }
}
