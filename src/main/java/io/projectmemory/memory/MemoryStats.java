package io.projectmemory.memory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Row counts, configured limits and approximate payload size.
 *
 * @param decisions            stored decisions
 * @param patterns             stored patterns
 * @param contextKeys          stored context entries
 * @param limits               configured maximums
 * @param approximateSizeBytes UTF-8 bytes of stored keys and text fields
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MemoryStats(
        int decisions,
        int patterns,
        int contextKeys,
        MemoryLimits limits,
        long approximateSizeBytes
) {

    public int count(MemoryTable table) {
        return switch (table) {
            case DECISIONS -> decisions;
            case PATTERNS -> patterns;
            case CONTEXT -> contextKeys;
        };
    }

    /** Utilization of a table as a percentage of its limit, rounded to one decimal. */
    public double utilizationPercent(MemoryTable table) {
        int limit = limits.limitFor(table);
        if (limit <= 0) return 0.0;
        return Math.round(count(table) * 1000.0 / limit) / 10.0;
    }
}
