package io.projectmemory.snapshot;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.projectmemory.memory.Decision;
import io.projectmemory.memory.MemoryStats;
import io.projectmemory.memory.Pattern;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Versioned, portable copy of a project memory as written by {@code export_memory}.
 *
 * @param version    schema version the blob was written with
 * @param exportedAt export time
 * @param project    project the memory belongs to
 * @param decisions  decisions, oldest first
 * @param patterns   patterns ordered by name
 * @param context    context entries ordered by key
 * @param stats      statistics read in the same transaction as the rows
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MemorySnapshot(
        String version,
        Instant exportedAt,
        String project,
        List<Decision> decisions,
        List<Pattern> patterns,
        Map<String, String> context,
        MemoryStats stats
) {
}
