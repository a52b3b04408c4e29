package io.projectmemory.memory;

import java.util.List;
import java.util.Map;

/**
 * Consistent copy of a project memory, read inside one transaction.
 *
 * @param decisions decisions in id order, oldest first
 * @param patterns  patterns ordered by name
 * @param context   context entries ordered by key
 * @param stats     statistics taken in the same transaction
 */
public record MemoryDump(
        List<Decision> decisions,
        List<Pattern> patterns,
        Map<String, String> context,
        MemoryStats stats
) {
}
