package io.projectmemory.snapshot;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Loose reading of an import blob. Timestamps stay strings here so a blank or malformed value can
 * be reported as a validation error instead of a parse failure; ids and stats are ignored.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
record ImportBlob(
        String version,
        List<DecisionEntry> decisions,
        List<PatternEntry> patterns,
        Map<String, String> context
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record DecisionEntry(String timestamp, String decision, String rationale, String context, String alternatives) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record PatternEntry(String name, String description, String example, String whenToUse, String updatedAt) {
    }
}
