package io.projectmemory.memory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * A named code pattern or convention. Storing an existing name replaces the record in place.
 *
 * @param name        unique key
 * @param description what the pattern is and why it is used
 * @param example     code example (may be empty)
 * @param whenToUse   guidance on when to apply it (may be empty)
 * @param updatedAt   last write time
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Pattern(
        String name,
        String description,
        String example,
        String whenToUse,
        Instant updatedAt
) {
}
