package io.projectmemory.memory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Rows removed by a purge. A purge of an empty store reports zeros. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PurgeResult(int decisionsDeleted, int patternsDeleted, int contextDeleted) {
}
