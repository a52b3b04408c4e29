package io.projectmemory.memory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Rows written by an import.
 *
 * @param decisionsImported decisions inserted
 * @param patternsImported  pattern records written (a repeated name counts once per write)
 * @param contextImported   context entries written
 * @param decisionsEvicted  decisions dropped because the blob held more than the decision limit
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImportResult(int decisionsImported, int patternsImported, int contextImported, int decisionsEvicted) {
}
