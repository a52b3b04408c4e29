package io.projectmemory.memory;

import java.time.Instant;

/**
 * An immutable decision record. Ids are assigned by storage, strictly increasing and never reused.
 *
 * @param id           storage-assigned id
 * @param timestamp    when the decision was remembered
 * @param decision     the decision made
 * @param rationale    why it was made
 * @param context      what triggered it (may be empty)
 * @param alternatives options that were considered (may be empty)
 */
public record Decision(
        long id,
        Instant timestamp,
        String decision,
        String rationale,
        String context,
        String alternatives
) {
}
