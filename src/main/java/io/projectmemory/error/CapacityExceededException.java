package io.projectmemory.error;

import java.util.Map;

/** A new keyed record would push a table past its configured maximum. */
public class CapacityExceededException extends MemoryException {

    public CapacityExceededException(String table, int limit) {
        super(ErrorKind.CAPACITY_EXCEEDED,
                "Table '%s' is at its limit of %d entries; purge or reuse an existing key".formatted(table, limit),
                Map.of("table", table, "limit", limit));
    }
}
