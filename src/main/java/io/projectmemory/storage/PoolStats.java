package io.projectmemory.storage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Point-in-time view of the connection pool.
 *
 * @param poolSize        configured capacity
 * @param available       connections that can be acquired right now
 * @param inUse           connections currently handed out
 * @param exhaustionCount acquire attempts that timed out since startup
 * @param warmedUp        whether all connections were opened at startup
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PoolStats(int poolSize, int available, int inUse, long exhaustionCount, boolean warmedUp) {
}
