package io.projectmemory.error;

import java.time.Duration;
import java.util.Map;

/** No pooled connection became free within the acquire timeout. Transient; safe to retry. */
public class PoolExhaustedException extends MemoryException {

    public PoolExhaustedException(int poolSize, Duration timeout) {
        super(ErrorKind.POOL_EXHAUSTED,
                "No database connection available within %d ms (pool size %d)".formatted(timeout.toMillis(), poolSize),
                Map.of("pool_size", poolSize, "timeout_ms", timeout.toMillis()));
    }

    public PoolExhaustedException(String message, Throwable cause) {
        super(ErrorKind.POOL_EXHAUSTED, message, cause);
    }
}
