package io.projectmemory.health;

import io.projectmemory.error.MemoryException;
import io.projectmemory.memory.MemoryStats;
import io.projectmemory.memory.MemoryTable;
import io.projectmemory.memory.ProjectMemory;
import io.projectmemory.ratelimit.RateLimitDecision;
import io.projectmemory.ratelimit.RateLimiter;
import io.projectmemory.snapshot.SnapshotSerializer;
import io.projectmemory.storage.ConnectionPool;
import io.projectmemory.storage.PoolStats;
import io.projectmemory.storage.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports whether the memory service can serve requests.
 *
 * <p>Unhealthy when storage integrity has failed or no connection can be acquired within the
 * short health timeout. Degraded when a table is above the capacity warning threshold, the pool
 * has been exhausted, or the rate limiter is above {@value #RATE_LIMIT_WARNING_PERCENT}% of its
 * window. This check never throws; failures are reported in the result.</p>
 */
public class MemoryHealthCheck {

    private static final Logger log = LoggerFactory.getLogger(MemoryHealthCheck.class);

    static final double RATE_LIMIT_WARNING_PERCENT = 80.0;

    private final StorageEngine storage;
    private final ConnectionPool pool;
    private final ProjectMemory store;
    private final RateLimiter rateLimiter;
    private final Duration acquireTimeout;
    private final int capacityWarningPercent;
    private final boolean readOnly;
    private final Clock clock;

    public MemoryHealthCheck(StorageEngine storage, ConnectionPool pool, ProjectMemory store, RateLimiter rateLimiter,
                             Duration acquireTimeout, int capacityWarningPercent, boolean readOnly, Clock clock) {
        this.storage = storage;
        this.pool = pool;
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.acquireTimeout = acquireTimeout;
        this.capacityWarningPercent = capacityWarningPercent;
        this.readOnly = readOnly;
        this.clock = clock;
    }

    public HealthReport check() {
        Map<String, Object> checks = new LinkedHashMap<>();
        HealthStatus status = HealthStatus.HEALTHY;

        if (storage.isFailed()) {
            checks.put("integrity", failed(storage.failure().getMessage()));
            status = HealthStatus.UNHEALTHY;
        } else {
            status = status.worse(checkStorage(checks));
        }

        if (status != HealthStatus.UNHEALTHY) {
            status = status.worse(checkCapacity(checks));
        }
        status = status.worse(checkPool(checks));
        status = status.worse(checkRateLimiter(checks));

        if (status != HealthStatus.HEALTHY) {
            log.warn("Health check reports {}: {}", status.value(), checks);
        }
        return new HealthReport(status, checks, SnapshotSerializer.SCHEMA_VERSION,
                storage.path().toString(), storage.fileSizeBytes(), Instant.now(clock));
    }

    private HealthStatus checkStorage(Map<String, Object> checks) {
        Connection connection;
        try {
            connection = pool.acquire(acquireTimeout);
        } catch (MemoryException e) {
            checks.put("connection", failed(e.getMessage()));
            return HealthStatus.UNHEALTHY;
        }
        try {
            checks.put("connection", ok());

            boolean intact = storage.integrityCheck(connection);
            if (!intact) {
                checks.put("integrity", failed(storage.isFailed() ? storage.failure().getMessage() : "integrity check failed"));
                return HealthStatus.UNHEALTHY;
            }
            checks.put("integrity", ok());

            if (readOnly) {
                checks.put("write_capability", Map.of("status", "skipped", "reason", "read-only mode"));
            } else {
                storage.probeWrite(connection);
                checks.put("write_capability", ok());
            }
            return HealthStatus.HEALTHY;
        } catch (MemoryException e) {
            String check = checks.containsKey("integrity") ? "write_capability" : "integrity";
            checks.put(check, failed(e.getMessage()));
            return HealthStatus.UNHEALTHY;
        } finally {
            pool.release(connection);
        }
    }

    private HealthStatus checkCapacity(Map<String, Object> checks) {
        MemoryStats stats;
        try {
            stats = store.stats();
        } catch (MemoryException e) {
            checks.put("capacity_percentages", failed(e.getMessage()));
            return HealthStatus.DEGRADED;
        }
        Map<String, Object> percentages = new LinkedHashMap<>();
        HealthStatus status = HealthStatus.HEALTHY;
        for (MemoryTable table : MemoryTable.values()) {
            double percent = stats.utilizationPercent(table);
            percentages.put(table.tableName(), percent);
            if (percent > capacityWarningPercent) {
                status = HealthStatus.DEGRADED;
            }
        }
        checks.put("capacity_percentages", percentages);
        return status;
    }

    private HealthStatus checkPool(Map<String, Object> checks) {
        PoolStats stats = pool.stats();
        checks.put("connection_pool", stats);
        return stats.exhaustionCount() > 0 ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
    }

    private HealthStatus checkRateLimiter(Map<String, Object> checks) {
        RateLimitDecision window = rateLimiter.peek();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("limit", window.limit());
        result.put("remaining", window.remaining());
        result.put("utilization_percent", window.utilizationPercent());
        checks.put("rate_limiter", result);
        return window.utilizationPercent() > RATE_LIMIT_WARNING_PERCENT ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
    }

    private static Map<String, Object> ok() {
        return Map.of("status", "ok");
    }

    private static Map<String, Object> failed(String message) {
        return Map.of("status", "failed", "error", message == null ? "unknown" : message);
    }
}
