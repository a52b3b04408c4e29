package io.projectmemory.health;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * Result of a health check.
 *
 * @param status      overall state, the worst of all checks
 * @param checks      per-check results keyed by check name
 * @param version     service schema version
 * @param dbPath      database file in use
 * @param dbSizeBytes database plus WAL size
 * @param checkedAt   when the check ran
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HealthReport(
        HealthStatus status,
        Map<String, Object> checks,
        String version,
        String dbPath,
        long dbSizeBytes,
        Instant checkedAt
) {
}
