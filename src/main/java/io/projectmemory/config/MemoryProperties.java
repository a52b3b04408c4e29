package io.projectmemory.config;

import io.projectmemory.memory.MemoryLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for the project memory service.
 *
 * <p>Binds to {@code project-memory} in application.yml:</p>
 * <pre>
 * project-memory:
 *   db-path: ${PROJECT_MEMORY_DB:}
 *   max-decisions: ${PROJECT_MEMORY_MAX_DECISIONS:1000}
 *   max-patterns: ${PROJECT_MEMORY_MAX_PATTERNS:100}
 *   max-context-keys: ${PROJECT_MEMORY_MAX_CONTEXT_KEYS:50}
 *   pool-size: ${PROJECT_MEMORY_POOL_SIZE:5}
 *   rate-limit: ${PROJECT_MEMORY_RATE_LIMIT:100}
 *   persist-rate-limit: ${PROJECT_MEMORY_PERSIST_RATE_LIMIT:false}
 *   read-only: ${PROJECT_MEMORY_READ_ONLY:false}
 * </pre>
 *
 * <p>Every field is optional; a missing value takes the documented default. The record is built
 * once at startup and never changes afterwards.</p>
 *
 * @param dbPath                 database file; blank means {@code ~/.claude/project-memories/<project>.db}
 * @param maxDecisions           decisions kept before the oldest is evicted (default 1000)
 * @param maxPatterns            distinct pattern names accepted (default 100)
 * @param maxContextKeys         distinct context keys accepted (default 50)
 * @param poolSize               pooled connections (default 5)
 * @param acquireTimeout         longest wait for a pooled connection (default 5s)
 * @param warmUp                 open every pooled connection at startup (default true)
 * @param rateLimit              operations allowed per window (default 100)
 * @param rateLimitWindow        sliding window length (default 60s)
 * @param persistRateLimit       keep rate-limit history across restarts (default false)
 * @param readOnly               reject every write with a permission error (default false)
 * @param maxTextLength          cap applied to free-text fields (default 10000)
 * @param capacityWarningPercent table utilization that turns health to degraded (default 90)
 * @param healthCheckTimeout     connection acquire timeout used by the health check (default 1s)
 * @param maxImportBytes         largest accepted import payload (default 10 MiB)
 * @param maxImportDecisions     decisions accepted in one import (default 10000)
 * @param maxImportPatterns      patterns accepted in one import (default 1000)
 * @param maxImportContextKeys   context keys accepted in one import (default 500)
 */
@ConfigurationProperties(prefix = "project-memory")
public record MemoryProperties(
        String dbPath,
        Integer maxDecisions,
        Integer maxPatterns,
        Integer maxContextKeys,
        Integer poolSize,
        Duration acquireTimeout,
        Boolean warmUp,
        Integer rateLimit,
        Duration rateLimitWindow,
        Boolean persistRateLimit,
        Boolean readOnly,
        Integer maxTextLength,
        Integer capacityWarningPercent,
        Duration healthCheckTimeout,
        Long maxImportBytes,
        Integer maxImportDecisions,
        Integer maxImportPatterns,
        Integer maxImportContextKeys
) {

    public MemoryProperties {
        if (dbPath != null && dbPath.isBlank()) dbPath = null;
        maxDecisions = positive("max-decisions", maxDecisions, 1000);
        maxPatterns = positive("max-patterns", maxPatterns, 100);
        maxContextKeys = positive("max-context-keys", maxContextKeys, 50);
        poolSize = positive("pool-size", poolSize, 5);
        acquireTimeout = positive("acquire-timeout", acquireTimeout, Duration.ofSeconds(5));
        if (warmUp == null) warmUp = true;
        rateLimit = positive("rate-limit", rateLimit, 100);
        rateLimitWindow = positive("rate-limit-window", rateLimitWindow, Duration.ofSeconds(60));
        if (persistRateLimit == null) persistRateLimit = false;
        if (readOnly == null) readOnly = false;
        maxTextLength = positive("max-text-length", maxTextLength, 10_000);
        capacityWarningPercent = positive("capacity-warning-percent", capacityWarningPercent, 90);
        if (capacityWarningPercent > 100) {
            throw new IllegalArgumentException("capacity-warning-percent must be between 1 and 100");
        }
        healthCheckTimeout = positive("health-check-timeout", healthCheckTimeout, Duration.ofSeconds(1));
        if (maxImportBytes == null) maxImportBytes = 10L * 1024 * 1024;
        if (maxImportBytes <= 0) throw new IllegalArgumentException("max-import-bytes must be positive");
        maxImportDecisions = positive("max-import-decisions", maxImportDecisions, 10_000);
        maxImportPatterns = positive("max-import-patterns", maxImportPatterns, 1_000);
        maxImportContextKeys = positive("max-import-context-keys", maxImportContextKeys, 500);
    }

    /** All defaults, database location derived from the working directory. */
    public static MemoryProperties defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public MemoryLimits limits() {
        return new MemoryLimits(maxDecisions, maxPatterns, maxContextKeys);
    }

    /**
     * Resolves the database file. An explicit {@code db-path} wins; otherwise the file lives under
     * {@code ~/.claude/project-memories/} and is named after the working directory.
     */
    public Path resolveDatabasePath() {
        return resolveDatabasePath(Path.of("").toAbsolutePath(), Path.of(System.getProperty("user.home")));
    }

    Path resolveDatabasePath(Path projectDir, Path homeDir) {
        if (dbPath != null) {
            return Path.of(dbPath);
        }
        return homeDir.resolve(".claude").resolve("project-memories").resolve(projectName(projectDir) + ".db");
    }

    /** Filesystem-safe project name derived from a directory. */
    public static String projectName(Path projectDir) {
        Path fileName = projectDir.getFileName();
        String name = fileName == null ? "default" : fileName.toString();
        return name.replaceAll("[^\\w\\-]", "_");
    }

    private static Integer positive(String name, Integer value, int fallback) {
        if (value == null) return fallback;
        if (value <= 0) throw new IllegalArgumentException(name + " must be positive, got " + value);
        return value;
    }

    private static Duration positive(String name, Duration value, Duration fallback) {
        if (value == null) return fallback;
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    /** Fluent construction for tests and embedded use. */
    public static final class Builder {
        private String dbPath;
        private Integer maxDecisions;
        private Integer maxPatterns;
        private Integer maxContextKeys;
        private Integer poolSize;
        private Duration acquireTimeout;
        private Boolean warmUp;
        private Integer rateLimit;
        private Duration rateLimitWindow;
        private Boolean persistRateLimit;
        private Boolean readOnly;
        private Integer maxTextLength;
        private Integer capacityWarningPercent;
        private Duration healthCheckTimeout;
        private Long maxImportBytes;
        private Integer maxImportDecisions;
        private Integer maxImportPatterns;
        private Integer maxImportContextKeys;

        private Builder() {
        }

        public Builder dbPath(String dbPath) { this.dbPath = dbPath; return this; }
        public Builder maxDecisions(int v) { this.maxDecisions = v; return this; }
        public Builder maxPatterns(int v) { this.maxPatterns = v; return this; }
        public Builder maxContextKeys(int v) { this.maxContextKeys = v; return this; }
        public Builder poolSize(int v) { this.poolSize = v; return this; }
        public Builder acquireTimeout(Duration v) { this.acquireTimeout = v; return this; }
        public Builder warmUp(boolean v) { this.warmUp = v; return this; }
        public Builder rateLimit(int v) { this.rateLimit = v; return this; }
        public Builder rateLimitWindow(Duration v) { this.rateLimitWindow = v; return this; }
        public Builder persistRateLimit(boolean v) { this.persistRateLimit = v; return this; }
        public Builder readOnly(boolean v) { this.readOnly = v; return this; }
        public Builder maxTextLength(int v) { this.maxTextLength = v; return this; }
        public Builder capacityWarningPercent(int v) { this.capacityWarningPercent = v; return this; }
        public Builder healthCheckTimeout(Duration v) { this.healthCheckTimeout = v; return this; }
        public Builder maxImportBytes(long v) { this.maxImportBytes = v; return this; }
        public Builder maxImportDecisions(int v) { this.maxImportDecisions = v; return this; }
        public Builder maxImportPatterns(int v) { this.maxImportPatterns = v; return this; }
        public Builder maxImportContextKeys(int v) { this.maxImportContextKeys = v; return this; }

        public MemoryProperties build() {
            return new MemoryProperties(dbPath, maxDecisions, maxPatterns, maxContextKeys, poolSize,
                    acquireTimeout, warmUp, rateLimit, rateLimitWindow, persistRateLimit, readOnly,
                    maxTextLength, capacityWarningPercent, healthCheckTimeout, maxImportBytes,
                    maxImportDecisions, maxImportPatterns, maxImportContextKeys);
        }
    }
}
