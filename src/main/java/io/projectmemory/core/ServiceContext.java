package io.projectmemory.core;

import io.projectmemory.config.MemoryProperties;
import io.projectmemory.error.MemoryException;
import io.projectmemory.health.MemoryHealthCheck;
import io.projectmemory.memory.ProjectMemory;
import io.projectmemory.memory.SQLiteMemoryStore;
import io.projectmemory.ratelimit.PersistentRateLimiter;
import io.projectmemory.ratelimit.RateLimiter;
import io.projectmemory.ratelimit.SlidingWindowRateLimiter;
import io.projectmemory.security.InputValidator;
import io.projectmemory.snapshot.SnapshotSerializer;
import io.projectmemory.storage.ConnectionPool;
import io.projectmemory.storage.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Process-wide state of the memory service: one storage engine, one connection pool and one rate
 * limiter, shared by every caller. Built once by {@link #start} and torn down by {@link #close}.
 */
public class ServiceContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceContext.class);

    private final MemoryProperties properties;
    private final StorageEngine storage;
    private final ConnectionPool pool;
    private final RateLimiter rateLimiter;
    private final ProjectMemory store;
    private final SnapshotSerializer serializer;
    private final MemoryHealthCheck healthCheck;
    private volatile boolean closed;

    private ServiceContext(MemoryProperties properties, StorageEngine storage, ConnectionPool pool,
                           RateLimiter rateLimiter, ProjectMemory store, SnapshotSerializer serializer,
                           MemoryHealthCheck healthCheck) {
        this.properties = properties;
        this.storage = storage;
        this.pool = pool;
        this.rateLimiter = rateLimiter;
        this.store = store;
        this.serializer = serializer;
        this.healthCheck = healthCheck;
    }

    public static ServiceContext start(MemoryProperties properties) {
        return start(properties, Clock.systemUTC());
    }

    /**
     * Opens storage, fills the pool and creates the rate limiter.
     *
     * @throws io.projectmemory.error.StorageIntegrityException if the database file is unreadable
     */
    public static ServiceContext start(MemoryProperties properties, Clock clock) {
        StorageEngine storage = StorageEngine.open(properties.resolveDatabasePath());
        ConnectionPool pool = new ConnectionPool(storage, properties.poolSize(), properties.acquireTimeout());
        return assemble(properties, storage, pool, clock);
    }

    /**
     * Builds the services on top of an opened pool. The limiter and the pool are closed again if
     * any step fails, so a failed start leaves no connections behind.
     */
    static ServiceContext assemble(MemoryProperties properties, StorageEngine storage, ConnectionPool pool,
                                   Clock clock) {
        RateLimiter rateLimiter = null;
        try {
            if (properties.warmUp()) {
                pool.warmUp();
            }
            rateLimiter = createRateLimiter(properties, storage, clock);

            String projectName = MemoryProperties.projectName(Path.of("").toAbsolutePath());
            InputValidator validator = new InputValidator(properties.maxTextLength());
            ProjectMemory store = new SQLiteMemoryStore(storage, pool, validator, properties.limits(),
                    properties.readOnly(), clock);
            SnapshotSerializer serializer = new SnapshotSerializer(store, properties, projectName, clock);
            MemoryHealthCheck healthCheck = new MemoryHealthCheck(storage, pool, store, rateLimiter,
                    properties.healthCheckTimeout(), properties.capacityWarningPercent(), properties.readOnly(), clock);

            log.info("Project memory started: db={}, limits={}, pool={}, rateLimit={}/{}s, readOnly={}",
                    storage.path(), properties.limits(), properties.poolSize(), properties.rateLimit(),
                    properties.rateLimitWindow().toSeconds(), properties.readOnly());
            return new ServiceContext(properties, storage, pool, rateLimiter, store, serializer, healthCheck);
        } catch (RuntimeException e) {
            if (rateLimiter != null) {
                rateLimiter.close();
            }
            pool.close();
            throw e;
        }
    }

    private static RateLimiter createRateLimiter(MemoryProperties properties, StorageEngine storage, Clock clock) {
        if (properties.persistRateLimit()) {
            try {
                return new PersistentRateLimiter(storage, properties.rateLimit(), properties.rateLimitWindow(), clock);
            } catch (MemoryException e) {
                log.warn("Rate limit persistence unavailable, falling back to in-memory limiter: {}", e.getMessage());
            }
        }
        return new SlidingWindowRateLimiter(properties.rateLimit(), properties.rateLimitWindow(), clock);
    }

    public MemoryProperties properties() {
        return properties;
    }

    public StorageEngine storage() {
        return storage;
    }

    public ConnectionPool pool() {
        return pool;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public ProjectMemory store() {
        return store;
    }

    public SnapshotSerializer serializer() {
        return serializer;
    }

    public MemoryHealthCheck healthCheck() {
        return healthCheck;
    }

    /** Flushes the rate limiter, then closes all pooled connections. Safe to call twice. */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        rateLimiter.close();
        pool.close();
        log.info("Project memory stopped");
    }
}
