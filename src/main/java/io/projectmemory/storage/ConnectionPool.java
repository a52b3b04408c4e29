package io.projectmemory.storage;

import io.projectmemory.error.PoolExhaustedException;
import io.projectmemory.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size pool of SQLite connections shared by all callers of one process.
 *
 * <p>At most {@code capacity} connections are handed out at once. {@link #acquire(Duration)}
 * blocks until one is returned or the timeout elapses, then fails with
 * {@link PoolExhaustedException} instead of queuing without bound. This is the service's only
 * backpressure point. Writers are still serialized by SQLite itself, so the pool size bounds
 * reader fan-out, not write ordering.</p>
 */
public class ConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final StorageEngine storage;
    private final int capacity;
    private final Duration defaultTimeout;
    private final Semaphore permits;
    private final ConcurrentLinkedQueue<Connection> idle = new ConcurrentLinkedQueue<>();
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicLong exhaustionCount = new AtomicLong();
    private volatile boolean warmedUp;
    private volatile boolean closed;

    public ConnectionPool(StorageEngine storage, int capacity, Duration defaultTimeout) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Pool capacity must be at least 1");
        }
        this.storage = storage;
        this.capacity = capacity;
        this.defaultTimeout = defaultTimeout;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Opens every connection up front so the first callers do not pay the open cost.
     */
    public void warmUp() {
        ensureOpen();
        int missing = capacity - opened.get();
        for (int i = 0; i < missing; i++) {
            idle.offer(storage.openConnection());
            opened.incrementAndGet();
        }
        warmedUp = true;
        log.info("Connection pool warmed up with {} connections", capacity);
    }

    /** Acquires a connection, waiting at most the configured default timeout. */
    public Connection acquire() {
        return acquire(defaultTimeout);
    }

    /**
     * Acquires a connection, waiting at most {@code timeout} for one to be released.
     *
     * @throws PoolExhaustedException if none became free in time or the wait was interrupted
     */
    public Connection acquire(Duration timeout) {
        ensureOpen();
        boolean granted;
        try {
            granted = permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolExhaustedException("Interrupted while waiting for a database connection", e);
        }
        if (!granted) {
            long exhaustions = exhaustionCount.incrementAndGet();
            log.warn("Connection pool exhausted after waiting {} ms (pool size {}, total exhaustions {})",
                    timeout.toMillis(), capacity, exhaustions);
            throw new PoolExhaustedException(capacity, timeout);
        }

        Connection connection = idle.poll();
        if (connection != null && isUsable(connection)) {
            return connection;
        }
        if (connection != null) {
            opened.decrementAndGet();
            StorageEngine.closeQuietly(connection);
        }
        try {
            Connection fresh = storage.openConnection();
            opened.incrementAndGet();
            return fresh;
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /** Returns a connection to the pool and wakes one waiting caller. */
    public void release(Connection connection) {
        if (connection == null) return;
        if (closed) {
            opened.decrementAndGet();
            StorageEngine.closeQuietly(connection);
        } else {
            idle.offer(connection);
        }
        permits.release();
    }

    /**
     * Runs {@code work} with a pooled connection and always releases it, including when the
     * work throws.
     */
    public <T> T withConnection(PooledWork<T> work) {
        Connection connection = acquire();
        try {
            return work.apply(connection);
        } finally {
            release(connection);
        }
    }

    public PoolStats stats() {
        int available = permits.availablePermits();
        return new PoolStats(capacity, available, capacity - available, exhaustionCount.get(), warmedUp);
    }

    public int capacity() {
        return capacity;
    }

    /** Closes all idle connections. Connections still handed out are closed on release. */
    @Override
    public void close() {
        closed = true;
        Connection connection;
        int closedCount = 0;
        while ((connection = idle.poll()) != null) {
            StorageEngine.closeQuietly(connection);
            opened.decrementAndGet();
            closedCount++;
        }
        log.info("Connection pool closed ({} connections)", closedCount);
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Connection pool is closed", null);
        }
    }

    private static boolean isUsable(Connection connection) {
        try {
            return !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    /** Work run against a pooled connection. */
    @FunctionalInterface
    public interface PooledWork<T> {
        T apply(Connection connection);
    }
}
