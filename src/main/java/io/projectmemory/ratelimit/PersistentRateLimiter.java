package io.projectmemory.ratelimit;

import io.projectmemory.storage.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window limiter whose history survives restarts.
 *
 * <p>Operation timestamps go to the {@code rate_limit_ops} table of the memory database over a
 * dedicated connection, so rate limiting never takes capacity from the connection pool. Entries
 * older than the window are pruned every {@link #CLEANUP_INTERVAL} and on {@link #close()}.</p>
 *
 * <p>Persistence is best effort: a failed write is logged and the in-memory window stays
 * authoritative for the running process.</p>
 */
public class PersistentRateLimiter extends SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(PersistentRateLimiter.class);

    static final Duration CLEANUP_INTERVAL = Duration.ofMinutes(5);

    private final Connection connection;
    private Instant lastCleanup;

    /**
     * Opens the persistence table and reloads operations still inside the window.
     *
     * @throws io.projectmemory.error.StorageException if the table cannot be created or read
     */
    public PersistentRateLimiter(StorageEngine storage, int maxOperations, Duration window, Clock clock) {
        super(maxOperations, window, clock);
        this.connection = storage.openConnection();
        this.lastCleanup = clock.instant();
        try {
            createTable();
            restore(load(clock.instant().minus(window)));
        } catch (SQLException e) {
            closeConnection();
            throw storage.translate(e, "initialize rate limit persistence");
        }
    }

    private void createTable() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS rate_limit_ops (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    timestamp_ms INTEGER NOT NULL
                )
                """);
            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_rate_limit_timestamp ON rate_limit_ops(timestamp_ms)
                """);
        }
    }

    private List<Instant> load(Instant cutoff) throws SQLException {
        prune(cutoff);
        List<Instant> timestamps = new ArrayList<>();
        try (var stmt = connection.prepareStatement(
                "SELECT timestamp_ms FROM rate_limit_ops WHERE timestamp_ms > ? ORDER BY timestamp_ms")) {
            stmt.setLong(1, cutoff.toEpochMilli());
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    timestamps.add(Instant.ofEpochMilli(rs.getLong(1)));
                }
            }
        }
        log.info("Loaded {} rate limit operations from persistence", timestamps.size());
        return timestamps;
    }

    @Override
    protected void onRecorded(Instant timestamp, int cost) {
        try (var stmt = connection.prepareStatement("INSERT INTO rate_limit_ops (timestamp_ms) VALUES (?)")) {
            for (int i = 0; i < cost; i++) {
                stmt.setLong(1, timestamp.toEpochMilli());
                stmt.addBatch();
            }
            stmt.executeBatch();
        } catch (SQLException e) {
            log.warn("Failed to persist rate limit operation: {}", e.getMessage());
        }

        if (Duration.between(lastCleanup, timestamp).compareTo(CLEANUP_INTERVAL) >= 0) {
            lastCleanup = timestamp;
            pruneQuietly(timestamp.minus(window()));
        }
    }

    @Override
    public synchronized void reset() {
        super.reset();
        try (var stmt = connection.createStatement()) {
            stmt.executeUpdate("DELETE FROM rate_limit_ops");
        } catch (SQLException e) {
            log.warn("Failed to clear rate limit persistence: {}", e.getMessage());
        }
    }

    /** Prunes expired rows and closes the dedicated connection. */
    @Override
    public synchronized void close() {
        pruneQuietly(clock().instant().minus(window()));
        closeConnection();
        log.info("Persistent rate limiter closed");
    }

    private void prune(Instant cutoff) throws SQLException {
        try (var stmt = connection.prepareStatement("DELETE FROM rate_limit_ops WHERE timestamp_ms <= ?")) {
            stmt.setLong(1, cutoff.toEpochMilli());
            stmt.executeUpdate();
        }
    }

    private void pruneQuietly(Instant cutoff) {
        try {
            prune(cutoff);
        } catch (SQLException e) {
            log.warn("Failed to prune rate limit history: {}", e.getMessage());
        }
    }

    private void closeConnection() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close rate limiter connection", e);
        }
    }
}
