package io.projectmemory.memory;

import io.projectmemory.error.CapacityExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Enforces the per-table maximums inside the write transaction, before commit.
 *
 * <ul>
 *   <li>Append log (decisions): a full table drops its lowest ids to make room. Never rejects.</li>
 *   <li>Keyed tables (patterns, context): a new key on a full table is rejected; an existing key
 *       is always accepted.</li>
 * </ul>
 */
public class CapacityManager {

    private static final Logger log = LoggerFactory.getLogger(CapacityManager.class);

    private final MemoryLimits limits;

    public CapacityManager(MemoryLimits limits) {
        this.limits = limits;
    }

    /**
     * Evicts the oldest decisions so one more fits.
     *
     * @return number of evicted rows, normally 0 or 1
     */
    public int makeRoomForDecision(Connection tx) throws SQLException {
        int count = count(tx, MemoryTable.DECISIONS);
        int max = limits.maxDecisions();
        if (count < max) {
            return 0;
        }
        int toEvict = count - max + 1;
        try (var stmt = tx.prepareStatement(
                "DELETE FROM decisions WHERE id IN (SELECT id FROM decisions ORDER BY id ASC LIMIT ?)")) {
            stmt.setInt(1, toEvict);
            int evicted = stmt.executeUpdate();
            log.debug("Evicted {} oldest decision(s) to stay within {}", evicted, max);
            return evicted;
        }
    }

    /**
     * Admits a write to a keyed table.
     *
     * @return true if the key already exists and the write is an update
     * @throws CapacityExceededException if the key is new and the table is full
     */
    public boolean admitKeyed(Connection tx, MemoryTable table, String key) throws SQLException {
        if (table.isAppendLog()) {
            throw new IllegalArgumentException(table + " is not a keyed table");
        }
        try (var stmt = tx.prepareStatement(
                "SELECT 1 FROM " + table.tableName() + " WHERE " + table.keyColumn() + " = ?")) {
            stmt.setString(1, key);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return true;
                }
            }
        }
        int limit = limits.limitFor(table);
        if (count(tx, table) >= limit) {
            log.debug("Rejected new key '{}' for full table {}", key, table.tableName());
            throw new CapacityExceededException(table.tableName(), limit);
        }
        return false;
    }

    public MemoryLimits limits() {
        return limits;
    }

    static int count(Connection tx, MemoryTable table) throws SQLException {
        try (var stmt = tx.createStatement();
             var rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table.tableName())) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }
}
