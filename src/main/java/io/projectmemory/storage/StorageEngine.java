package io.projectmemory.storage;

import io.projectmemory.error.StorageException;
import io.projectmemory.error.StorageIntegrityException;
import org.slf4j.Logger;
import org.sqlite.Function;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * File-backed SQLite storage for one project memory.
 *
 * <p>Every connection runs in WAL journal mode, so readers never block the single writer. Write
 * units start with {@code BEGIN IMMEDIATE}, which makes SQLite serialize writers; read units start
 * with a deferred {@code BEGIN} and see one consistent snapshot.</p>
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code decisions} is the append log, ids from AUTOINCREMENT so they are never reused</li>
 *   <li>{@code patterns} is keyed by {@code name}</li>
 *   <li>{@code context} is keyed by {@code key}</li>
 * </ul>
 *
 * <p>A corrupt or unreadable file latches the engine into a failed state: every later call throws
 * the same {@link StorageIntegrityException} until the process is restarted.</p>
 */
public class StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(StorageEngine.class);

    private static final int SQLITE_CORRUPT = 11;
    private static final int SQLITE_NOTADB = 26;

    /**
     * SQL function registered on every connection that lower-cases text with full Unicode rules.
     * SQLite's own {@code LIKE} and {@code lower()} only fold ASCII letters.
     */
    public static final String FOLD_FUNCTION = "unicode_fold";

    private final Path dbPath;
    private final String jdbcUrl;
    private final AtomicReference<StorageIntegrityException> failure = new AtomicReference<>();

    private StorageEngine(Path dbPath) {
        this.dbPath = dbPath;
        this.jdbcUrl = "jdbc:sqlite:" + dbPath;
    }

    /**
     * Opens the database, creating the file and schema on first use.
     *
     * @throws StorageIntegrityException if the file exists but is not a readable database
     * @throws StorageException          if the file cannot be created or opened
     */
    public static StorageEngine open(Path dbPath) {
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StorageException("Failed to create memory directory: " + parent, e);
            }
        }
        StorageEngine engine = new StorageEngine(dbPath);
        try (Connection connection = engine.openConnection()) {
            engine.createSchema(connection);
        } catch (SQLException e) {
            throw engine.translate(e, "initialize schema");
        }
        log.info("Project memory storage opened at: {}", dbPath);
        return engine;
    }

    /** Opens a new connection configured for WAL concurrency. Callers own the connection. */
    public Connection openConnection() {
        ensureUsable();
        Connection connection = null;
        try {
            connection = DriverManager.getConnection(jdbcUrl);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute("PRAGMA temp_store=MEMORY");
            }
            Function.create(connection, FOLD_FUNCTION, new UnicodeFold());
            return connection;
        } catch (SQLException e) {
            closeQuietly(connection);
            throw translate(e, "open connection");
        }
    }

    private void createSchema(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS decisions (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    timestamp TEXT NOT NULL,
                    decision TEXT NOT NULL,
                    rationale TEXT NOT NULL,
                    context TEXT NOT NULL DEFAULT '',
                    alternatives TEXT NOT NULL DEFAULT ''
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS patterns (
                    name TEXT PRIMARY KEY,
                    description TEXT NOT NULL,
                    example TEXT NOT NULL DEFAULT '',
                    when_to_use TEXT NOT NULL DEFAULT '',
                    updated_at TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS context (
                    key TEXT PRIMARY KEY,
                    value TEXT NOT NULL,
                    updated_at TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_decisions_timestamp ON decisions(timestamp)
                """);
        }
    }

    /**
     * Runs a unit of work atomically on the given connection. All writes inside succeed or none
     * do: any exception rolls the transaction back and is rethrown.
     */
    public <T> T execute(Connection connection, TransactionMode mode, SqlWork<T> work) {
        ensureUsable();
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(mode.beginStatement());
        } catch (SQLException e) {
            throw translate(e, "begin transaction");
        }

        T result;
        try {
            result = work.apply(connection);
        } catch (SQLException e) {
            rollback(connection);
            throw translate(e, "execute " + mode.name().toLowerCase() + " transaction");
        } catch (RuntimeException e) {
            rollback(connection);
            throw e;
        }

        try (Statement stmt = connection.createStatement()) {
            stmt.execute("COMMIT");
        } catch (SQLException e) {
            rollback(connection);
            throw translate(e, "commit transaction");
        }
        return result;
    }

    /**
     * Runs {@code PRAGMA integrity_check}. A failed check latches the engine into the failed state.
     *
     * @return true when SQLite reports {@code ok}
     */
    public boolean integrityCheck(Connection connection) {
        ensureUsable();
        try (Statement stmt = connection.createStatement();
             var rs = stmt.executeQuery("PRAGMA integrity_check")) {
            String result = rs.next() ? rs.getString(1) : "no result";
            if ("ok".equalsIgnoreCase(result)) {
                return true;
            }
            markFailed(new StorageIntegrityException("Integrity check failed for " + dbPath + ": " + result));
            return false;
        } catch (SQLException e) {
            RuntimeException translated = translate(e, "run integrity check");
            if (translated instanceof StorageIntegrityException) {
                return false;
            }
            throw translated;
        }
    }

    /**
     * Verifies the store accepts writes by inserting a probe row inside a transaction that is
     * always rolled back.
     */
    public void probeWrite(Connection connection) {
        ensureUsable();
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(TransactionMode.WRITE.beginStatement());
            try {
                stmt.executeUpdate(
                        "INSERT OR REPLACE INTO context (key, value, updated_at) VALUES ('_health_check', 'probe', 'probe')");
            } finally {
                stmt.execute("ROLLBACK");
            }
        } catch (SQLException e) {
            throw translate(e, "probe write capability");
        }
    }

    /** The latched integrity failure, if any. */
    public StorageIntegrityException failure() {
        return failure.get();
    }

    public boolean isFailed() {
        return failure.get() != null;
    }

    public Path path() {
        return dbPath;
    }

    /** Size of the database file plus its WAL, in bytes. */
    public long fileSizeBytes() {
        return sizeOf(dbPath) + sizeOf(Path.of(dbPath + "-wal"));
    }

    /**
     * Maps a SQLException onto the service taxonomy. Corruption latches the engine; any other
     * failure is reported as a plain storage error.
     */
    public RuntimeException translate(SQLException e, String action) {
        int code = e.getErrorCode() & 0xff;
        if (code == SQLITE_CORRUPT || code == SQLITE_NOTADB) {
            StorageIntegrityException integrity = new StorageIntegrityException(
                    "Database at %s is unreadable or corrupt (failed to %s): %s".formatted(dbPath, action, e.getMessage()), e);
            markFailed(integrity);
            return failure.get();
        }
        return new StorageException("Failed to " + action + ": " + e.getMessage(), e);
    }

    private void markFailed(StorageIntegrityException e) {
        if (failure.compareAndSet(null, e)) {
            log.error("Storage integrity failure, memory service is unavailable until recovered: {}", e.getMessage());
        }
    }

    private void ensureUsable() {
        StorageIntegrityException latched = failure.get();
        if (latched != null) {
            throw latched;
        }
    }

    /**
     * Rolls back the open transaction. A connection whose rollback fails may still hold the
     * transaction, so it is closed; the pool discards closed connections on the next acquire.
     */
    private void rollback(Connection connection) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("ROLLBACK");
        } catch (SQLException e) {
            log.warn("Rollback failed, closing connection: {}", e.getMessage());
            closeQuietly(connection);
        }
    }

    private static long sizeOf(Path path) {
        try {
            return Files.exists(path) ? Files.size(path) : 0L;
        } catch (IOException e) {
            log.debug("Could not read size of {}: {}", path, e.getMessage());
            return 0L;
        }
    }

    static void closeQuietly(Connection connection) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close SQLite connection", e);
        }
    }

    /** Lower-cases for keyword matching; must agree with {@link #fold(String)}. */
    public static String fold(String text) {
        return text == null ? null : text.toLowerCase(Locale.ROOT);
    }

    private static final class UnicodeFold extends Function {
        @Override
        protected void xFunc() throws SQLException {
            String text = value_text(0);
            if (text == null) {
                result();
            } else {
                result(fold(text));
            }
        }
    }

    /** How a unit of work opens its transaction. */
    public enum TransactionMode {
        /** Deferred transaction: a consistent snapshot that does not block the writer. */
        READ("BEGIN"),
        /** Takes the write lock up front so concurrent writers queue on the busy timeout. */
        WRITE("BEGIN IMMEDIATE");

        private final String beginStatement;

        TransactionMode(String beginStatement) {
            this.beginStatement = beginStatement;
        }

        String beginStatement() {
            return beginStatement;
        }
    }
}
