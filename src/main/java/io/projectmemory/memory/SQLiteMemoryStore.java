package io.projectmemory.memory;

import io.projectmemory.error.PermissionDeniedException;
import io.projectmemory.error.ValidationException;
import io.projectmemory.security.InputValidator;
import io.projectmemory.storage.ConnectionPool;
import io.projectmemory.storage.StorageEngine;
import io.projectmemory.storage.StorageEngine.TransactionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * SQLite-backed project memory.
 *
 * <p>Each public method runs Validation, then the Capacity Manager, then storage, inside exactly
 * one transaction on one pooled connection. Input is validated before a connection is acquired,
 * so rejected input never reaches the database.</p>
 */
public class SQLiteMemoryStore implements ProjectMemory {

    private static final Logger log = LoggerFactory.getLogger(SQLiteMemoryStore.class);

    private static final String DECISION_COLUMNS = "id, timestamp, decision, rationale, context, alternatives";

    private final StorageEngine storage;
    private final ConnectionPool pool;
    private final InputValidator validator;
    private final CapacityManager capacity;
    private final boolean readOnly;
    private final Clock clock;

    public SQLiteMemoryStore(StorageEngine storage, ConnectionPool pool, InputValidator validator,
                             MemoryLimits limits, boolean readOnly, Clock clock) {
        this.storage = storage;
        this.pool = pool;
        this.validator = validator;
        this.capacity = new CapacityManager(limits);
        this.readOnly = readOnly;
        this.clock = clock;
    }

    @Override
    public long rememberDecision(String decision, String rationale, String context, String alternatives) {
        requireWritable("remember_decision");
        DecisionRow row = validateDecision(decision, rationale, context, alternatives, Instant.now(clock));

        long id = write(tx -> {
            capacity.makeRoomForDecision(tx);
            return insertDecision(tx, row);
        });
        log.debug("Remembered decision id={}", id);
        return id;
    }

    @Override
    public List<Decision> recallDecisions(String keyword, Integer limit) {
        String filter = validator.sanitizeKeyword(keyword);
        int max = capacity.limits().maxDecisions();
        int effectiveLimit = limit == null ? max : Math.max(1, Math.min(limit, max));

        return read(tx -> {
            String sql;
            if (filter != null) {
                sql = "SELECT " + DECISION_COLUMNS + """
                     FROM decisions
                    WHERE %1$s(decision) LIKE ? ESCAPE '\\' OR %1$s(rationale) LIKE ? ESCAPE '\\'
                    ORDER BY id DESC
                    LIMIT ?
                    """.formatted(StorageEngine.FOLD_FUNCTION);
            } else {
                sql = "SELECT " + DECISION_COLUMNS + " FROM decisions ORDER BY id DESC LIMIT ?";
            }
            try (var stmt = tx.prepareStatement(sql)) {
                int index = 1;
                if (filter != null) {
                    String like = "%" + escapeLike(StorageEngine.fold(filter)) + "%";
                    stmt.setString(index++, like);
                    stmt.setString(index++, like);
                }
                stmt.setInt(index, effectiveLimit);
                return readDecisions(stmt.executeQuery());
            }
        });
    }

    @Override
    public void storePattern(String name, String description, String example, String whenToUse) {
        requireWritable("store_pattern");
        Pattern pattern = validatePattern(name, description, example, whenToUse, Instant.now(clock));

        boolean updated = write(tx -> upsertPattern(tx, pattern));
        log.debug("{} pattern '{}'", updated ? "Updated" : "Stored", pattern.name());
    }

    @Override
    public List<Pattern> getPatterns() {
        return read(this::selectPatterns);
    }

    @Override
    public void setContext(String key, String value) {
        requireWritable("set_context");
        String validKey = validator.requireKey(key, "key");
        String validValue = validator.requireText(value, "value");
        Instant now = Instant.now(clock);

        boolean updated = write(tx -> upsertContext(tx, validKey, validValue, now));
        log.debug("{} context key '{}'", updated ? "Updated" : "Stored", validKey);
    }

    @Override
    public Map<String, String> getContext() {
        return read(this::selectContext);
    }

    @Override
    public MemoryStats stats() {
        return read(this::selectStats);
    }

    @Override
    public PurgeResult purge(String confirmToken) {
        if (!PURGE_CONFIRMATION.equals(confirmToken)) {
            throw new PermissionDeniedException(
                    "purge_memory requires confirm='" + PURGE_CONFIRMATION + "'; nothing was deleted");
        }
        requireWritable("purge_memory");

        PurgeResult result = write(tx -> new PurgeResult(
                deleteAll(tx, MemoryTable.DECISIONS),
                deleteAll(tx, MemoryTable.PATTERNS),
                deleteAll(tx, MemoryTable.CONTEXT)));
        log.warn("Purged all memory: {} decisions, {} patterns, {} context keys",
                result.decisionsDeleted(), result.patternsDeleted(), result.contextDeleted());
        return result;
    }

    @Override
    public MemoryDump dump() {
        return read(tx -> {
            List<Decision> decisions;
            try (var stmt = tx.prepareStatement("SELECT " + DECISION_COLUMNS + " FROM decisions ORDER BY id ASC")) {
                decisions = readDecisions(stmt.executeQuery());
            }
            return new MemoryDump(decisions, selectPatterns(tx), selectContext(tx), selectStats(tx));
        });
    }

    @Override
    public ImportResult replaceAll(List<Decision> decisions, List<Pattern> patterns, Map<String, String> context) {
        requireWritable("import_memory");
        Instant now = Instant.now(clock);

        List<DecisionRow> decisionRows = new ArrayList<>();
        for (int i = 0; i < decisions.size(); i++) {
            Decision d = decisions.get(i);
            if (d == null) {
                throw new ValidationException("Decision at index " + i + " must be an object");
            }
            decisionRows.add(withIndex("Decision", i, () ->
                    validateDecision(d.decision(), d.rationale(), d.context(), d.alternatives(),
                            d.timestamp() != null ? d.timestamp() : now)));
        }
        List<Pattern> patternRows = new ArrayList<>();
        Set<String> patternNames = new HashSet<>();
        for (int i = 0; i < patterns.size(); i++) {
            Pattern p = patterns.get(i);
            if (p == null) {
                throw new ValidationException("Pattern at index " + i + " must be an object");
            }
            Pattern row = withIndex("Pattern", i, () ->
                    validatePattern(p.name(), p.description(), p.example(), p.whenToUse(),
                            p.updatedAt() != null ? p.updatedAt() : now));
            if (!patternNames.add(row.name())) {
                throw new ValidationException("Pattern at index %d repeats the name '%s'".formatted(i, row.name()),
                        Map.of("field", "patterns[" + i + "].name"));
            }
            patternRows.add(row);
        }
        Map<String, String> contextRows = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : context.entrySet()) {
            String key = validator.requireKey(entry.getKey(), "context key");
            contextRows.put(key, validator.requireText(entry.getValue(), "context." + key));
        }

        ImportResult result = write(tx -> {
            deleteAll(tx, MemoryTable.DECISIONS);
            deleteAll(tx, MemoryTable.PATTERNS);
            deleteAll(tx, MemoryTable.CONTEXT);

            int evicted = 0;
            for (DecisionRow row : decisionRows) {
                evicted += capacity.makeRoomForDecision(tx);
                insertDecision(tx, row);
            }
            for (Pattern pattern : patternRows) {
                upsertPattern(tx, pattern);
            }
            for (Map.Entry<String, String> entry : contextRows.entrySet()) {
                upsertContext(tx, entry.getKey(), entry.getValue(), now);
            }
            return new ImportResult(decisionRows.size(), patternRows.size(), contextRows.size(), evicted);
        });
        log.info("Replaced memory contents: {}", result);
        return result;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    // --- validation -------------------------------------------------------------------------

    private DecisionRow validateDecision(String decision, String rationale, String context,
                                         String alternatives, Instant timestamp) {
        return new DecisionRow(
                timestamp,
                validator.requireText(decision, "decision"),
                validator.requireText(rationale, "rationale"),
                validator.optionalText(context),
                validator.optionalText(alternatives));
    }

    private Pattern validatePattern(String name, String description, String example, String whenToUse,
                                    Instant updatedAt) {
        return new Pattern(
                validator.requireKey(name, "name"),
                validator.requireText(description, "description"),
                validator.optionalText(example),
                validator.optionalText(whenToUse),
                updatedAt);
    }

    private static <T> T withIndex(String what, int index, Supplier<T> validation) {
        try {
            return validation.get();
        } catch (ValidationException e) {
            throw new ValidationException(what + " at index " + index + ": " + e.getMessage(), e.getDetails());
        }
    }

    private void requireWritable(String operation) {
        if (readOnly) {
            throw new PermissionDeniedException("Memory is in read-only mode; " + operation + " is not allowed");
        }
    }

    // --- statements -------------------------------------------------------------------------

    private long insertDecision(Connection tx, DecisionRow row) throws SQLException {
        try (var stmt = tx.prepareStatement("""
                INSERT INTO decisions (timestamp, decision, rationale, context, alternatives)
                VALUES (?, ?, ?, ?, ?)
                """)) {
            stmt.setString(1, row.timestamp().toString());
            stmt.setString(2, row.decision());
            stmt.setString(3, row.rationale());
            stmt.setString(4, row.context());
            stmt.setString(5, row.alternatives());
            stmt.executeUpdate();
        }
        try (var stmt = tx.createStatement();
             var rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private boolean upsertPattern(Connection tx, Pattern pattern) throws SQLException {
        boolean exists = capacity.admitKeyed(tx, MemoryTable.PATTERNS, pattern.name());
        try (var stmt = tx.prepareStatement("""
                INSERT INTO patterns (name, description, example, when_to_use, updated_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT(name) DO UPDATE SET
                    description = excluded.description,
                    example = excluded.example,
                    when_to_use = excluded.when_to_use,
                    updated_at = excluded.updated_at
                """)) {
            stmt.setString(1, pattern.name());
            stmt.setString(2, pattern.description());
            stmt.setString(3, pattern.example());
            stmt.setString(4, pattern.whenToUse());
            stmt.setString(5, pattern.updatedAt().toString());
            stmt.executeUpdate();
        }
        return exists;
    }

    private boolean upsertContext(Connection tx, String key, String value, Instant now) throws SQLException {
        boolean exists = capacity.admitKeyed(tx, MemoryTable.CONTEXT, key);
        try (var stmt = tx.prepareStatement("""
                INSERT INTO context (key, value, updated_at)
                VALUES (?, ?, ?)
                ON CONFLICT(key) DO UPDATE SET
                    value = excluded.value,
                    updated_at = excluded.updated_at
                """)) {
            stmt.setString(1, key);
            stmt.setString(2, value);
            stmt.setString(3, now.toString());
            stmt.executeUpdate();
        }
        return exists;
    }

    private List<Pattern> selectPatterns(Connection tx) throws SQLException {
        List<Pattern> patterns = new ArrayList<>();
        try (var stmt = tx.createStatement();
             var rs = stmt.executeQuery(
                     "SELECT name, description, example, when_to_use, updated_at FROM patterns ORDER BY name")) {
            while (rs.next()) {
                patterns.add(new Pattern(
                        rs.getString("name"),
                        rs.getString("description"),
                        rs.getString("example"),
                        rs.getString("when_to_use"),
                        parseInstant(rs.getString("updated_at"))));
            }
        }
        return patterns;
    }

    private Map<String, String> selectContext(Connection tx) throws SQLException {
        Map<String, String> context = new LinkedHashMap<>();
        try (var stmt = tx.createStatement();
             var rs = stmt.executeQuery("SELECT key, value FROM context ORDER BY key")) {
            while (rs.next()) {
                context.put(rs.getString(1), rs.getString(2));
            }
        }
        return context;
    }

    private MemoryStats selectStats(Connection tx) throws SQLException {
        int decisions = CapacityManager.count(tx, MemoryTable.DECISIONS);
        int patterns = CapacityManager.count(tx, MemoryTable.PATTERNS);
        int contextKeys = CapacityManager.count(tx, MemoryTable.CONTEXT);
        long size = sumBytes(tx, "decisions", "decision", "rationale", "context", "alternatives")
                + sumBytes(tx, "patterns", "name", "description", "example", "when_to_use")
                + sumBytes(tx, "context", "key", "value");
        return new MemoryStats(decisions, patterns, contextKeys, capacity.limits(), size);
    }

    private static long sumBytes(Connection tx, String table, String... columns) throws SQLException {
        StringBuilder expr = new StringBuilder();
        for (String column : columns) {
            if (expr.length() > 0) expr.append(" + ");
            expr.append("LENGTH(CAST(").append(column).append(" AS BLOB))");
        }
        try (var stmt = tx.createStatement();
             var rs = stmt.executeQuery("SELECT COALESCE(SUM(" + expr + "), 0) FROM " + table)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private static int deleteAll(Connection tx, MemoryTable table) throws SQLException {
        try (var stmt = tx.createStatement()) {
            return stmt.executeUpdate("DELETE FROM " + table.tableName());
        }
    }

    private static List<Decision> readDecisions(ResultSet rs) throws SQLException {
        List<Decision> decisions = new ArrayList<>();
        try (rs) {
            while (rs.next()) {
                decisions.add(new Decision(
                        rs.getLong("id"),
                        parseInstant(rs.getString("timestamp")),
                        rs.getString("decision"),
                        rs.getString("rationale"),
                        rs.getString("context"),
                        rs.getString("alternatives")));
            }
        }
        return decisions;
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}' in store", value);
            return Instant.EPOCH;
        }
    }

    /** Escapes LIKE wildcards so the keyword is matched literally with {@code ESCAPE '\'}. */
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    // --- plumbing ---------------------------------------------------------------------------

    private <T> T write(StorageWork<T> work) {
        return pool.withConnection(conn -> storage.execute(conn, TransactionMode.WRITE, work::apply));
    }

    private <T> T read(StorageWork<T> work) {
        return pool.withConnection(conn -> storage.execute(conn, TransactionMode.READ, work::apply));
    }

    @FunctionalInterface
    private interface StorageWork<T> {
        T apply(Connection tx) throws SQLException;
    }

    private record DecisionRow(Instant timestamp, String decision, String rationale, String context,
                               String alternatives) {
    }
}
