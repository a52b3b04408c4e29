package io.projectmemory.memory;

import io.projectmemory.MutableClock;
import io.projectmemory.error.CapacityExceededException;
import io.projectmemory.error.PermissionDeniedException;
import io.projectmemory.error.ValidationException;
import io.projectmemory.security.InputValidator;
import io.projectmemory.storage.ConnectionPool;
import io.projectmemory.storage.StorageEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteMemoryStoreTest {

    @TempDir
    Path tempDir;

    private StorageEngine storage;
    private ConnectionPool pool;
    private MutableClock clock;
    private SQLiteMemoryStore store;

    @BeforeEach
    void setUp() {
        storage = StorageEngine.open(tempDir.resolve("memory.db"));
        pool = new ConnectionPool(storage, 3, Duration.ofSeconds(5));
        clock = MutableClock.startingAt("2025-03-01T12:00:00Z");
        store = newStore(new MemoryLimits(3, 2, 2), false);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private SQLiteMemoryStore newStore(MemoryLimits limits, boolean readOnly) {
        return new SQLiteMemoryStore(storage, pool, new InputValidator(200), limits, readOnly, clock);
    }

    @Test
    void shouldRememberAndRecallDecision() {
        long id = store.rememberDecision("Use SQLite", "Zero setup", "storage choice", "Postgres");

        List<Decision> decisions = store.recallDecisions(null, null);
        assertEquals(1, decisions.size());
        Decision decision = decisions.get(0);
        assertEquals(id, decision.id());
        assertEquals("Use SQLite", decision.decision());
        assertEquals("Zero setup", decision.rationale());
        assertEquals("storage choice", decision.context());
        assertEquals("Postgres", decision.alternatives());
        assertEquals(Instant.parse("2025-03-01T12:00:00Z"), decision.timestamp());
    }

    @Test
    void shouldStoreEmptyOptionalFields() {
        store.rememberDecision("d", "r", null, null);

        Decision decision = store.recallDecisions(null, null).get(0);
        assertEquals("", decision.context());
        assertEquals("", decision.alternatives());
    }

    @Test
    void shouldEvictOnlyTheOldestDecision() {
        long d1 = store.rememberDecision("D1", "r1", null, null);
        long d2 = store.rememberDecision("D2", "r2", null, null);
        long d3 = store.rememberDecision("D3", "r3", null, null);
        long d4 = store.rememberDecision("D4", "r4", null, null);

        List<Decision> recalled = store.recallDecisions(null, null);

        assertEquals(List.of(d4, d3, d2), recalled.stream().map(Decision::id).toList());
        assertEquals(List.of("D4", "D3", "D2"), recalled.stream().map(Decision::decision).toList());
        assertTrue(recalled.stream().noneMatch(d -> d.id() == d1));
        assertEquals(3, store.stats().decisions());
    }

    @Test
    void shouldNeverReuseDecisionIds() {
        long first = store.rememberDecision("a", "r", null, null);
        store.purge(ProjectMemory.PURGE_CONFIRMATION);

        long second = store.rememberDecision("b", "r", null, null);

        assertTrue(second > first);
    }

    @Test
    void shouldFilterByKeywordCaseInsensitively() {
        store.rememberDecision("Adopt Redis cache", "latency", null, null);
        store.rememberDecision("Use JSON logs", "easier to parse in CACHE layer", null, null);
        store.rememberDecision("Pick JUnit", "standard", null, null);

        List<Decision> hits = store.recallDecisions("cache", null);

        assertEquals(List.of("Use JSON logs", "Adopt Redis cache"), hits.stream().map(Decision::decision).toList());
    }

    @Test
    void shouldFoldNonAsciiLettersWhenFiltering() {
        store.rememberDecision("Ärger vermeiden", "Straße bleibt frei", null, null);
        store.rememberDecision("Keep it simple", "nothing special", null, null);

        assertEquals(1, store.recallDecisions("ärger", null).size());
        assertEquals(1, store.recallDecisions("ÄRGER", null).size());
        assertEquals(1, store.recallDecisions("STRAßE", null).size());
    }

    @Test
    void shouldMatchWildcardCharactersLiterally() {
        store.rememberDecision("Coverage at 100%", "gate", null, null);
        store.rememberDecision("Coverage at 1000", "gate", null, null);
        store.rememberDecision("snake_case names", "style", null, null);
        store.rememberDecision("snakeXcase names", "style", null, null);

        assertEquals(1, store.recallDecisions("100%", null).size());
        assertEquals(1, store.recallDecisions("snake_case", null).size());
    }

    @Test
    void shouldClampRecallLimit() {
        store.rememberDecision("a", "r", null, null);
        store.rememberDecision("b", "r", null, null);
        store.rememberDecision("c", "r", null, null);

        assertEquals(1, store.recallDecisions(null, 0).size());
        assertEquals(2, store.recallDecisions(null, 2).size());
        assertEquals(3, store.recallDecisions(null, 50).size());
        assertEquals("c", store.recallDecisions(null, 1).get(0).decision());
    }

    @Test
    void shouldRejectDecisionWithoutRationale() {
        assertThrows(ValidationException.class, () -> store.rememberDecision("d", "  ", null, null));
        assertEquals(0, store.stats().decisions());
    }

    @Test
    void shouldTruncateLongText() {
        store.rememberDecision("x".repeat(500), "r", null, null);

        String stored = store.recallDecisions(null, null).get(0).decision();
        assertEquals("x".repeat(200) + InputValidator.TRUNCATION_MARKER, stored);
    }

    @Test
    void shouldReplacePatternInPlace() {
        store.storePattern("a", "first", "ex1", "when1");
        clock.advance(Duration.ofMinutes(1));
        store.storePattern("a", "updated", "ex2", "when2");

        List<Pattern> patterns = store.getPatterns();
        assertEquals(1, patterns.size());
        Pattern pattern = patterns.get(0);
        assertEquals("updated", pattern.description());
        assertEquals("ex2", pattern.example());
        assertEquals("when2", pattern.whenToUse());
        assertEquals(Instant.parse("2025-03-01T12:01:00Z"), pattern.updatedAt());
    }

    @Test
    void shouldRejectNewPatternWhenFullButAcceptUpdates() {
        store.storePattern("a", "A", null, null);
        store.storePattern("b", "B", null, null);

        assertThrows(CapacityExceededException.class, () -> store.storePattern("c", "C", null, null));
        assertDoesNotThrow(() -> store.storePattern("a", "A2", null, null));

        assertEquals(2, store.stats().patterns());
        assertTrue(store.getPatterns().stream().noneMatch(p -> p.name().equals("c")));
    }

    @Test
    void shouldRejectIllegalPatternName() {
        assertThrows(ValidationException.class, () -> store.storePattern("has space", "d", null, null));
        assertThrows(ValidationException.class, () -> store.storePattern("a/b", "d", null, null));
    }

    @Test
    void shouldOverwriteContextValue() {
        store.setContext("k", "v1");
        store.setContext("k", "v2");

        assertEquals(Map.of("k", "v2"), store.getContext());
        assertEquals(1, store.stats().contextKeys());
    }

    @Test
    void shouldRejectNewContextKeyWhenFull() {
        store.setContext("k1", "v");
        store.setContext("k2", "v");

        assertThrows(CapacityExceededException.class, () -> store.setContext("k3", "v"));
        store.setContext("k2", "changed");
        assertEquals("changed", store.getContext().get("k2"));
    }

    @Test
    void shouldRequireContextValue() {
        assertThrows(ValidationException.class, () -> store.setContext("k", ""));
    }

    @Test
    void shouldReportStatsWithLimitsAndSize() {
        store.rememberDecision("abc", "de", "", "");
        store.storePattern("p", "xyz", null, null);
        store.setContext("k", "vv");

        MemoryStats stats = store.stats();

        assertEquals(1, stats.decisions());
        assertEquals(1, stats.patterns());
        assertEquals(1, stats.contextKeys());
        assertEquals(new MemoryLimits(3, 2, 2), stats.limits());
        assertEquals(5 + 4 + 3, stats.approximateSizeBytes());
        assertEquals(50.0, stats.utilizationPercent(MemoryTable.PATTERNS));
    }

    @Test
    void shouldCountMultiByteTextInBytes() {
        store.setContext("k", "é");

        assertEquals(3, store.stats().approximateSizeBytes());
    }

    @Test
    void shouldLeaveTablesUntouchedWithoutConfirmation() {
        store.rememberDecision("d", "r", null, null);
        store.storePattern("p", "d", null, null);
        store.setContext("k", "v");

        assertThrows(PermissionDeniedException.class, () -> store.purge(null));
        assertThrows(PermissionDeniedException.class, () -> store.purge("confirm_purge"));
        assertThrows(PermissionDeniedException.class, () -> store.purge("CONFIRM_PURGE "));

        MemoryStats stats = store.stats();
        assertEquals(1, stats.decisions());
        assertEquals(1, stats.patterns());
        assertEquals(1, stats.contextKeys());
    }

    @Test
    void shouldPurgeEverythingAndBeIdempotent() {
        store.rememberDecision("d", "r", null, null);
        store.storePattern("p", "d", null, null);
        store.setContext("k", "v");

        PurgeResult first = store.purge(ProjectMemory.PURGE_CONFIRMATION);
        PurgeResult second = store.purge(ProjectMemory.PURGE_CONFIRMATION);

        assertEquals(new PurgeResult(1, 1, 1), first);
        assertEquals(new PurgeResult(0, 0, 0), second);
        MemoryStats stats = store.stats();
        assertEquals(0, stats.decisions() + stats.patterns() + stats.contextKeys());
    }

    @Test
    void shouldRejectEveryWriteInReadOnlyMode() {
        store.setContext("k", "v");
        SQLiteMemoryStore readOnly = newStore(new MemoryLimits(3, 2, 2), true);

        assertThrows(PermissionDeniedException.class, () -> readOnly.rememberDecision("d", "r", null, null));
        assertThrows(PermissionDeniedException.class, () -> readOnly.storePattern("p", "d", null, null));
        assertThrows(PermissionDeniedException.class, () -> readOnly.setContext("k", "v2"));
        assertThrows(PermissionDeniedException.class, () -> readOnly.purge(ProjectMemory.PURGE_CONFIRMATION));
        assertThrows(PermissionDeniedException.class, () -> readOnly.replaceAll(List.of(), List.of(), Map.of()));

        assertEquals(Map.of("k", "v"), readOnly.getContext());
        assertTrue(readOnly.isReadOnly());
    }

    @Test
    void shouldRejectReadOnlyWriteEvenWhenInputIsInvalid() {
        SQLiteMemoryStore readOnly = newStore(new MemoryLimits(3, 2, 2), true);

        assertThrows(PermissionDeniedException.class, () -> readOnly.setContext("bad key", ""));
    }

    @Test
    void shouldDumpInIdOrder() {
        store.rememberDecision("first", "r", null, null);
        store.rememberDecision("second", "r", null, null);
        store.setContext("b", "2");
        store.setContext("a", "1");

        MemoryDump dump = store.dump();

        assertEquals(List.of("first", "second"), dump.decisions().stream().map(Decision::decision).toList());
        assertEquals(List.of("a", "b"), new ArrayList<>(dump.context().keySet()));
        assertEquals(2, dump.stats().decisions());
    }

    @Test
    void shouldReplaceAllContentsAtomically() {
        store.rememberDecision("old", "r", null, null);
        store.storePattern("old-pattern", "d", null, null);
        store.setContext("old", "v");

        ImportResult result = store.replaceAll(
                List.of(new Decision(0, Instant.parse("2024-01-01T00:00:00Z"), "imported", "why", "", "")),
                List.of(new Pattern("p1", "desc", "", "", null)),
                Map.of("k", "v"));

        assertEquals(new ImportResult(1, 1, 1, 0), result);
        Decision decision = store.recallDecisions(null, null).get(0);
        assertEquals("imported", decision.decision());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), decision.timestamp());
        assertEquals(List.of("p1"), store.getPatterns().stream().map(Pattern::name).toList());
        assertEquals(Map.of("k", "v"), store.getContext());
    }

    @Test
    void shouldKeepOldContentsWhenReplacementBreaksKeyedLimit() {
        store.setContext("keep", "me");

        assertThrows(CapacityExceededException.class, () -> store.replaceAll(List.of(), List.of(),
                Map.of("a", "1", "b", "2", "c", "3")));

        assertEquals(Map.of("keep", "me"), store.getContext());
    }

    @Test
    void shouldRejectReplacementWithIllegalKeyBeforeTouchingStorage() {
        store.setContext("keep", "me");

        assertThrows(ValidationException.class, () -> store.replaceAll(List.of(),
                List.of(new Pattern("bad name", "d", "", "", null)), Map.of()));

        assertEquals(Map.of("keep", "me"), store.getContext());
    }

    @Test
    void shouldRejectReplacementRepeatingPatternName() {
        store.storePattern("keep", "d", null, null);

        ValidationException e = assertThrows(ValidationException.class, () -> store.replaceAll(List.of(),
                List.of(new Pattern("p1", "first", "", "", null), new Pattern("p1", "second", "", "", null)),
                Map.of()));

        assertEquals("patterns[1].name", e.getDetails().get("field"));
        assertEquals(List.of("keep"), store.getPatterns().stream().map(Pattern::name).toList());
    }

    @Test
    void shouldRingEvictExcessImportedDecisions() {
        List<Decision> decisions = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            decisions.add(new Decision(0, null, "D" + i, "r", "", ""));
        }

        ImportResult result = store.replaceAll(decisions, List.of(), Map.of());

        assertEquals(2, result.decisionsEvicted());
        assertEquals(List.of("D5", "D4", "D3"),
                store.recallDecisions(null, null).stream().map(Decision::decision).toList());
    }

    @Test
    void shouldSerializeConcurrentWritersWithoutLosingRows() throws Exception {
        SQLiteMemoryStore wide = newStore(new MemoryLimits(1000, 100, 50), false);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                int n = i;
                futures.add(executor.submit(() -> wide.rememberDecision("d" + n, "r", null, null)));
            }
            for (Future<Long> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(40, wide.stats().decisions());
    }
}
