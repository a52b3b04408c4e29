package io.projectmemory.protocol;

import io.projectmemory.MutableClock;
import io.projectmemory.config.MemoryProperties;
import io.projectmemory.core.ServiceContext;
import io.projectmemory.error.ErrorKind;
import io.projectmemory.health.HealthReport;
import io.projectmemory.memory.Decision;
import io.projectmemory.memory.ImportResult;
import io.projectmemory.memory.MemoryStats;
import io.projectmemory.memory.PurgeResult;
import io.projectmemory.snapshot.MemorySnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolHandlerTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.startingAt("2025-07-01T00:00:00Z");
    private ServiceContext context;
    private ProtocolHandler handler;

    @AfterEach
    void tearDown() {
        if (context != null) {
            context.close();
        }
    }

    private void start(MemoryProperties.Builder builder) {
        context = ServiceContext.start(builder.dbPath(tempDir.resolve("memory.db").toString()).build(), clock);
        handler = new ProtocolHandler(context);
    }

    @Test
    void shouldRunFullDecisionFlow() {
        start(MemoryProperties.builder());

        OperationResponse remembered = handler.handle("remember_decision",
                Map.of("decision", "Use SQLite", "rationale", "Embedded"));
        OperationResponse recalled = handler.handle("recall_decisions", Map.of("keyword", "sqlite"));

        assertTrue(remembered.success());
        assertEquals("remember_decision", remembered.operation());
        assertNotNull(remembered.requestId());
        assertTrue(((Map<?, ?>) remembered.data()).get("id") instanceof Long);
        assertTrue(recalled.success());
        List<?> decisions = (List<?>) recalled.data();
        assertEquals(1, decisions.size());
        assertEquals("Use SQLite", ((Decision) decisions.get(0)).decision());
    }

    @Test
    void shouldHandlePatternsAndContext() {
        start(MemoryProperties.builder());

        assertTrue(handler.handle("store_pattern", Map.of("name", "builder", "description", "Fluent setup",
                "when_to_use", "many optional fields")).success());
        assertTrue(handler.handle("set_context", Map.of("key", "framework", "value", "Spring")).success());

        assertEquals(1, ((List<?>) handler.handle("get_patterns", Map.of()).data()).size());
        assertEquals(Map.of("framework", "Spring"), handler.handle("get_context", null).data());
        MemoryStats stats = (MemoryStats) handler.handle("memory_stats", Map.of()).data();
        assertEquals(1, stats.patterns());
        assertEquals(1, stats.contextKeys());
    }

    @Test
    void shouldRejectUnknownOperation() {
        start(MemoryProperties.builder());

        OperationResponse response = handler.handle("drop_tables", Map.of());

        assertFalse(response.success());
        assertEquals(ErrorKind.UNKNOWN_OPERATION, response.error().kind());
        assertNull(response.data());
    }

    @Test
    void shouldRejectMissingAndMistypedArguments() {
        start(MemoryProperties.builder());

        OperationResponse missing = handler.handle("remember_decision", Map.of("decision", "d"));
        OperationResponse mistyped = handler.handle("set_context", Map.of("key", "k", "value", 42));
        OperationResponse badLimit = handler.handle("recall_decisions", Map.of("limit", "ten"));

        assertEquals(ErrorKind.VALIDATION_ERROR, missing.error().kind());
        assertEquals("rationale", missing.error().details().get("field"));
        assertEquals(ErrorKind.VALIDATION_ERROR, mistyped.error().kind());
        assertEquals(ErrorKind.VALIDATION_ERROR, badLimit.error().kind());
        assertFalse(missing.error().retryable());
    }

    @Test
    void shouldAcceptIntegralLimitOfAnyNumberType() {
        start(MemoryProperties.builder());
        handler.handle("remember_decision", Map.of("decision", "a", "rationale", "r"));
        handler.handle("remember_decision", Map.of("decision", "b", "rationale", "r"));

        OperationResponse response = handler.handle("recall_decisions", Map.of("limit", 1.0));

        assertEquals(1, ((List<?>) response.data()).size());
    }

    @Test
    void shouldReportCapacityDistinctFromValidation() {
        start(MemoryProperties.builder().maxContextKeys(1));
        handler.handle("set_context", Map.of("key", "a", "value", "1"));

        OperationResponse response = handler.handle("set_context", Map.of("key", "b", "value", "2"));

        assertEquals(ErrorKind.CAPACITY_EXCEEDED, response.error().kind());
    }

    @Test
    void shouldRateLimitAfterConfiguredCallsAndRecover() {
        start(MemoryProperties.builder().rateLimit(3));
        for (int i = 0; i < 3; i++) {
            assertTrue(handler.handle("get_context", Map.of()).success());
        }

        OperationResponse limited = handler.handle("get_context", Map.of());

        assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, limited.error().kind());
        assertTrue(limited.error().retryable());
        assertEquals(0, limited.error().details().get("remaining"));
        assertEquals(60_000L, limited.error().details().get("retry_after_ms"));

        clock.advance(Duration.ofSeconds(60));
        assertTrue(handler.handle("get_context", Map.of()).success());
    }

    @Test
    void shouldRateLimitBeforeTouchingPool() {
        start(MemoryProperties.builder().rateLimit(1).poolSize(1).acquireTimeout(Duration.ofMillis(50)));
        handler.handle("get_context", Map.of());
        Connection held = context.pool().acquire();
        try {
            OperationResponse response = handler.handle("get_context", Map.of());

            assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, response.error().kind());
            assertEquals(0, context.pool().stats().exhaustionCount());
        } finally {
            context.pool().release(held);
        }
    }

    @Test
    void shouldCheckRateLimitBeforeArgumentShape() {
        start(MemoryProperties.builder().rateLimit(1));
        handler.handle("get_patterns", Map.of());

        OperationResponse response = handler.handle("set_context", Map.of());

        assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, response.error().kind());
    }

    @Test
    void shouldNotRateLimitExemptOperations() {
        start(MemoryProperties.builder().rateLimit(1));
        handler.handle("get_context", Map.of());

        assertTrue(handler.handle("memory_stats", Map.of()).success());
        assertTrue(handler.handle("health_check", Map.of()).success());
        assertTrue(handler.handle("export_memory", Map.of()).success());
        assertFalse(handler.handle("purge_memory", Map.of()).error().kind() == ErrorKind.RATE_LIMIT_EXCEEDED);
    }

    @Test
    void shouldReportPoolExhaustionAsRetryable() {
        start(MemoryProperties.builder().poolSize(1).acquireTimeout(Duration.ofMillis(50)));
        Connection held = context.pool().acquire();
        try {
            OperationResponse response = handler.handle("get_context", Map.of());

            assertEquals(ErrorKind.POOL_EXHAUSTED, response.error().kind());
            assertTrue(response.error().retryable());
        } finally {
            context.pool().release(held);
        }
    }

    @Test
    void shouldRequireExactPurgeConfirmation() {
        start(MemoryProperties.builder());
        handler.handle("set_context", Map.of("key", "k", "value", "v"));

        OperationResponse missing = handler.handle("purge_memory", Map.of());
        OperationResponse wrong = handler.handle("purge_memory", Map.of("confirm", "yes"));

        assertEquals(ErrorKind.PERMISSION_DENIED, missing.error().kind());
        assertEquals(ErrorKind.PERMISSION_DENIED, wrong.error().kind());
        assertEquals(Map.of("k", "v"), handler.handle("get_context", Map.of()).data());

        OperationResponse purged = handler.handle("purge_memory", Map.of("confirm", "CONFIRM_PURGE"));
        assertEquals(new PurgeResult(0, 0, 1), purged.data());
        assertTrue(handler.handle("purge_memory", Map.of("confirm", "CONFIRM_PURGE")).success());
    }

    @Test
    void shouldRejectWritesInReadOnlyMode() {
        start(MemoryProperties.builder().readOnly(true));

        assertEquals(ErrorKind.PERMISSION_DENIED,
                handler.handle("remember_decision", Map.of("decision", "d", "rationale", "r")).error().kind());
        assertEquals(ErrorKind.PERMISSION_DENIED,
                handler.handle("import_memory", Map.of("data", "{\"version\":\"1.1.0\"}")).error().kind());
        assertTrue(handler.handle("recall_decisions", Map.of()).success());
    }

    @Test
    void shouldRefuseReadOnlyWritesBeforeLookingAtArguments() {
        start(MemoryProperties.builder().readOnly(true));

        List<OperationResponse> responses = List.of(
                handler.handle("import_memory", Map.of("data", Map.of("version", "9.0.0"))),
                handler.handle("import_memory", Map.of("data", "not json")),
                handler.handle("import_memory", Map.of()),
                handler.handle("set_context", Map.of("key", "k")),
                handler.handle("remember_decision", Map.of("decision", "d")),
                handler.handle("store_pattern", Map.of("name", "bad name!")),
                handler.handle("purge_memory", Map.of("confirm", "CONFIRM_PURGE")));

        for (OperationResponse response : responses) {
            assertEquals(ErrorKind.PERMISSION_DENIED, response.error().kind(), response.operation());
        }
        assertEquals(ErrorKind.VALIDATION_ERROR, handler.handle("recall_decisions", Map.of("limit", "ten")).error().kind());
    }

    @Test
    void shouldFlagExactlyTheWritingOperations() {
        List<OperationKind> writes = Arrays.stream(OperationKind.values()).filter(OperationKind::write).toList();

        assertEquals(List.of(OperationKind.REMEMBER_DECISION, OperationKind.STORE_PATTERN, OperationKind.SET_CONTEXT,
                OperationKind.IMPORT_MEMORY, OperationKind.PURGE_MEMORY), writes);
    }

    @Test
    void shouldRoundTripThroughExportAndImport() {
        start(MemoryProperties.builder());
        handler.handle("remember_decision", Map.of("decision", "d", "rationale", "r"));
        handler.handle("set_context", Map.of("key", "k", "value", "v"));
        MemorySnapshot snapshot = (MemorySnapshot) handler.handle("export_memory", Map.of()).data();
        String json = context.serializer().toJson(snapshot);
        handler.handle("purge_memory", Map.of("confirm", "CONFIRM_PURGE"));

        OperationResponse imported = handler.handle("import_memory", Map.of("data", json));

        assertTrue(imported.success());
        assertEquals(new ImportResult(1, 0, 1, 0), imported.data());
        assertEquals(snapshot.stats(), handler.handle("memory_stats", Map.of()).data());
    }

    @Test
    void shouldReportSchemaVersionErrors() {
        start(MemoryProperties.builder());
        Map<String, Object> blob = new HashMap<>();
        blob.put("version", "9.0.0");

        OperationResponse response = handler.handle("import_memory", Map.of("data", blob));

        assertEquals(ErrorKind.SCHEMA_VERSION, response.error().kind());
    }

    @Test
    void shouldReturnHealthReport() {
        start(MemoryProperties.builder());

        OperationResponse response = handler.handle("health_check", Map.of());

        assertTrue(response.success());
        assertInstanceOf(HealthReport.class, response.data());
    }

    @Test
    void shouldMapEveryOperationName() {
        for (OperationKind kind : OperationKind.values()) {
            assertEquals(kind, OperationKind.fromName(kind.operationName()).orElseThrow());
        }
        assertTrue(OperationKind.fromName("REMEMBER_DECISION").isEmpty());
        assertTrue(OperationKind.fromName(null).isEmpty());
    }
}
