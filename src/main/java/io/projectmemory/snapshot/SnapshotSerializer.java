package io.projectmemory.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.projectmemory.config.MemoryProperties;
import io.projectmemory.error.PermissionDeniedException;
import io.projectmemory.error.SchemaVersionException;
import io.projectmemory.error.ValidationException;
import io.projectmemory.memory.Decision;
import io.projectmemory.memory.ImportResult;
import io.projectmemory.memory.MemoryDump;
import io.projectmemory.memory.Pattern;
import io.projectmemory.memory.ProjectMemory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Export and import of a whole project memory.
 *
 * <p>Import replaces the current contents atomically. Every row goes through the same validation
 * and capacity rules as a live write, so an edited export cannot smuggle in bad keys or exceed the
 * configured limits.</p>
 */
public class SnapshotSerializer {

    private static final Logger log = LoggerFactory.getLogger(SnapshotSerializer.class);

    public static final String SCHEMA_VERSION = "1.1.0";

    private final ProjectMemory store;
    private final MemoryProperties properties;
    private final String projectName;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public SnapshotSerializer(ProjectMemory store, MemoryProperties properties, String projectName, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.projectName = projectName;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Reads a consistent snapshot of the store. */
    public MemorySnapshot export() {
        MemoryDump dump = store.dump();
        log.info("Exported {} decisions, {} patterns, {} context keys",
                dump.decisions().size(), dump.patterns().size(), dump.context().size());
        return new MemorySnapshot(SCHEMA_VERSION, Instant.now(clock), projectName,
                dump.decisions(), dump.patterns(), dump.context(), dump.stats());
    }

    public String toJson(MemorySnapshot snapshot) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize memory snapshot", e);
        }
    }

    /**
     * Imports a blob given either as raw JSON text or as an already parsed JSON object.
     *
     * @throws PermissionDeniedException in read-only mode, before the payload is looked at
     * @throws ValidationException    if the payload is not a JSON object or breaks a limit
     * @throws SchemaVersionException if the blob version is missing or incompatible
     */
    public ImportResult importData(Object data) {
        requireWritable();
        if (data instanceof String json) {
            return importJson(json);
        }
        if (data instanceof Map<?, ?> map) {
            try {
                return importJson(objectMapper.writeValueAsString(map));
            } catch (JsonProcessingException e) {
                throw new ValidationException("Import data could not be read: " + e.getOriginalMessage(), e);
            }
        }
        throw new ValidationException("'data' must be a JSON object or a JSON string");
    }

    public ImportResult importJson(String json) {
        requireWritable();
        if (json == null || json.isBlank()) {
            throw new ValidationException("Import data is empty");
        }
        long size = json.getBytes(StandardCharsets.UTF_8).length;
        if (size > properties.maxImportBytes()) {
            throw new ValidationException("Import data is %d bytes, limit is %d".formatted(size, properties.maxImportBytes()),
                    Map.of("size_bytes", size, "limit_bytes", properties.maxImportBytes()));
        }

        ImportBlob blob;
        try {
            blob = objectMapper.readValue(json, ImportBlob.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Import data is not a valid memory export: " + e.getOriginalMessage(), e);
        }
        if (blob == null) {
            throw new ValidationException("Import data is not a valid memory export");
        }
        return importBlob(blob);
    }

    private ImportResult importBlob(ImportBlob blob) {
        checkVersion(blob.version());

        List<ImportBlob.DecisionEntry> decisionEntries = blob.decisions() == null ? List.of() : blob.decisions();
        List<ImportBlob.PatternEntry> patternEntries = blob.patterns() == null ? List.of() : blob.patterns();
        Map<String, String> context = blob.context() == null ? Map.of() : blob.context();

        checkCount("decisions", decisionEntries.size(), properties.maxImportDecisions());
        checkCount("patterns", patternEntries.size(), properties.maxImportPatterns());
        checkCount("context keys", context.size(), properties.maxImportContextKeys());

        List<Decision> decisions = new ArrayList<>(decisionEntries.size());
        for (int i = 0; i < decisionEntries.size(); i++) {
            ImportBlob.DecisionEntry entry = decisionEntries.get(i);
            if (entry == null) {
                throw new ValidationException("Decision at index " + i + " must be an object");
            }
            decisions.add(new Decision(0L, parseTimestamp(entry.timestamp(), "decisions[" + i + "].timestamp"),
                    entry.decision(), entry.rationale(), entry.context(), entry.alternatives()));
        }
        List<Pattern> patterns = new ArrayList<>(patternEntries.size());
        for (int i = 0; i < patternEntries.size(); i++) {
            ImportBlob.PatternEntry entry = patternEntries.get(i);
            if (entry == null) {
                throw new ValidationException("Pattern at index " + i + " must be an object");
            }
            patterns.add(new Pattern(entry.name(), entry.description(), entry.example(), entry.whenToUse(),
                    parseTimestamp(entry.updatedAt(), "patterns[" + i + "].updated_at")));
        }

        ImportResult result = store.replaceAll(decisions, patterns, new LinkedHashMap<>(context));
        log.info("Imported snapshot version {}: {}", blob.version(), result);
        return result;
    }

    private void requireWritable() {
        if (properties.readOnly()) {
            throw new PermissionDeniedException("Memory is in read-only mode; import_memory is not allowed");
        }
    }

    /** Compatible when the major version matches. */
    static void checkVersion(String version) {
        if (version == null || version.isBlank()) {
            throw new SchemaVersionException("missing", SCHEMA_VERSION);
        }
        if (!major(version).equals(major(SCHEMA_VERSION))) {
            throw new SchemaVersionException(version, SCHEMA_VERSION);
        }
    }

    private static String major(String version) {
        int dot = version.indexOf('.');
        return (dot < 0 ? version : version.substring(0, dot)).trim();
    }

    private static void checkCount(String what, int count, int limit) {
        if (count > limit) {
            throw new ValidationException("Import contains %d %s, limit is %d".formatted(count, what, limit),
                    Map.of("count", count, "limit", limit));
        }
    }

    /** Blank means "now" (decided by the store); anything else must be ISO-8601. */
    private static Instant parseTimestamp(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("'%s' is not an ISO-8601 timestamp: %s".formatted(field, value),
                    Map.of("field", field));
        }
    }
}
