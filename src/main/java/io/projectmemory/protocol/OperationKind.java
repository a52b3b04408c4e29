package io.projectmemory.protocol;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of operations the service accepts. Each kind carries its wire name, whether it
 * counts against the rate limit, whether it writes, a description and JSON input schema for tool publication, and
 * the parser that turns raw arguments into a {@link MemoryOperation}.
 */
public enum OperationKind {

    REMEMBER_DECISION("remember_decision", true, true,
            "Record an architectural or technical decision with its rationale. The oldest decision is evicted when the limit is reached.",
            """
            {
              "type": "object",
              "properties": {
                "decision": {"type": "string", "description": "The decision made"},
                "rationale": {"type": "string", "description": "Why the decision was made"},
                "context": {"type": "string", "description": "What prompted the decision"},
                "alternatives": {"type": "string", "description": "Alternatives that were considered"}
              },
              "required": ["decision", "rationale"]
            }
            """,
            MemoryOperation.RememberDecision::parse),

    RECALL_DECISIONS("recall_decisions", true, false,
            "Recall past decisions, most recent first, optionally filtered by a keyword in the decision or rationale.",
            """
            {
              "type": "object",
              "properties": {
                "keyword": {"type": "string", "description": "Case-insensitive text to search for"},
                "limit": {"type": "integer", "description": "Maximum number of decisions to return"}
              }
            }
            """,
            MemoryOperation.RecallDecisions::parse),

    STORE_PATTERN("store_pattern", true, true,
            "Store a named code pattern or convention. Storing an existing name replaces it.",
            """
            {
              "type": "object",
              "properties": {
                "name": {"type": "string", "description": "Unique pattern name: letters, digits, '_', '-' or '.'"},
                "description": {"type": "string", "description": "What the pattern is"},
                "example": {"type": "string", "description": "Code example"},
                "when_to_use": {"type": "string", "description": "When to apply the pattern"}
              },
              "required": ["name", "description"]
            }
            """,
            MemoryOperation.StorePattern::parse),

    GET_PATTERNS("get_patterns", true, false,
            "List all stored code patterns.",
            """
            {"type": "object", "properties": {}}
            """,
            MemoryOperation.GetPatterns::parse),

    SET_CONTEXT("set_context", true, true,
            "Set a project context value. Setting an existing key replaces its value.",
            """
            {
              "type": "object",
              "properties": {
                "key": {"type": "string", "description": "Context key: letters, digits, '_', '-' or '.'"},
                "value": {"type": "string", "description": "Context value"}
              },
              "required": ["key", "value"]
            }
            """,
            MemoryOperation.SetContext::parse),

    GET_CONTEXT("get_context", true, false,
            "Get all project context values.",
            """
            {"type": "object", "properties": {}}
            """,
            MemoryOperation.GetContext::parse),

    MEMORY_STATS("memory_stats", false, false,
            "Show record counts, configured limits and approximate size of the project memory.",
            """
            {"type": "object", "properties": {}}
            """,
            MemoryOperation.MemoryStatsQuery::parse),

    EXPORT_MEMORY("export_memory", false, false,
            "Export the whole project memory as a versioned JSON snapshot for backup or transfer.",
            """
            {"type": "object", "properties": {}}
            """,
            MemoryOperation.ExportMemory::parse),

    IMPORT_MEMORY("import_memory", false, true,
            "Replace the project memory with the contents of an exported snapshot.",
            """
            {
              "type": "object",
              "properties": {
                "data": {"type": ["object", "string"], "description": "Snapshot produced by export_memory"}
              },
              "required": ["data"]
            }
            """,
            MemoryOperation.ImportMemory::parse),

    HEALTH_CHECK("health_check", false, false,
            "Check database connectivity, integrity, write capability and capacity.",
            """
            {"type": "object", "properties": {}}
            """,
            MemoryOperation.HealthCheck::parse),

    PURGE_MEMORY("purge_memory", false, true,
            "Delete all decisions, patterns and context. Requires confirm set to CONFIRM_PURGE.",
            """
            {
              "type": "object",
              "properties": {
                "confirm": {"type": "string", "description": "Must be exactly CONFIRM_PURGE"}
              },
              "required": ["confirm"]
            }
            """,
            MemoryOperation.PurgeMemory::parse);

    private static final Map<String, OperationKind> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(OperationKind::operationName, Function.identity()));

    private final String operationName;
    private final boolean rateLimited;
    private final boolean write;
    private final String description;
    private final String inputSchema;
    private final Function<OperationArguments, MemoryOperation> parser;

    OperationKind(String operationName, boolean rateLimited, boolean write, String description, String inputSchema,
                  Function<OperationArguments, MemoryOperation> parser) {
        this.operationName = operationName;
        this.rateLimited = rateLimited;
        this.write = write;
        this.description = description;
        this.inputSchema = inputSchema;
        this.parser = parser;
    }

    public static Optional<OperationKind> fromName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String operationName() {
        return operationName;
    }

    /** Whether a call counts against the sliding-window rate limit. */
    public boolean rateLimited() {
        return rateLimited;
    }

    /** Whether the operation changes stored memory, and so is refused in read-only mode. */
    public boolean write() {
        return write;
    }

    public String description() {
        return description;
    }

    public String inputSchema() {
        return inputSchema;
    }

    /**
     * Checks argument shape and builds the operation.
     *
     * @throws io.projectmemory.error.ValidationException if an argument is missing or has the wrong type
     */
    public MemoryOperation parse(Map<String, Object> arguments) {
        return parser.apply(new OperationArguments(arguments));
    }
}
