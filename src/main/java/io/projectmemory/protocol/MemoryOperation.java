package io.projectmemory.protocol;

import io.projectmemory.core.ServiceContext;
import io.projectmemory.error.PermissionDeniedException;
import io.projectmemory.memory.ProjectMemory;

import java.util.Map;

/**
 * One parsed call, with its arguments already shape-checked. Each variant knows which store
 * method it maps to.
 */
public sealed interface MemoryOperation {

    OperationKind kind();

    /** Runs the operation and returns the response payload. */
    Object apply(ServiceContext context);

    /** Checks run after argument parsing and before any storage access. */
    default void authorize() {
    }

    record RememberDecision(String decision, String rationale, String context, String alternatives)
            implements MemoryOperation {

        static RememberDecision parse(OperationArguments args) {
            return new RememberDecision(args.requiredString("decision"), args.requiredString("rationale"),
                    args.optionalString("context"), args.optionalString("alternatives"));
        }

        @Override
        public OperationKind kind() {
            return OperationKind.REMEMBER_DECISION;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            long id = ctx.store().rememberDecision(decision, rationale, context, alternatives);
            return Map.of("id", id);
        }
    }

    record RecallDecisions(String keyword, Integer limit) implements MemoryOperation {

        static RecallDecisions parse(OperationArguments args) {
            return new RecallDecisions(args.optionalString("keyword"), args.optionalInt("limit"));
        }

        @Override
        public OperationKind kind() {
            return OperationKind.RECALL_DECISIONS;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            return ctx.store().recallDecisions(keyword, limit);
        }
    }

    record StorePattern(String name, String description, String example, String whenToUse)
            implements MemoryOperation {

        static StorePattern parse(OperationArguments args) {
            return new StorePattern(args.requiredString("name"), args.requiredString("description"),
                    args.optionalString("example"), args.optionalString("when_to_use"));
        }

        @Override
        public OperationKind kind() {
            return OperationKind.STORE_PATTERN;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            ctx.store().storePattern(name, description, example, whenToUse);
            return Map.of("name", name);
        }
    }

    record GetPatterns() implements MemoryOperation {

        static GetPatterns parse(OperationArguments args) {
            return new GetPatterns();
        }

        @Override
        public OperationKind kind() {
            return OperationKind.GET_PATTERNS;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            return ctx.store().getPatterns();
        }
    }

    record SetContext(String key, String value) implements MemoryOperation {

        static SetContext parse(OperationArguments args) {
            return new SetContext(args.requiredString("key"), args.requiredString("value"));
        }

        @Override
        public OperationKind kind() {
            return OperationKind.SET_CONTEXT;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            ctx.store().setContext(key, value);
            return Map.of("key", key);
        }
    }

    record GetContext() implements MemoryOperation {

        static GetContext parse(OperationArguments args) {
            return new GetContext();
        }

        @Override
        public OperationKind kind() {
            return OperationKind.GET_CONTEXT;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            return ctx.store().getContext();
        }
    }

    record MemoryStatsQuery() implements MemoryOperation {

        static MemoryStatsQuery parse(OperationArguments args) {
            return new MemoryStatsQuery();
        }

        @Override
        public OperationKind kind() {
            return OperationKind.MEMORY_STATS;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            return ctx.store().stats();
        }
    }

    record ExportMemory() implements MemoryOperation {

        static ExportMemory parse(OperationArguments args) {
            return new ExportMemory();
        }

        @Override
        public OperationKind kind() {
            return OperationKind.EXPORT_MEMORY;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            return ctx.serializer().export();
        }
    }

    record ImportMemory(Object data) implements MemoryOperation {

        static ImportMemory parse(OperationArguments args) {
            return new ImportMemory(args.requiredPayload("data"));
        }

        @Override
        public OperationKind kind() {
            return OperationKind.IMPORT_MEMORY;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            return ctx.serializer().importData(data);
        }
    }

    record HealthCheck() implements MemoryOperation {

        static HealthCheck parse(OperationArguments args) {
            return new HealthCheck();
        }

        @Override
        public OperationKind kind() {
            return OperationKind.HEALTH_CHECK;
        }

        @Override
        public Object apply(ServiceContext ctx) {
            return ctx.healthCheck().check();
        }
    }

    record PurgeMemory(String confirm) implements MemoryOperation {

        static PurgeMemory parse(OperationArguments args) {
            return new PurgeMemory(args.optionalString("confirm"));
        }

        @Override
        public OperationKind kind() {
            return OperationKind.PURGE_MEMORY;
        }

        @Override
        public void authorize() {
            if (!ProjectMemory.PURGE_CONFIRMATION.equals(confirm)) {
                throw new PermissionDeniedException(
                        "purge_memory requires confirm='" + ProjectMemory.PURGE_CONFIRMATION + "'; nothing was deleted");
            }
        }

        @Override
        public Object apply(ServiceContext ctx) {
            return ctx.store().purge(confirm);
        }
    }
}
