package io.projectmemory.protocol;

import io.projectmemory.core.ServiceContext;
import io.projectmemory.error.ErrorKind;
import io.projectmemory.error.MemoryException;
import io.projectmemory.error.PermissionDeniedException;
import io.projectmemory.error.RateLimitExceededException;
import io.projectmemory.error.UnknownOperationException;
import io.projectmemory.ratelimit.RateLimitDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

/**
 * Single entry point for every collaborator: REST, MCP tools and tests all come through here.
 *
 * <p>Per call: rate limit, read-only refusal of writes, argument shape, authorization (purge
 * confirmation), then the pooled store call. A rate-limited call is rejected before a connection is acquired. Every failure is
 * returned as a structured {@link OperationResponse}; nothing is thrown to the caller.</p>
 */
public class ProtocolHandler {

    private static final Logger log = LoggerFactory.getLogger(ProtocolHandler.class);

    static final String REQUEST_ID_KEY = "requestId";

    private final ServiceContext context;

    public ProtocolHandler(ServiceContext context) {
        this.context = context;
    }

    public OperationResponse handle(String operation, Map<String, Object> arguments) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(REQUEST_ID_KEY, requestId);
        try {
            OperationKind kind = OperationKind.fromName(operation)
                    .orElseThrow(() -> new UnknownOperationException(operation));
            if (kind.rateLimited()) {
                checkRateLimit();
            }
            if (kind.write() && context.properties().readOnly()) {
                throw new PermissionDeniedException(
                        "Memory is in read-only mode; " + kind.operationName() + " is not allowed");
            }

            MemoryOperation parsed = kind.parse(arguments);
            parsed.authorize();

            log.debug("Executing {}", kind.operationName());
            Object data = parsed.apply(context);
            return OperationResponse.ok(kind.operationName(), requestId, data);
        } catch (MemoryException e) {
            logFailure(operation, e);
            return OperationResponse.failure(operation, requestId, e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {}", operation, e);
            return OperationResponse.failure(operation, requestId,
                    new MemoryException(ErrorKind.INTERNAL_ERROR, "Internal error: " + e.getMessage(), e));
        } finally {
            MDC.remove(REQUEST_ID_KEY);
        }
    }

    private void checkRateLimit() {
        RateLimitDecision decision = context.rateLimiter().allow();
        if (!decision.allowed()) {
            throw new RateLimitExceededException(decision.limit(), decision.remaining(),
                    decision.utilizationPercent(), decision.retryAfterMillis());
        }
    }

    private static void logFailure(String operation, MemoryException e) {
        switch (e.getKind()) {
            case VALIDATION_ERROR, UNKNOWN_OPERATION, SCHEMA_VERSION ->
                    log.debug("Rejected {}: {}", operation, e.getMessage());
            case STORAGE_INTEGRITY -> log.error("Storage integrity failure in {}: {}", operation, e.getMessage());
            case STORAGE_ERROR, INTERNAL_ERROR -> log.error("{} failed: {}", operation, e.getMessage(), e);
            default -> log.warn("{} rejected ({}): {}", operation, e.getKind(), e.getMessage());
        }
    }
}
