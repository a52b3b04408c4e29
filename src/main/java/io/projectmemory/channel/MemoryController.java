package io.projectmemory.channel;

import io.projectmemory.error.ErrorKind;
import io.projectmemory.protocol.OperationKind;
import io.projectmemory.protocol.OperationResponse;
import io.projectmemory.protocol.ProtocolHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST access to the memory operations, for hooks and scripts that do not speak MCP.
 */
@RestController
@RequestMapping("/api/memory")
public class MemoryController {

    private final ProtocolHandler handler;

    public MemoryController(ProtocolHandler handler) {
        this.handler = handler;
    }

    /**
     * Runs any operation by name. The body is the argument object and may be omitted.
     */
    @PostMapping("/{operation}")
    public ResponseEntity<OperationResponse> execute(@PathVariable String operation,
                                                     @RequestBody(required = false) Map<String, Object> arguments) {
        return toEntity(handler.handle(operation, arguments == null ? Map.of() : arguments));
    }

    @GetMapping("/health")
    public ResponseEntity<OperationResponse> health() {
        return toEntity(handler.handle(OperationKind.HEALTH_CHECK.operationName(), Map.of()));
    }

    @GetMapping("/stats")
    public ResponseEntity<OperationResponse> stats() {
        return toEntity(handler.handle(OperationKind.MEMORY_STATS.operationName(), Map.of()));
    }

    private static ResponseEntity<OperationResponse> toEntity(OperationResponse response) {
        if (response.success()) {
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.status(statusFor(response.error().kind())).body(response);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case UNKNOWN_OPERATION -> HttpStatus.NOT_FOUND;
            case CAPACITY_EXCEEDED -> HttpStatus.CONFLICT;
            case SCHEMA_VERSION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case RATE_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case POOL_EXHAUSTED -> HttpStatus.SERVICE_UNAVAILABLE;
            case STORAGE_INTEGRITY, STORAGE_ERROR, INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
