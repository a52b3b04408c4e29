package io.projectmemory.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.projectmemory.error.ErrorKind;
import io.projectmemory.error.MemoryException;

import java.util.Map;

/**
 * Structured result of one call. Exactly one of {@code data} and {@code error} is set.
 *
 * @param success   whether the operation was applied
 * @param operation requested operation name
 * @param requestId id also logged under the {@code requestId} MDC key
 * @param data      operation payload on success
 * @param error     failure description otherwise
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        boolean success,
        String operation,
        String requestId,
        Object data,
        ErrorBody error
) {

    public static OperationResponse ok(String operation, String requestId, Object data) {
        return new OperationResponse(true, operation, requestId, data, null);
    }

    public static OperationResponse failure(String operation, String requestId, MemoryException e) {
        return new OperationResponse(false, operation, requestId, null,
                new ErrorBody(e.getKind(), e.getMessage(), e.getKind().retryable(), e.getDetails()));
    }

    /** Error kind, message and the hints a caller needs to react. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ErrorBody(ErrorKind kind, String message, boolean retryable,
                            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> details) {
    }
}
