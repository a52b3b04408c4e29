package io.projectmemory.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the memory service with a stable {@link ErrorKind} and optional
 * details. The details map is copied and unmodifiable.
 */
public class MemoryException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public MemoryException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public MemoryException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public MemoryException(ErrorKind kind, String message, Map<String, ?> details) {
        this(kind, message, details, null);
    }

    public MemoryException(ErrorKind kind, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.details = copy(details);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Additional key/value details that help the caller react to the error. */
    public Map<String, Object> getDetails() {
        return details;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) return Collections.emptyMap();
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach(m::put);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{kind=" + kind
                + ", message=" + getMessage()
                + (details.isEmpty() ? "" : ", details=" + details)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
