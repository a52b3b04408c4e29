package io.projectmemory.error;

import java.util.Map;

/** Malformed, oversized or illegally-charactered input. Rejected before it reaches storage. */
public class ValidationException extends MemoryException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, ?> details) {
        super(ErrorKind.VALIDATION_ERROR, message, details);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }
}
