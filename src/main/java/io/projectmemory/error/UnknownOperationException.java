package io.projectmemory.error;

import java.util.Map;

public class UnknownOperationException extends MemoryException {

    public UnknownOperationException(String operation) {
        super(ErrorKind.UNKNOWN_OPERATION, "Unknown operation: " + operation,
                Map.of("operation", String.valueOf(operation)));
    }
}
