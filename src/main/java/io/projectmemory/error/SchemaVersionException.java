package io.projectmemory.error;

import java.util.HashMap;
import java.util.Map;

public class SchemaVersionException extends MemoryException {

    public SchemaVersionException(String found, String supported) {
        super(ErrorKind.SCHEMA_VERSION,
                "Import blob version '%s' is not compatible with schema version %s".formatted(found, supported),
                details(found, supported));
    }

    private static Map<String, Object> details(String found, String supported) {
        Map<String, Object> details = new HashMap<>();
        details.put("found", found);
        details.put("supported", supported);
        return details;
    }
}
