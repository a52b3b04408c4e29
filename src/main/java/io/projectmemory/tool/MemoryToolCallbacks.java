package io.projectmemory.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.projectmemory.protocol.OperationKind;
import io.projectmemory.protocol.ProtocolHandler;
import org.springframework.ai.tool.ToolCallback;

import java.util.Arrays;
import java.util.List;

/** One tool callback per operation kind. */
public final class MemoryToolCallbacks {

    private MemoryToolCallbacks() {
    }

    public static List<ToolCallback> forAllOperations(ProtocolHandler handler, ObjectMapper objectMapper) {
        return Arrays.stream(OperationKind.values())
                .<ToolCallback>map(kind -> new MemoryToolCallback(kind, handler, objectMapper))
                .toList();
    }
}
