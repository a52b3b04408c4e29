package io.projectmemory.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.projectmemory.error.ValidationException;
import io.projectmemory.protocol.OperationKind;
import io.projectmemory.protocol.OperationResponse;
import io.projectmemory.protocol.ProtocolHandler;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.Map;

/**
 * Publishes one {@link OperationKind} as an MCP tool. The tool input is the JSON argument object,
 * the result is the JSON-serialized {@link OperationResponse}.
 */
public class MemoryToolCallback implements ToolCallback {

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {};

    private final OperationKind kind;
    private final ProtocolHandler handler;
    private final ObjectMapper objectMapper;

    public MemoryToolCallback(OperationKind kind, ProtocolHandler handler, ObjectMapper objectMapper) {
        this.kind = kind;
        this.handler = handler;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return ToolDefinition.builder()
                .name(kind.operationName())
                .description(kind.description())
                .inputSchema(kind.inputSchema())
                .build();
    }

    @Override
    public String call(String toolInput) {
        OperationResponse response;
        try {
            response = handler.handle(kind.operationName(), parseArguments(toolInput));
        } catch (JsonProcessingException e) {
            response = OperationResponse.failure(kind.operationName(), null,
                    new ValidationException("Tool input is not a JSON object: " + e.getOriginalMessage(), e));
        }
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response of " + kind.operationName(), e);
        }
    }

    private Map<String, Object> parseArguments(String toolInput) throws JsonProcessingException {
        if (toolInput == null || toolInput.isBlank()) {
            return Map.of();
        }
        Map<String, Object> args = objectMapper.readValue(toolInput, ARGUMENTS);
        return args == null ? Map.of() : args;
    }
}
