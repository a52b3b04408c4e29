package io.projectmemory.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.projectmemory.core.ServiceContext;
import io.projectmemory.metrics.MemoryMetrics;
import io.projectmemory.protocol.ProtocolHandler;
import io.projectmemory.tool.MemoryToolCallbacks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.StaticToolCallbackProvider;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the memory service: one {@link ServiceContext} per process, the protocol handler in front
 * of it, its Micrometer meters, and the MCP tools published by the Spring AI MCP server.
 */
@Configuration
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryServiceConfig.class);

    @Bean(destroyMethod = "close")
    public ServiceContext serviceContext(MemoryProperties properties) {
        return ServiceContext.start(properties);
    }

    @Bean
    public ProtocolHandler protocolHandler(ServiceContext serviceContext) {
        return new ProtocolHandler(serviceContext);
    }

    @Bean
    public MemoryMetrics memoryMetrics(ServiceContext serviceContext) {
        return new MemoryMetrics(serviceContext);
    }

    @Bean
    public ToolCallbackProvider memoryToolCallbackProvider(ProtocolHandler protocolHandler, ObjectMapper objectMapper) {
        var callbacks = MemoryToolCallbacks.forAllOperations(protocolHandler, objectMapper);
        log.info("Publishing {} memory tools over MCP", callbacks.size());
        return new StaticToolCallbackProvider(callbacks);
    }
}
