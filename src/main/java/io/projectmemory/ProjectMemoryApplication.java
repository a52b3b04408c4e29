package io.projectmemory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Project Memory: persistent decisions, patterns and context for one project, served over MCP
 * and REST.
 */
@SpringBootApplication
public class ProjectMemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProjectMemoryApplication.class, args);
    }
}
