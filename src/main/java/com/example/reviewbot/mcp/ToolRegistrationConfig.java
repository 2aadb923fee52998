package com.example.reviewbot.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes the operator tools on the MCP server.
 */
@Configuration
public class ToolRegistrationConfig {

    @Bean
    public ToolCallbackProvider operatorTools(SessionTools sessionTools, CapabilitiesTools capabilitiesTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(sessionTools, capabilitiesTools)
                .build();
    }
}
