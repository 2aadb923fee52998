package com.example.reviewbot.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    @Tool(description = "List available operator tool names for introspection")
    public Map<String,Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "course-review-bot", "version", "0.1.0"),
                "tools", List.of("session_get", "session_timeout_info", "session_clear", "draft_get", "quota_status")
        );
    }
}
