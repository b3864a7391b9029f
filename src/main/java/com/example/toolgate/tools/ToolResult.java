package com.example.toolgate.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public record ToolResult(String content, boolean isError) {

    public ToolResult {
        content = content == null ? "" : content;
    }

    public static ToolResult success(String content) {
        return new ToolResult(content, false);
    }

    public static ToolResult error(String content) {
        return new ToolResult(content, true);
    }

    public static ToolResult success(ObjectMapper mapper, JsonNode result) {
        return new ToolResult(render(mapper, result), false);
    }

    private static String render(ObjectMapper mapper, JsonNode result) {
        if (result == null || result.isNull()) {
            return "null";
        }
        if (result.isTextual()) {
            return result.asText();
        }
        if (result.isNumber() || result.isBoolean()) {
            return result.toString();
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return result.toString();
        }
    }
}
