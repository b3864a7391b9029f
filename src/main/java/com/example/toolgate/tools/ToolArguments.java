package com.example.toolgate.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class ToolArguments {

    private ToolArguments() {
    }

    /**
     * Binds {@code arguments} onto a record (or bean), ignoring properties the type does not declare.
     */
    public static <T> T decode(ObjectMapper mapper, JsonNode arguments, Class<T> type) throws ToolException {
        try {
            return mapper.readerFor(type)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .treeToValue(arguments, type);
        } catch (JsonProcessingException e) {
            throw ToolException.invalidArguments(e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw ToolException.invalidArguments(String.valueOf(e.getMessage()));
        }
    }

    public static String requireText(JsonNode arguments, String field) throws ToolException {
        String value = optionalText(arguments, field);
        if (value == null || value.isBlank()) {
            throw ToolException.invalidArguments("'" + field + "' is required");
        }
        return value;
    }

    public static String optionalText(JsonNode arguments, String field) {
        JsonNode node = arguments.get(field);
        if (node == null || node.isNull() || !node.isTextual()) {
            return null;
        }
        return node.asText();
    }
}
