package com.example.toolgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunctionSchemasTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void replacesDotsForFunctionNames() {
        assertEquals("agent-_-persona_get", FunctionSchemas.sanitize("agent.persona_get"));
        assertEquals("agent.persona_get", FunctionSchemas.desanitize("agent-_-persona_get"));
        assertEquals("web_search", FunctionSchemas.sanitize("web_search"));
    }

    @Test
    void exportsFunctionDefinitions() {
        ToolDescriptor descriptor = ToolDescriptor.builder("telegram.send_message", new ToolCategory("telegram", "Telegram"))
                .description("Send a message")
                .schema(InputSchema.builder()
                        .integer("chat_id", "Chat id", true)
                        .string("text", "Text", true)
                        .oneOf("parse_mode", "Formatting", false, List.of("Markdown", "HTML"))
                        .stringArray("tags", null, false)
                        .build())
                .build();

        ArrayNode functions = FunctionSchemas.export(mapper, List.of(descriptor));

        assertEquals(1, functions.size());
        JsonNode entry = functions.get(0);
        assertEquals("function", entry.path("type").asText());
        JsonNode function = entry.path("function");
        assertEquals("telegram-_-send_message", function.path("name").asText());
        assertEquals("Send a message", function.path("description").asText());

        JsonNode parameters = function.path("parameters");
        assertEquals("object", parameters.path("type").asText());
        assertEquals("integer", parameters.path("properties").path("chat_id").path("type").asText());
        assertEquals("string", parameters.path("properties").path("parse_mode").path("type").asText());
        assertEquals("HTML", parameters.path("properties").path("parse_mode").path("enum").get(1).asText());
        assertEquals("string", parameters.path("properties").path("tags").path("items").path("type").asText());
        assertFalse(parameters.path("properties").path("tags").has("description"));
        assertEquals("chat_id", parameters.path("required").get(0).asText());
        assertEquals(2, parameters.path("required").size());
    }

    @Test
    void emptySchemaHasNoRequiredList() {
        JsonNode schema = InputSchema.empty().toJson(mapper);

        assertEquals("object", schema.path("type").asText());
        assertTrue(schema.path("properties").isEmpty());
        assertFalse(schema.has("required"));
    }

    @Test
    void schemaBuilderRejectsInconsistentDeclarations() {
        assertThrows(IllegalArgumentException.class, () -> InputSchema.builder()
                .string("name", null, true)
                .string("name", null, false));
        assertThrows(IllegalArgumentException.class, () -> InputSchema.builder()
                .oneOf("mode", null, true, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new InputSchema(Map.of(), List.of("ghost")));
    }
}
