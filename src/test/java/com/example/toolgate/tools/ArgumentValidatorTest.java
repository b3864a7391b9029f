package com.example.toolgate.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArgumentValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private final InputSchema schema = InputSchema.builder()
            .string("text", "Text", true)
            .integer("chat_id", "Chat", false)
            .bool("enabled", "Flag", false)
            .number("ratio", "Ratio", false)
            .oneOf("mode", "Mode", false, List.of("replace", "append"))
            .stringArray("names", "Names", false)
            .build();

    private ToolException reject(ObjectNode arguments) {
        return assertThrows(ToolException.class, () -> ArgumentValidator.validate(schema, arguments));
    }

    @Test
    void acceptsWellFormedArguments() {
        ObjectNode arguments = mapper.createObjectNode()
                .put("text", "hi")
                .put("chat_id", 42)
                .put("enabled", true)
                .put("ratio", 0.5)
                .put("mode", "append")
                .put("extra", "ignored");
        arguments.putArray("names").add("a").add("b");

        assertDoesNotThrow(() -> ArgumentValidator.validate(schema, arguments));
    }

    @Test
    void acceptsWholeValuedFloatsForIntegers() {
        ObjectNode arguments = mapper.createObjectNode().put("text", "hi").put("chat_id", 42.0);

        assertDoesNotThrow(() -> ArgumentValidator.validate(schema, arguments));
    }

    @Test
    void treatsExplicitNullAsAbsent() {
        ObjectNode arguments = mapper.createObjectNode().put("text", "hi");
        arguments.putNull("chat_id");

        assertDoesNotThrow(() -> ArgumentValidator.validate(schema, arguments));
    }

    @Test
    void rejectsMissingRequiredProperty() {
        ToolException error = reject(mapper.createObjectNode().put("chat_id", 1));

        assertEquals(ToolErrorKind.INVALID_ARGUMENTS, error.getKind());
        assertEquals("Invalid arguments: 'text' is required", error.getMessage());
    }

    @Test
    void rejectsWrongTypes() {
        assertEquals("Invalid arguments: 'text' must be a string",
                reject(mapper.createObjectNode().put("text", 5)).getMessage());
        assertEquals("Invalid arguments: 'chat_id' must be an integer",
                reject(mapper.createObjectNode().put("text", "x").put("chat_id", 1.5)).getMessage());
        assertEquals("Invalid arguments: 'enabled' must be a boolean",
                reject(mapper.createObjectNode().put("text", "x").put("enabled", "yes")).getMessage());
        assertEquals("Invalid arguments: 'ratio' must be a number",
                reject(mapper.createObjectNode().put("text", "x").put("ratio", "1")).getMessage());
    }

    @Test
    void rejectsValuesOutsideTheEnum() {
        ToolException error = reject(mapper.createObjectNode().put("text", "x").put("mode", "prepend"));

        assertEquals("Invalid arguments: 'mode' must be one of [replace, append]", error.getMessage());
    }

    @Test
    void rejectsBadArrayItems() {
        ObjectNode arguments = mapper.createObjectNode().put("text", "x");
        arguments.putArray("names").add("a").add(3);

        assertEquals("Invalid arguments: 'names' items must be of type string", reject(arguments).getMessage());
    }

    @Test
    void rejectsNonObjectArguments() {
        assertThrows(ToolException.class,
                () -> ArgumentValidator.validate(InputSchema.empty(), mapper.createArrayNode()));
    }
}
