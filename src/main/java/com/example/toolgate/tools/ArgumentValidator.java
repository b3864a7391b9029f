package com.example.toolgate.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public final class ArgumentValidator {

    private ArgumentValidator() {
    }

    public static void validate(InputSchema schema, JsonNode arguments) throws ToolException {
        if (arguments == null || !arguments.isObject()) {
            throw ToolException.invalidArguments("arguments must be a JSON object");
        }
        for (String name : schema.required()) {
            if (isAbsent(arguments.get(name))) {
                throw ToolException.invalidArguments("'" + name + "' is required");
            }
        }
        for (Map.Entry<String, InputSchema.Property> entry : schema.properties().entrySet()) {
            JsonNode value = arguments.get(entry.getKey());
            if (isAbsent(value)) {
                continue;
            }
            check(entry.getKey(), entry.getValue(), value);
        }
    }

    private static void check(String name, InputSchema.Property property, JsonNode value) throws ToolException {
        switch (property.type()) {
            case STRING -> require(value.isTextual(), name, "a string");
            case NUMBER -> require(value.isNumber(), name, "a number");
            case INTEGER -> require(isWholeNumber(value), name, "an integer");
            case BOOLEAN -> require(value.isBoolean(), name, "a boolean");
            case ENUM -> {
                require(value.isTextual(), name, "a string");
                if (!property.allowedValues().contains(value.asText())) {
                    throw ToolException.invalidArguments("'" + name + "' must be one of " + property.allowedValues());
                }
            }
            case ARRAY -> {
                require(value.isArray(), name, "an array");
                for (JsonNode item : value) {
                    if (!matches(property.itemType(), item)) {
                        throw ToolException.invalidArguments("'" + name + "' items must be of type "
                                + property.itemType().jsonType());
                    }
                }
            }
        }
    }

    private static boolean matches(PropertyType type, JsonNode item) {
        if (type == null) {
            return true;
        }
        return switch (type) {
            case STRING, ENUM -> item.isTextual();
            case NUMBER -> item.isNumber();
            case INTEGER -> isWholeNumber(item);
            case BOOLEAN -> item.isBoolean();
            case ARRAY -> item.isArray();
        };
    }

    static boolean isWholeNumber(JsonNode value) {
        if (value.isIntegralNumber()) {
            return true;
        }
        if (value.isFloatingPointNumber()) {
            double d = value.asDouble();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    private static void require(boolean condition, String name, String expected) throws ToolException {
        if (!condition) {
            throw ToolException.invalidArguments("'" + name + "' must be " + expected);
        }
    }
}
