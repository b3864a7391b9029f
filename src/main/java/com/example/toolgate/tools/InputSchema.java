package com.example.toolgate.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record InputSchema(Map<String, Property> properties, List<String> required) {

    private static final InputSchema EMPTY = new InputSchema(Map.of(), List.of());

    public record Property(PropertyType type, String description, List<String> allowedValues, PropertyType itemType) {
        public Property {
            allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        }
    }

    public InputSchema {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = List.copyOf(required);
        for (String name : required) {
            if (!properties.containsKey(name)) {
                throw new IllegalArgumentException("Required property '" + name + "' is not declared");
            }
        }
    }

    public static InputSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        for (Map.Entry<String, Property> entry : properties.entrySet()) {
            Property property = entry.getValue();
            ObjectNode node = props.putObject(entry.getKey());
            node.put("type", property.type().jsonType());
            if (property.type() == PropertyType.ENUM) {
                ArrayNode values = node.putArray("enum");
                property.allowedValues().forEach(values::add);
            }
            if (property.type() == PropertyType.ARRAY) {
                node.putObject("items").put("type", property.itemType().jsonType());
            }
            if (property.description() != null) {
                node.put("description", property.description());
            }
        }
        if (!required.isEmpty()) {
            ArrayNode requiredNode = schema.putArray("required");
            required.forEach(requiredNode::add);
        }
        return schema;
    }

    public static final class Builder {
        private final Map<String, Property> properties = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();

        private Builder() {
        }

        public Builder string(String name, String description, boolean isRequired) {
            return add(name, new Property(PropertyType.STRING, description, null, null), isRequired);
        }

        public Builder integer(String name, String description, boolean isRequired) {
            return add(name, new Property(PropertyType.INTEGER, description, null, null), isRequired);
        }

        public Builder number(String name, String description, boolean isRequired) {
            return add(name, new Property(PropertyType.NUMBER, description, null, null), isRequired);
        }

        public Builder bool(String name, String description, boolean isRequired) {
            return add(name, new Property(PropertyType.BOOLEAN, description, null, null), isRequired);
        }

        public Builder stringArray(String name, String description, boolean isRequired) {
            return add(name, new Property(PropertyType.ARRAY, description, null, PropertyType.STRING), isRequired);
        }

        public Builder oneOf(String name, String description, boolean isRequired, List<String> values) {
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Enum property '" + name + "' needs at least one value");
            }
            return add(name, new Property(PropertyType.ENUM, description, values, null), isRequired);
        }

        private Builder add(String name, Property property, boolean isRequired) {
            if (properties.putIfAbsent(name, property) != null) {
                throw new IllegalArgumentException("Property '" + name + "' declared twice");
            }
            if (isRequired) {
                required.add(name);
            }
            return this;
        }

        public InputSchema build() {
            return new InputSchema(properties, required);
        }
    }
}
