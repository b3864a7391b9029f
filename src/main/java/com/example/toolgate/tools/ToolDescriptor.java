package com.example.toolgate.tools;

import java.util.Objects;

public record ToolDescriptor(
        String id,
        String name,
        String description,
        InputSchema inputSchema,
        ToolCategory category,
        boolean baseline,
        RiskLevel risk
) {

    public static final String ID_PREFIX = "builtin:";

    public ToolDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        id = id == null ? ID_PREFIX + name : id;
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? InputSchema.empty() : inputSchema;
        risk = risk == null ? RiskLevel.SAFE : risk;
    }

    public static Builder builder(String name, ToolCategory category) {
        return new Builder(name, category);
    }

    public static final class Builder {
        private final String name;
        private final ToolCategory category;
        private String description;
        private InputSchema inputSchema = InputSchema.empty();
        private boolean baseline;
        private RiskLevel risk = RiskLevel.SAFE;

        private Builder(String name, ToolCategory category) {
            this.name = name;
            this.category = category;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder schema(InputSchema inputSchema) {
            this.inputSchema = inputSchema;
            return this;
        }

        public Builder baseline() {
            this.baseline = true;
            return this;
        }

        public Builder risk(RiskLevel risk) {
            this.risk = risk;
            return this;
        }

        public ToolDescriptor build() {
            return new ToolDescriptor(null, name, description, inputSchema, category, baseline, risk);
        }
    }
}
