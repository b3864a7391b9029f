package com.example.toolgate.tools;

import java.util.Objects;

public record ToolCategory(String name, String description) {

    public ToolCategory {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Category name must not be blank");
        }
        description = description == null ? "" : description;
    }
}
