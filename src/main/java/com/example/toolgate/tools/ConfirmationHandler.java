package com.example.toolgate.tools;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface ConfirmationHandler {

    boolean confirm(ToolDescriptor descriptor, JsonNode arguments);
}
