package com.example.toolgate.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public interface ToolProvider {

    List<ToolDescriptor> descriptors();

    ToolResult invoke(String name, JsonNode arguments) throws ToolException;
}
