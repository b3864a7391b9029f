package com.example.toolgate.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public final class FunctionSchemas {

    public static final String DOT_REPLACEMENT = "-_-";

    private FunctionSchemas() {
    }

    public static String sanitize(String name) {
        return name.replace(".", DOT_REPLACEMENT);
    }

    public static String desanitize(String name) {
        return name.replace(DOT_REPLACEMENT, ".");
    }

    public static ArrayNode export(ObjectMapper mapper, List<ToolDescriptor> descriptors) {
        ArrayNode functions = mapper.createArrayNode();
        for (ToolDescriptor descriptor : descriptors) {
            ObjectNode entry = functions.addObject();
            entry.put("type", "function");
            ObjectNode function = entry.putObject("function");
            function.put("name", sanitize(descriptor.name()));
            function.put("description", descriptor.description());
            function.set("parameters", descriptor.inputSchema().toJson(mapper));
        }
        return functions;
    }
}
