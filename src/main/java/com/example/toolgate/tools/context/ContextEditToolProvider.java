package com.example.toolgate.tools.context;

import com.example.toolgate.host.ContextStore;
import com.example.toolgate.tools.InputSchema;
import com.example.toolgate.tools.RiskLevel;
import com.example.toolgate.tools.ToolArguments;
import com.example.toolgate.tools.ToolCategory;
import com.example.toolgate.tools.ToolDescriptor;
import com.example.toolgate.tools.ToolException;
import com.example.toolgate.tools.ToolProvider;
import com.example.toolgate.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class ContextEditToolProvider implements ToolProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextEditToolProvider.class);

    public static final ToolCategory CATEGORY = new ToolCategory("context",
            "Edit the base system prompt shared by all agents.");

    static final String UPDATE_BASE_SYSTEM_PROMPT = "context.update_base_system_prompt";

    private final ContextStore contextStore;

    public ContextEditToolProvider(ContextStore contextStore) {
        this.contextStore = contextStore;
    }

    @Override
    public List<ToolDescriptor> descriptors() {
        return List.of(ToolDescriptor.builder(UPDATE_BASE_SYSTEM_PROMPT, CATEGORY)
                .description("Replace or append to the base system prompt (system_prompt.md).")
                .schema(InputSchema.builder()
                        .oneOf("mode", "replace or append", true, List.of("replace", "append"))
                        .string("content", "Prompt text", true)
                        .build())
                .risk(RiskLevel.SENSITIVE)
                .build());
    }

    @Override
    public ToolResult invoke(String name, JsonNode arguments) throws ToolException {
        if (!UPDATE_BASE_SYSTEM_PROMPT.equals(name)) {
            throw ToolException.unknownTool(name);
        }
        if (contextStore == null) {
            throw ToolException.hostUnavailable("Context store");
        }
        String mode = ToolArguments.requireText(arguments, "mode");
        String content = arguments.path("content").asText("");
        if ("append".equals(mode)) {
            contextStore.updateBaseSystemPrompt(current -> current.isEmpty() ? content : current + "\n\n" + content);
        } else {
            contextStore.writeBaseSystemPrompt(content);
        }
        LOGGER.info("system_prompt.md updated (mode={})", mode);
        return ToolResult.success("Base system prompt updated (mode=" + mode + ")");
    }
}
