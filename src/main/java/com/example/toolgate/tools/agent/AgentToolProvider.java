package com.example.toolgate.tools.agent;

import com.example.toolgate.host.ContextStore;
import com.example.toolgate.host.SettingKey;
import com.example.toolgate.host.SettingsStore;
import com.example.toolgate.tools.InputSchema;
import com.example.toolgate.tools.RiskLevel;
import com.example.toolgate.tools.ToolArguments;
import com.example.toolgate.tools.ToolCategory;
import com.example.toolgate.tools.ToolDescriptor;
import com.example.toolgate.tools.ToolException;
import com.example.toolgate.tools.ToolProvider;
import com.example.toolgate.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class AgentToolProvider implements ToolProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentToolProvider.class);

    public static final ToolCategory CATEGORY = new ToolCategory("agent", "Create, list and switch agents.");

    private final ObjectMapper mapper;
    private final ContextStore contextStore;
    private final SettingsStore settings;

    public AgentToolProvider(ObjectMapper mapper, ContextStore contextStore, SettingsStore settings) {
        this.mapper = mapper;
        this.contextStore = contextStore;
        this.settings = settings;
    }

    @Override
    public List<ToolDescriptor> descriptors() {
        return List.of(
                ToolDescriptor.builder("agent.create", CATEGORY)
                        .description("Create a new agent with optional wake word and description. Workspace-aware if a current workspace is set.")
                        .schema(InputSchema.builder()
                                .string("name", "Agent name", true)
                                .string("wake_word", "Wake word; defaults to the configured one", false)
                                .string("description", "Short description", false)
                                .build())
                        .risk(RiskLevel.SENSITIVE)
                        .build(),
                ToolDescriptor.builder("agent.list", CATEGORY)
                        .description("List agent names. Workspace-aware if a current workspace is set.")
                        .baseline()
                        .build(),
                ToolDescriptor.builder("agent.set_active", CATEGORY)
                        .description("Set the active agent by name.")
                        .schema(InputSchema.builder()
                                .string("name", "Agent name", true)
                                .build())
                        .risk(RiskLevel.SENSITIVE)
                        .build()
        );
    }

    @Override
    public ToolResult invoke(String name, JsonNode arguments) throws ToolException {
        if (contextStore == null) {
            throw ToolException.hostUnavailable("Context store");
        }
        if (settings == null) {
            throw ToolException.hostUnavailable("Settings");
        }
        return switch (name) {
            case "agent.create" -> createAgent(arguments);
            case "agent.list" -> listAgents();
            case "agent.set_active" -> setActiveAgent(arguments);
            default -> throw ToolException.unknownTool(name);
        };
    }

    private ToolResult createAgent(JsonNode arguments) throws ToolException {
        String agentName = ToolArguments.requireText(arguments, "name");
        String wakeWord = ToolArguments.optionalText(arguments, "wake_word");
        if (wakeWord == null || wakeWord.isBlank()) {
            wakeWord = settings.getString(SettingKey.WAKE_WORD);
        }
        String description = ToolArguments.optionalText(arguments, "description");

        if (!contextStore.createAgent(currentWorkspace(), agentName, wakeWord, description == null ? "" : description)) {
            return ToolResult.error("Agent already exists: " + agentName);
        }
        LOGGER.info("Created agent name={}, wakeWord={}", agentName, wakeWord);
        return ToolResult.success("Created agent '" + agentName + "'");
    }

    private ToolResult listAgents() {
        ArrayNode names = mapper.createArrayNode();
        contextStore.listAgents(currentWorkspace()).forEach(names::add);
        return ToolResult.success(mapper, names);
    }

    private ToolResult setActiveAgent(JsonNode arguments) throws ToolException {
        String agentName = ToolArguments.requireText(arguments, "name");
        List<String> available = contextStore.listAgents(currentWorkspace());
        if (!available.contains(agentName)) {
            return ToolResult.error("Agent not found: " + agentName + ". Available: " + available);
        }
        settings.set(SettingKey.ACTIVE_AGENT_NAME, agentName);
        return ToolResult.success("Active agent set to " + agentName);
    }

    private String currentWorkspace() {
        return settings.get(SettingKey.CURRENT_WORKSPACE_ID).orElse(null);
    }
}
