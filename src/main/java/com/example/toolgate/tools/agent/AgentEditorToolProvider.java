package com.example.toolgate.tools.agent;

import com.example.toolgate.host.AgentDocument;
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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class AgentEditorToolProvider implements ToolProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentEditorToolProvider.class);

    public static final ToolCategory CATEGORY = new ToolCategory("agent_edit",
            "Edit an agent's persona, memory and config.");

    private static final String NAME_HELP = "Agent name; defaults to the active agent";
    private static final List<String> UPDATE_MODES = List.of("replace", "append");

    private final ObjectMapper mapper;
    private final ContextStore contextStore;
    private final SettingsStore settings;

    public AgentEditorToolProvider(ObjectMapper mapper, ContextStore contextStore, SettingsStore settings) {
        this.mapper = mapper;
        this.contextStore = contextStore;
        this.settings = settings;
    }

    @Override
    public List<ToolDescriptor> descriptors() {
        return List.of(
                editor("agent.persona_get", "Get persona.md for an agent.", InputSchema.builder()
                        .string("name", NAME_HELP, false)),
                editor("agent.persona_search", "Search persona.md and return matching lines with indices.", InputSchema.builder()
                        .string("query", "Case-insensitive substring", true)
                        .string("name", NAME_HELP, false)),
                editor("agent.persona_replace", "Replace occurrences of 'find' with 'replace' in persona.md.", InputSchema.builder()
                        .string("find", "Text to find", true)
                        .string("replace", "Replacement text", true)
                        .string("name", NAME_HELP, false)),
                editor("agent.persona_delete_lines", "Delete lines in persona.md that contain the substring.", InputSchema.builder()
                        .string("contains", "Substring identifying lines to delete", true)
                        .string("name", NAME_HELP, false)),
                editor("agent.persona_update", "Update persona.md (replace or append).", InputSchema.builder()
                        .oneOf("mode", "replace or append", true, UPDATE_MODES)
                        .string("content", "New content", true)
                        .string("name", NAME_HELP, false)),
                editor("agent.memory_get", "Get memory.md for an agent.", InputSchema.builder()
                        .string("name", NAME_HELP, false)),
                editor("agent.memory_append", "Append an entry to memory.md (prefixed with '- ' if needed).", InputSchema.builder()
                        .string("content", "Entry to append", true)
                        .string("name", NAME_HELP, false)),
                editor("agent.memory_replace", "Replace memory.md entirely.", InputSchema.builder()
                        .string("content", "New content", true)
                        .string("name", NAME_HELP, false)),
                editor("agent.memory_update", "Replace the first memory.md line containing 'find' with '- replace'. An empty replace deletes the line.", InputSchema.builder()
                        .string("find", "Substring identifying the line", true)
                        .string("replace", "Replacement entry; empty to delete", true)
                        .string("name", NAME_HELP, false)),
                editor("agent.config_get", "Get config.json for an agent.", InputSchema.builder()
                        .string("name", NAME_HELP, false)),
                editor("agent.config_update", "Merge a JSON object into config.json (top-level keys overwrite).", InputSchema.builder()
                        .string("content", "JSON object to merge", true)
                        .string("name", NAME_HELP, false))
        );
    }

    private static ToolDescriptor editor(String name, String description, InputSchema.Builder schema) {
        return ToolDescriptor.builder(name, CATEGORY)
                .description(description)
                .schema(schema.build())
                .risk(name.endsWith("_get") || name.endsWith("_search") ? RiskLevel.SAFE : RiskLevel.SENSITIVE)
                .build();
    }

    @Override
    public ToolResult invoke(String name, JsonNode arguments) throws ToolException {
        if (contextStore == null) {
            throw ToolException.hostUnavailable("Context store");
        }
        String agent = resolveAgent(arguments);
        return switch (name) {
            case "agent.persona_get" -> get(agent, AgentDocument.PERSONA);
            case "agent.persona_search" -> search(agent, ToolArguments.requireText(arguments, "query"));
            case "agent.persona_replace" -> replaceText(agent, arguments);
            case "agent.persona_delete_lines" -> deleteLines(agent, ToolArguments.requireText(arguments, "contains"));
            case "agent.persona_update" -> updatePersona(agent, arguments);
            case "agent.memory_get" -> get(agent, AgentDocument.MEMORY);
            case "agent.memory_append" -> appendMemory(agent, ToolArguments.requireText(arguments, "content"));
            case "agent.memory_replace" -> replaceMemory(agent, arguments);
            case "agent.memory_update" -> updateMemoryLine(agent, arguments);
            case "agent.config_get" -> get(agent, AgentDocument.CONFIG);
            case "agent.config_update" -> updateConfig(agent, ToolArguments.requireText(arguments, "content"));
            default -> throw ToolException.unknownTool(name);
        };
    }

    private String resolveAgent(JsonNode arguments) throws ToolException {
        String explicit = ToolArguments.optionalText(arguments, "name");
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        if (settings == null) {
            throw ToolException.hostUnavailable("Settings");
        }
        String active = settings.getString(SettingKey.ACTIVE_AGENT_NAME);
        if (active.isBlank()) {
            throw ToolException.invalidArguments("'name' is required when no agent is active");
        }
        return active;
    }

    private ToolResult get(String agent, AgentDocument document) {
        String content = contextStore.read(agent, document);
        return ToolResult.success(content.isEmpty() ? "(" + document.fileName() + " is empty)" : content);
    }

    private ToolResult search(String agent, String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<String> lines = lines(contextStore.read(agent, AgentDocument.PERSONA));
        ArrayNode matches = mapper.createArrayNode();
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).toLowerCase(Locale.ROOT).contains(needle)) {
                ObjectNode match = matches.addObject();
                match.put("index", i);
                match.put("line", lines.get(i));
            }
        }
        return ToolResult.success(mapper, matches);
    }

    private ToolResult replaceText(String agent, JsonNode arguments) throws ToolException {
        String find = ToolArguments.requireText(arguments, "find");
        String replacement = arguments.path("replace").asText("");
        AtomicInteger count = new AtomicInteger();
        contextStore.update(agent, AgentDocument.PERSONA, current -> {
            count.set(countOccurrences(current, find));
            return current.replace(find, replacement);
        });
        if (count.get() == 0) {
            return ToolResult.error("No occurrences of '" + find + "' in persona.md");
        }
        LOGGER.info("persona.md of {} updated: {} replacement(s)", agent, count.get());
        return ToolResult.success("Replaced " + count.get() + " occurrence(s)");
    }

    private ToolResult deleteLines(String agent, String contains) {
        AtomicInteger removed = new AtomicInteger();
        contextStore.update(agent, AgentDocument.PERSONA, current -> {
            List<String> lines = lines(current);
            List<String> kept = new ArrayList<>();
            for (String line : lines) {
                if (!line.contains(contains)) {
                    kept.add(line);
                }
            }
            removed.set(lines.size() - kept.size());
            return removed.get() == 0 ? current : String.join("\n", kept);
        });
        if (removed.get() == 0) {
            return ToolResult.error("No lines contain '" + contains + "'");
        }
        return ToolResult.success("Deleted " + removed.get() + " line(s)");
    }

    private ToolResult updatePersona(String agent, JsonNode arguments) throws ToolException {
        String mode = ToolArguments.requireText(arguments, "mode");
        String content = arguments.path("content").asText("");
        if ("append".equals(mode)) {
            contextStore.update(agent, AgentDocument.PERSONA, current -> appendBlock(current, content));
        } else {
            contextStore.write(agent, AgentDocument.PERSONA, content);
        }
        LOGGER.info("persona.md of {} updated (mode={})", agent, mode);
        return ToolResult.success("persona.md updated (mode=" + mode + ")");
    }

    private ToolResult appendMemory(String agent, String content) {
        String entry = content.startsWith("- ") ? content : "- " + content;
        contextStore.update(agent, AgentDocument.MEMORY,
                current -> current.isEmpty() ? entry : stripTrailingNewline(current) + "\n" + entry);
        return ToolResult.success("Appended to memory.md");
    }

    private ToolResult replaceMemory(String agent, JsonNode arguments) {
        contextStore.write(agent, AgentDocument.MEMORY, arguments.path("content").asText(""));
        return ToolResult.success("memory.md replaced");
    }

    private ToolResult updateMemoryLine(String agent, JsonNode arguments) throws ToolException {
        String find = ToolArguments.requireText(arguments, "find");
        String replacement = arguments.path("replace").asText("");
        AtomicInteger index = new AtomicInteger(-1);
        contextStore.update(agent, AgentDocument.MEMORY, current -> {
            List<String> lines = lines(current);
            for (int i = 0; i < lines.size(); i++) {
                if (!lines.get(i).contains(find)) {
                    continue;
                }
                index.set(i);
                if (replacement.isBlank()) {
                    lines.remove(i);
                } else {
                    lines.set(i, replacement.startsWith("- ") ? replacement : "- " + replacement);
                }
                return String.join("\n", lines);
            }
            return current;
        });
        if (index.get() < 0) {
            return ToolResult.error("No memory line contains '" + find + "'");
        }
        return ToolResult.success(replacement.isBlank()
                ? "Deleted memory line " + index.get()
                : "Updated memory line " + index.get());
    }

    private ToolResult updateConfig(String agent, String content) throws ToolException {
        JsonNode patch;
        try {
            patch = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw ToolException.invalidArguments("'content' is not valid JSON: " + e.getOriginalMessage());
        }
        if (!patch.isObject()) {
            throw ToolException.invalidArguments("'content' must be a JSON object");
        }
        ObjectNode fields = (ObjectNode) patch;
        AtomicReference<ObjectNode> merged = new AtomicReference<>();
        contextStore.update(agent, AgentDocument.CONFIG, current -> {
            ObjectNode config = parseConfig(agent, current);
            config.setAll(fields);
            merged.set(config);
            try {
                return mapper.writeValueAsString(config);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize config for " + agent, e);
            }
        });
        return ToolResult.success(mapper, merged.get());
    }

    private ObjectNode parseConfig(String agent, String existing) {
        if (existing.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(existing);
            if (node.isObject()) {
                return (ObjectNode) node;
            }
        } catch (JsonProcessingException e) {
            LOGGER.warn("config.json of {} is not valid JSON; starting from an empty object", agent);
        }
        return mapper.createObjectNode();
    }

    private static List<String> lines(String content) {
        List<String> lines = new ArrayList<>();
        if (content.isEmpty()) {
            return lines;
        }
        for (String line : content.split("\n", -1)) {
            lines.add(line);
        }
        return lines;
    }

    private static String appendBlock(String current, String content) {
        return current.isEmpty() ? content : current + "\n\n" + content;
    }

    private static String stripTrailingNewline(String value) {
        return value.endsWith("\n") ? value.substring(0, value.length() - 1) : value;
    }

    private static int countOccurrences(String haystack, String needle) {
        int count = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
