package com.example.toolgate.tools.settings;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class SettingsToolProvider implements ToolProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsToolProvider.class);

    public static final ToolCategory CATEGORY = new ToolCategory("settings", "Read and change application settings.");

    private static final List<String> KEYS = Arrays.stream(SettingKey.values()).map(SettingKey::key).toList();

    private final ObjectMapper mapper;
    private final SettingsStore settings;

    public SettingsToolProvider(ObjectMapper mapper, SettingsStore settings) {
        this.mapper = mapper;
        this.settings = settings;
    }

    @Override
    public List<ToolDescriptor> descriptors() {
        return List.of(
                ToolDescriptor.builder("settings.list", CATEGORY)
                        .description("List supported setting keys, their types and current values. Secrets are masked.")
                        .build(),
                ToolDescriptor.builder("settings.get", CATEGORY)
                        .description("Get the current value of a setting key.")
                        .schema(InputSchema.builder()
                                .oneOf("key", "Setting key", true, KEYS)
                                .build())
                        .build(),
                ToolDescriptor.builder("settings.set", CATEGORY)
                        .description("Set an application setting. Use settings.list to discover keys and types.")
                        .schema(InputSchema.builder()
                                .oneOf("key", "Setting key to update", true, KEYS)
                                .string("value", "New value (stringified); the type is checked per key", true)
                                .build())
                        .risk(RiskLevel.SENSITIVE)
                        .build()
        );
    }

    @Override
    public ToolResult invoke(String name, JsonNode arguments) throws ToolException {
        if (settings == null) {
            throw ToolException.hostUnavailable("Settings");
        }
        return switch (name) {
            case "settings.list" -> list();
            case "settings.get" -> get(arguments);
            case "settings.set" -> set(arguments);
            default -> throw ToolException.unknownTool(name);
        };
    }

    private ToolResult list() {
        ArrayNode entries = mapper.createArrayNode();
        for (SettingKey key : SettingKey.values()) {
            ObjectNode entry = entries.addObject();
            entry.put("key", key.key());
            entry.put("type", key.type().name().toLowerCase(Locale.ROOT));
            writeValue(entry, key);
        }
        return ToolResult.success(mapper, entries);
    }

    private ToolResult get(JsonNode arguments) throws ToolException {
        SettingKey key = resolveKey(arguments);
        ObjectNode entry = mapper.createObjectNode();
        entry.put("key", key.key());
        writeValue(entry, key);
        return ToolResult.success(mapper, entry);
    }

    private ToolResult set(JsonNode arguments) throws ToolException {
        SettingKey key = resolveKey(arguments);
        String value = arguments.path("value").asText();
        try {
            settings.set(key, value);
        } catch (IllegalArgumentException e) {
            throw ToolException.invalidArguments(key.key() + ": " + e.getMessage());
        }
        LOGGER.info("Setting {} updated", key.key());
        return ToolResult.success("Updated " + key.key() + " = " + display(key, settings.get(key)));
    }

    private SettingKey resolveKey(JsonNode arguments) throws ToolException {
        String raw = ToolArguments.requireText(arguments, "key");
        return SettingKey.fromKey(raw)
                .orElseThrow(() -> ToolException.invalidArguments("unknown setting key '" + raw + "'"));
    }

    private void writeValue(ObjectNode entry, SettingKey key) {
        Optional<String> value = settings.get(key);
        if (value.isEmpty()) {
            entry.putNull("value");
        } else {
            entry.put("value", display(key, value));
        }
    }

    static String display(SettingKey key, Optional<String> value) {
        if (value.isEmpty()) {
            return "(unset)";
        }
        return key.secret() ? mask(value.get()) : value.get();
    }

    static String mask(String secret) {
        if (secret.length() <= 4) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
