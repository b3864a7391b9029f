package com.example.toolgate.tools.telegram;

import com.example.toolgate.host.HttpTransport;
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
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.List;

public class TelegramToolProvider implements ToolProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(TelegramToolProvider.class);

    public static final ToolCategory CATEGORY = new ToolCategory("telegram",
            "Configure the Telegram bot and send messages.");
    public static final URI DEFAULT_API_BASE = URI.create("https://api.telegram.org");

    private final ObjectMapper mapper;
    private final SettingsStore settings;
    private final HttpTransport transport;
    private final URI apiBase;

    public TelegramToolProvider(ObjectMapper mapper, SettingsStore settings, HttpTransport transport) {
        this(mapper, settings, transport, DEFAULT_API_BASE);
    }

    public TelegramToolProvider(ObjectMapper mapper, SettingsStore settings, HttpTransport transport, URI apiBase) {
        this.mapper = mapper;
        this.settings = settings;
        this.transport = transport;
        this.apiBase = apiBase;
    }

    @Override
    public List<ToolDescriptor> descriptors() {
        return List.of(
                ToolDescriptor.builder("telegram.enable", CATEGORY)
                        .description("Enable or disable Telegram integration. Optionally set the bot token.")
                        .schema(InputSchema.builder()
                                .bool("enabled", "Whether Telegram is enabled", true)
                                .string("token", "Bot token", false)
                                .build())
                        .risk(RiskLevel.SENSITIVE)
                        .build(),
                ToolDescriptor.builder("telegram.set_token", CATEGORY)
                        .description("Set the Telegram bot token.")
                        .schema(InputSchema.builder()
                                .string("token", "Bot token", true)
                                .build())
                        .risk(RiskLevel.SENSITIVE)
                        .build(),
                ToolDescriptor.builder("telegram.get_me", CATEGORY)
                        .description("Fetch the bot username for the configured token.")
                        .build(),
                ToolDescriptor.builder("telegram.send_message", CATEGORY)
                        .description("Send a text message to a chat id.")
                        .schema(InputSchema.builder()
                                .integer("chat_id", "Target chat id", true)
                                .string("text", "Message text", true)
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
            case "telegram.enable" -> enable(arguments);
            case "telegram.set_token" -> setToken(arguments);
            case "telegram.get_me" -> getMe();
            case "telegram.send_message" -> sendMessage(arguments);
            default -> throw ToolException.unknownTool(name);
        };
    }

    private ToolResult enable(JsonNode arguments) {
        boolean enabled = arguments.path("enabled").asBoolean();
        String token = ToolArguments.optionalText(arguments, "token");
        if (token != null && !token.isBlank()) {
            settings.set(SettingKey.TELEGRAM_BOT_TOKEN, token);
        }
        settings.set(SettingKey.TELEGRAM_ENABLED, Boolean.toString(enabled));
        LOGGER.info("Telegram integration {}", enabled ? "enabled" : "disabled");
        return ToolResult.success(enabled ? "Telegram enabled" : "Telegram disabled");
    }

    private ToolResult setToken(JsonNode arguments) throws ToolException {
        settings.set(SettingKey.TELEGRAM_BOT_TOKEN, ToolArguments.requireText(arguments, "token"));
        return ToolResult.success("Token updated");
    }

    private ToolResult getMe() throws ToolException {
        JsonNode result = call("getMe", mapper.createObjectNode());
        String username = result.path("username").asText(null);
        if (username == null) {
            throw ToolException.invalidResponse("Telegram getMe response has no username");
        }
        return ToolResult.success("@" + username);
    }

    private ToolResult sendMessage(JsonNode arguments) throws ToolException {
        String text = ToolArguments.requireText(arguments, "text");
        ObjectNode body = mapper.createObjectNode();
        body.put("chat_id", arguments.path("chat_id").asLong());
        body.put("text", text);
        JsonNode result = call("sendMessage", body);
        return ToolResult.success("Sent (message_id=" + result.path("message_id").asText("?") + ")");
    }

    private JsonNode call(String method, ObjectNode body) throws ToolException {
        if (transport == null) {
            throw ToolException.hostUnavailable("HTTP transport");
        }
        String token = settings.getString(SettingKey.TELEGRAM_BOT_TOKEN);
        if (token.isBlank()) {
            throw ToolException.missingApiKey("Telegram bot");
        }
        URI uri = apiBase.resolve("/bot" + token + "/" + method);

        HttpTransport.Response response;
        try {
            response = transport.postJson(uri, body.toString());
        } catch (IOException e) {
            throw ToolException.apiError("Telegram request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ToolException.apiError("Telegram request interrupted", e);
        }

        JsonNode payload;
        try {
            payload = mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            if (response.status() != 200) {
                throw ToolException.apiError("Telegram API error (" + response.status() + "): " + response.body());
            }
            throw ToolException.invalidResponse("Failed to parse Telegram response");
        }
        if (response.status() != 200 || !payload.path("ok").asBoolean(false)) {
            String description = payload.path("description").asText(response.body());
            LOGGER.warn("Telegram {} failed: status={}, description={}", method, response.status(), description);
            throw ToolException.apiError("Telegram API error (" + response.status() + "): " + description);
        }
        return payload.path("result");
    }
}
