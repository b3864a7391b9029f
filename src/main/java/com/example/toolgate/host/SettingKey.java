package com.example.toolgate.host;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum SettingKey {
    WAKE_WORD("wakeWord", Type.STRING, false, "assistant"),
    ACTIVE_AGENT_NAME("activeAgentName", Type.STRING, false, "default"),
    CURRENT_WORKSPACE_ID("currentWorkspaceId", Type.STRING, false, null),
    DEFAULT_USER_ID("defaultUserId", Type.STRING, false, null),
    TELEGRAM_ENABLED("telegramEnabled", Type.BOOLEAN, false, "false"),
    TELEGRAM_BOT_TOKEN("telegramBotToken", Type.STRING, true, null),
    TAVILY_API_KEY("tavilyApiKey", Type.STRING, true, null),
    SHELL_TIMEOUT_SECONDS("shellTimeoutSeconds", Type.INTEGER, false, "20");

    public enum Type {
        STRING,
        BOOLEAN,
        INTEGER;

        /**
         * @throws IllegalArgumentException if {@code raw} is not a valid value of this type
         */
        public String normalize(String raw) {
            String trimmed = raw.trim();
            return switch (this) {
                case BOOLEAN -> normalizeBoolean(trimmed, raw);
                case INTEGER -> normalizeInteger(trimmed, raw);
                case STRING -> raw;
            };
        }

        private static String normalizeBoolean(String trimmed, String raw) {
            String lower = trimmed.toLowerCase(Locale.ROOT);
            if (lower.equals("true") || lower.equals("1") || lower.equals("yes")) {
                return "true";
            }
            if (lower.equals("false") || lower.equals("0") || lower.equals("no")) {
                return "false";
            }
            throw new IllegalArgumentException("expected a boolean but got '" + raw + "'");
        }

        private static String normalizeInteger(String trimmed, String raw) {
            try {
                return Integer.toString(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("expected an integer but got '" + raw + "'");
            }
        }
    }

    private final String key;
    private final Type type;
    private final boolean secret;
    private final String defaultValue;

    SettingKey(String key, Type type, boolean secret, String defaultValue) {
        this.key = key;
        this.type = type;
        this.secret = secret;
        this.defaultValue = defaultValue;
    }

    public String key() {
        return key;
    }

    public Type type() {
        return type;
    }

    public boolean secret() {
        return secret;
    }

    public String defaultValue() {
        return defaultValue;
    }

    public static Optional<SettingKey> fromKey(String key) {
        return Arrays.stream(values()).filter(value -> value.key.equals(key)).findFirst();
    }
}
