package com.example.toolgate.config;

import com.example.toolgate.host.SettingKey;
import com.example.toolgate.host.SettingsStore;

import java.util.Map;
import java.util.Properties;

public record ServerConfig(String tavilyApiKey, String telegramBotToken, int shellTimeoutSeconds, String logFileName) {

    public static final String TAVILY_API_KEY_PROPERTY = "toolgate.tavily.apiKey";
    public static final String TAVILY_API_KEY_ENV = "TAVILY_API_KEY";
    public static final String TELEGRAM_TOKEN_PROPERTY = "toolgate.telegram.token";
    public static final String TELEGRAM_TOKEN_ENV = "TELEGRAM_BOT_TOKEN";
    public static final String SHELL_TIMEOUT_PROPERTY = "toolgate.shell.timeoutSeconds";
    public static final String SHELL_TIMEOUT_ENV = "TOOLGATE_SHELL_TIMEOUT_SECONDS";
    public static final String LOG_FILE_PROPERTY = "toolgate.log.file";

    public static final int DEFAULT_SHELL_TIMEOUT_SECONDS = 20;
    public static final String DEFAULT_LOG_FILE = "tool-gate.log";

    public static ServerConfig fromEnvironment() {
        return load(System.getProperties(), System.getenv());
    }

    /**
     * @throws IllegalArgumentException if the shell timeout is not a positive integer
     */
    public static ServerConfig load(Properties properties, Map<String, String> env) {
        String timeout = lookup(properties, env, SHELL_TIMEOUT_PROPERTY, SHELL_TIMEOUT_ENV);
        int shellTimeout = DEFAULT_SHELL_TIMEOUT_SECONDS;
        if (timeout != null) {
            try {
                shellTimeout = Integer.parseInt(timeout.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(SHELL_TIMEOUT_PROPERTY + " must be an integer: " + timeout, e);
            }
            if (shellTimeout <= 0) {
                throw new IllegalArgumentException(SHELL_TIMEOUT_PROPERTY + " must be positive: " + timeout);
            }
        }
        String logFile = lookup(properties, env, LOG_FILE_PROPERTY, null);
        return new ServerConfig(
                lookup(properties, env, TAVILY_API_KEY_PROPERTY, TAVILY_API_KEY_ENV),
                lookup(properties, env, TELEGRAM_TOKEN_PROPERTY, TELEGRAM_TOKEN_ENV),
                shellTimeout,
                logFile == null ? DEFAULT_LOG_FILE : logFile);
    }

    public void applyTo(SettingsStore settings) {
        if (tavilyApiKey != null) {
            settings.set(SettingKey.TAVILY_API_KEY, tavilyApiKey);
        }
        if (telegramBotToken != null) {
            settings.set(SettingKey.TELEGRAM_BOT_TOKEN, telegramBotToken);
        }
        settings.set(SettingKey.SHELL_TIMEOUT_SECONDS, Integer.toString(shellTimeoutSeconds));
    }

    private static String lookup(Properties properties, Map<String, String> env, String property, String variable) {
        String value = properties.getProperty(property);
        if ((value == null || value.isBlank()) && variable != null) {
            value = env.get(variable);
        }
        return value == null || value.isBlank() ? null : value;
    }
}
