package com.example.toolgate.config;

import com.example.toolgate.host.InMemorySettingsStore;
import com.example.toolgate.host.SettingKey;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ServerConfigTest {

    @Test
    void usesDefaultsWhenNothingIsSet() {
        ServerConfig config = ServerConfig.load(new Properties(), Map.of());

        assertNull(config.tavilyApiKey());
        assertNull(config.telegramBotToken());
        assertEquals(ServerConfig.DEFAULT_SHELL_TIMEOUT_SECONDS, config.shellTimeoutSeconds());
        assertEquals(ServerConfig.DEFAULT_LOG_FILE, config.logFileName());
    }

    @Test
    void systemPropertiesWinOverEnvironment() {
        Properties properties = new Properties();
        properties.setProperty(ServerConfig.TAVILY_API_KEY_PROPERTY, "from-property");
        properties.setProperty(ServerConfig.TELEGRAM_TOKEN_PROPERTY, "  ");

        ServerConfig config = ServerConfig.load(properties, Map.of(
                ServerConfig.TAVILY_API_KEY_ENV, "from-env",
                ServerConfig.TELEGRAM_TOKEN_ENV, "123:abc",
                ServerConfig.SHELL_TIMEOUT_ENV, " 45 "));

        assertEquals("from-property", config.tavilyApiKey());
        assertEquals("123:abc", config.telegramBotToken());
        assertEquals(45, config.shellTimeoutSeconds());
    }

    @Test
    void rejectsInvalidShellTimeouts() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.load(new Properties(), Map.of(ServerConfig.SHELL_TIMEOUT_ENV, "soon")));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.load(new Properties(), Map.of(ServerConfig.SHELL_TIMEOUT_ENV, "0")));
    }

    @Test
    void appliesValuesToSettings() {
        InMemorySettingsStore settings = new InMemorySettingsStore();

        new ServerConfig("tvly-key", null, 7, ServerConfig.DEFAULT_LOG_FILE).applyTo(settings);

        assertEquals("tvly-key", settings.getString(SettingKey.TAVILY_API_KEY));
        assertEquals("", settings.getString(SettingKey.TELEGRAM_BOT_TOKEN));
        assertEquals(7, settings.getInt(SettingKey.SHELL_TIMEOUT_SECONDS, 0));
    }
}
