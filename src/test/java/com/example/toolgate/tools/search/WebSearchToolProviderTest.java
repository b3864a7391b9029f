package com.example.toolgate.tools.search;

import com.example.toolgate.host.HttpTransport;
import com.example.toolgate.host.InMemorySettingsStore;
import com.example.toolgate.host.SettingKey;
import com.example.toolgate.tools.ToolErrorKind;
import com.example.toolgate.tools.ToolException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebSearchToolProviderTest {

    private static final URI ENDPOINT = URI.create("http://search.test/search");

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> bodies = new ArrayList<>();
    private InMemorySettingsStore settings;

    @BeforeEach
    void setUp() {
        settings = new InMemorySettingsStore();
    }

    private WebSearchToolProvider provider(int status, String body) {
        HttpTransport transport = (uri, request) -> {
            bodies.add(request);
            return new HttpTransport.Response(status, body);
        };
        return new WebSearchToolProvider(mapper, settings, transport, ENDPOINT);
    }

    private ObjectNode query(String text) {
        return mapper.createObjectNode().put("query", text);
    }

    @Test
    void requiresAnApiKey() {
        ToolException error = assertThrows(ToolException.class,
                () -> provider(200, "{}").invoke(WebSearchToolProvider.WEB_SEARCH, query("java")));

        assertEquals(ToolErrorKind.MISSING_API_KEY, error.getKind());
        assertEquals("Tavily API key is not configured", error.getMessage());
        assertTrue(bodies.isEmpty());
    }

    @Test
    void rendersSummaryAndResults() throws Exception {
        settings.set(SettingKey.TAVILY_API_KEY, "tvly-key");
        String longContent = "a".repeat(400);
        String response = "{\"answer\":\"Java 17 is an LTS release.\",\"results\":["
                + "{\"title\":\"JDK 17\",\"url\":\"https://openjdk.org/projects/jdk/17/\",\"content\":\"" + longContent + "\"},"
                + "{\"url\":\"https://example.org\"}]}";

        String text = provider(200, response).invoke(WebSearchToolProvider.WEB_SEARCH, query("java 17")).content();

        assertTrue(text.startsWith("## Summary\nJava 17 is an LTS release.\n\n## Search Results\n\n"));
        assertTrue(text.contains("1. **JDK 17**\n   URL: https://openjdk.org/projects/jdk/17/\n"));
        assertTrue(text.contains("   " + "a".repeat(300) + "...\n"));
        assertTrue(text.contains("2. **No title**"));

        JsonNode request = mapper.readTree(bodies.get(0));
        assertEquals("tvly-key", request.path("api_key").asText());
        assertEquals("java 17", request.path("query").asText());
        assertEquals(5, request.path("max_results").asInt());
    }

    @Test
    void reportsEmptyResults() throws Exception {
        settings.set(SettingKey.TAVILY_API_KEY, "tvly-key");

        String text = provider(200, "{\"results\":[]}").invoke(WebSearchToolProvider.WEB_SEARCH, query("nothing")).content();

        assertEquals("No results found for: nothing", text);
    }

    @Test
    void surfacesHttpErrors() {
        settings.set(SettingKey.TAVILY_API_KEY, "tvly-key");

        ToolException error = assertThrows(ToolException.class,
                () -> provider(429, "rate limited").invoke(WebSearchToolProvider.WEB_SEARCH, query("java")));

        assertEquals(ToolErrorKind.API_ERROR, error.getKind());
        assertEquals("Tavily API error (429): rate limited", error.getMessage());
    }

    @Test
    void rejectsMalformedResponses() {
        settings.set(SettingKey.TAVILY_API_KEY, "tvly-key");

        ToolException error = assertThrows(ToolException.class,
                () -> provider(200, "not json").invoke(WebSearchToolProvider.WEB_SEARCH, query("java")));

        assertEquals(ToolErrorKind.INVALID_RESPONSE, error.getKind());
        assertEquals("Failed to parse Tavily response", error.getMessage());
    }
}
