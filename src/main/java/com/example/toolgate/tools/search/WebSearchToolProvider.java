package com.example.toolgate.tools.search;

import com.example.toolgate.host.HttpTransport;
import com.example.toolgate.host.SettingKey;
import com.example.toolgate.host.SettingsStore;
import com.example.toolgate.tools.InputSchema;
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
import org.apache.commons.text.WordUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.List;

public class WebSearchToolProvider implements ToolProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSearchToolProvider.class);

    public static final ToolCategory CATEGORY = new ToolCategory("search", "Search the web for current information.");
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.tavily.com/search");

    static final String WEB_SEARCH = "web_search";
    private static final int MAX_RESULTS = 5;
    private static final int SNIPPET_LENGTH = 300;

    private final ObjectMapper mapper;
    private final SettingsStore settings;
    private final HttpTransport transport;
    private final URI endpoint;

    public WebSearchToolProvider(ObjectMapper mapper, SettingsStore settings, HttpTransport transport) {
        this(mapper, settings, transport, DEFAULT_ENDPOINT);
    }

    public WebSearchToolProvider(ObjectMapper mapper, SettingsStore settings, HttpTransport transport, URI endpoint) {
        this.mapper = mapper;
        this.settings = settings;
        this.transport = transport;
        this.endpoint = endpoint;
    }

    @Override
    public List<ToolDescriptor> descriptors() {
        return List.of(ToolDescriptor.builder(WEB_SEARCH, CATEGORY)
                .description("Search the web for current information. Use this when you need up-to-date information about events, facts, or topics.")
                .schema(InputSchema.builder()
                        .string("query", "The search query", true)
                        .build())
                .baseline()
                .build());
    }

    @Override
    public ToolResult invoke(String name, JsonNode arguments) throws ToolException {
        if (!WEB_SEARCH.equals(name)) {
            throw ToolException.unknownTool(name);
        }
        if (settings == null || transport == null) {
            throw ToolException.hostUnavailable(settings == null ? "Settings" : "HTTP transport");
        }
        String apiKey = settings.getString(SettingKey.TAVILY_API_KEY);
        if (apiKey.isBlank()) {
            throw ToolException.missingApiKey("Tavily");
        }
        String query = ToolArguments.requireText(arguments, "query");
        LOGGER.info("Web search request: query={}", query);

        ObjectNode body = mapper.createObjectNode();
        body.put("api_key", apiKey);
        body.put("query", query);
        body.put("search_depth", "basic");
        body.put("include_answer", true);
        body.put("include_raw_content", false);
        body.put("max_results", MAX_RESULTS);

        HttpTransport.Response response;
        try {
            response = transport.postJson(endpoint, body.toString());
        } catch (IOException e) {
            throw ToolException.apiError("Tavily request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ToolException.apiError("Tavily request interrupted", e);
        }
        if (response.status() != 200) {
            LOGGER.error("Tavily API error: status={}, body={}", response.status(), response.body());
            throw ToolException.apiError("Tavily API error (" + response.status() + "): " + response.body());
        }

        JsonNode json;
        try {
            json = mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw ToolException.invalidResponse("Failed to parse Tavily response");
        }
        if (json == null || !json.isObject()) {
            throw ToolException.invalidResponse("Failed to parse Tavily response");
        }
        return ToolResult.success(render(query, json));
    }

    private String render(String query, JsonNode json) {
        StringBuilder text = new StringBuilder();
        String answer = json.path("answer").asText("");
        if (!answer.isEmpty()) {
            text.append("## Summary\n").append(answer).append("\n\n");
        }
        JsonNode results = json.path("results");
        if (results.isArray() && !results.isEmpty()) {
            text.append("## Search Results\n\n");
            int index = 0;
            for (JsonNode result : results) {
                if (index == MAX_RESULTS) {
                    break;
                }
                index++;
                text.append(index).append(". **").append(result.path("title").asText("No title")).append("**\n");
                String url = result.path("url").asText("");
                if (!url.isEmpty()) {
                    text.append("   URL: ").append(url).append('\n');
                }
                String content = result.path("content").asText("");
                if (!content.isEmpty()) {
                    text.append("   ").append(WordUtils.abbreviate(content, SNIPPET_LENGTH, SNIPPET_LENGTH, "...")).append('\n');
                }
                text.append('\n');
            }
        }
        if (text.length() == 0) {
            return "No results found for: " + query;
        }
        return text.toString();
    }
}
