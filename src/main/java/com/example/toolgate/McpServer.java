package com.example.toolgate;

import com.example.toolgate.config.ServerConfig;
import com.example.toolgate.host.ContextStore;
import com.example.toolgate.host.HttpTransport;
import com.example.toolgate.host.InMemoryContextStore;
import com.example.toolgate.host.InMemorySettingsStore;
import com.example.toolgate.host.JdkHttpTransport;
import com.example.toolgate.host.SettingsStore;
import com.example.toolgate.tools.GatingPolicy;
import com.example.toolgate.tools.ToolCatalog;
import com.example.toolgate.tools.ToolDescriptor;
import com.example.toolgate.tools.ToolDispatcher;
import com.example.toolgate.tools.ToolProvider;
import com.example.toolgate.tools.ToolResult;
import com.example.toolgate.tools.agent.AgentEditorToolProvider;
import com.example.toolgate.tools.agent.AgentToolProvider;
import com.example.toolgate.tools.context.ContextEditToolProvider;
import com.example.toolgate.tools.registry.RegistryToolProvider;
import com.example.toolgate.tools.search.WebSearchToolProvider;
import com.example.toolgate.tools.settings.SettingsToolProvider;
import com.example.toolgate.tools.shell.ShellToolProvider;
import com.example.toolgate.tools.telegram.TelegramToolProvider;
import com.example.toolgate.util.LogLocations;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * MCP server bootstrap that exposes the gated tool catalog over stdio. Only baseline and currently
 * elevated tools are registered with the MCP session; the registration is re-synced after every
 * call so elevation, reset and TTL expiry show up as tool list changes.
 */
public class McpServer {

    private static final String LOG_FILE_PATH = configureSimpleLogger();
    private static final Logger LOGGER = LoggerFactory.getLogger(McpServer.class);

    static final String PRINT_FUNCTION_SCHEMAS = "--print-function-schemas";

    private final ObjectMapper mapper = new ObjectMapper();
    private final McpJsonMapper mcpJsonMapper = McpJsonMapper.getDefault();
    private final ToolDispatcher dispatcher;
    private final Set<String> advertised = new LinkedHashSet<>();
    private McpSyncServer server;

    public McpServer(ServerConfig config) {
        SettingsStore settings = new InMemorySettingsStore();
        config.applyTo(settings);
        ContextStore contextStore = new InMemoryContextStore();
        HttpTransport transport = new JdkHttpTransport(Duration.ofSeconds(30));

        RegistryToolProvider registryTools = new RegistryToolProvider(mapper);
        List<ToolProvider> providers = List.of(
                registryTools,
                new AgentToolProvider(mapper, contextStore, settings),
                new AgentEditorToolProvider(mapper, contextStore, settings),
                new ContextEditToolProvider(contextStore),
                new SettingsToolProvider(mapper, settings),
                new TelegramToolProvider(mapper, settings, transport),
                new WebSearchToolProvider(mapper, settings, transport),
                new ShellToolProvider(settings)
        );
        ToolCatalog catalog = ToolCatalog.of(providers);
        Clock clock = Clock.systemUTC();
        GatingPolicy gating = new GatingPolicy(catalog, clock);
        registryTools.attach(gating);
        this.dispatcher = new ToolDispatcher(catalog, gating, mapper, clock);

        LOGGER.info("Tool catalog built with {} tool(s) in {} categories ({} baseline)",
                catalog.size(), catalog.byCategory().size(), catalog.baselineCount());
    }

    public static void main(String[] args) throws JsonProcessingException {
        McpServer mcpServer = new McpServer(ServerConfig.fromEnvironment());
        if (Arrays.asList(args).contains(PRINT_FUNCTION_SCHEMAS)) {
            System.out.println(mcpServer.mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(mcpServer.dispatcher.functionSchemas()));
            return;
        }
        mcpServer.start();
    }

    public void start() {
        List<ToolDescriptor> initial = dispatcher.callableTools();
        List<McpServerFeatures.SyncToolSpecification> tools = initial.stream()
                .map(this::toToolSpecification)
                .toList();

        if (LOG_FILE_PATH != null) {
            LOGGER.info("Logging MCP server output to {}", LOG_FILE_PATH);
        }

        StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(mcpJsonMapper);

        McpSyncServer syncServer = io.modelcontextprotocol.server.McpServer
                .sync(transportProvider)
                .serverInfo(new McpSchema.Implementation("tool-gate-mcp", "0.1.0"))
                .jsonMapper(mcpJsonMapper)
                .capabilities(McpSchema.ServerCapabilities.builder().tools(true).build())
                .tools(tools)
                .build();

        synchronized (this) {
            this.server = syncServer;
            initial.forEach(descriptor -> advertised.add(descriptor.name()));
        }
        keepServerAlive(syncServer, tools.size());
    }

    private static String configureSimpleLogger() {
        String existing = System.getProperty("org.slf4j.simpleLogger.logFile");
        if (existing != null && !existing.isBlank()) {
            return existing;
        }

        try {
            String fileName = System.getProperty(ServerConfig.LOG_FILE_PROPERTY, ServerConfig.DEFAULT_LOG_FILE);
            Path logFile = LogLocations.resolveLogFile(McpServer.class, fileName);
            if (logFile == null) {
                return null;
            }
            Path parent = logFile.getParent();
            if (parent != null && Files.notExists(parent)) {
                Files.createDirectories(parent);
            }
            String absolutePath = logFile.toAbsolutePath().toString();
            System.setProperty("org.slf4j.simpleLogger.logFile", absolutePath);
            return absolutePath;
        } catch (Exception ex) {
            System.err.println("Failed to configure simple logger file output: " + ex.getMessage());
            return null;
        }
    }

    private void keepServerAlive(McpSyncServer syncServer, int toolCount) {
        CountDownLatch shutdown = new CountDownLatch(1);
        AtomicBoolean closed = new AtomicBoolean(false);

        Runnable shutdownHook = () -> {
            if (closed.compareAndSet(false, true)) {
                try {
                    LOGGER.info("Shutting down MCP server");
                    syncServer.closeGracefully();
                } catch (Exception e) {
                    LOGGER.warn("Error while shutting down MCP server", e);
                } finally {
                    shutdown.countDown();
                }
            }
        };

        Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook, "mcp-server-shutdown"));

        LOGGER.info("MCP server started advertising {} tool(s); awaiting requests...", toolCount);
        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("MCP server interrupted; shutting down");
            shutdownHook.run();
        }
    }

    private McpServerFeatures.SyncToolSpecification toToolSpecification(ToolDescriptor descriptor) {
        McpSchema.Tool tool = McpSchema.Tool.builder()
                .name(descriptor.name())
                .description(descriptor.description())
                .inputSchema(mcpJsonMapper, descriptor.inputSchema().toJson(mapper).toString())
                .build();
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(tool)
                .callHandler((exchange, request) -> executeTool(request))
                .build();
    }

    ToolDispatcher dispatcher() {
        return dispatcher;
    }

    private McpSchema.CallToolResult executeTool(McpSchema.CallToolRequest request) {
        ToolResult result = dispatcher.invoke(request.name(), toArgumentsNode(request));
        syncAdvertisedTools();
        return McpSchema.CallToolResult.builder()
                .isError(result.isError())
                .addTextContent(result.content())
                .build();
    }

    /**
     * Registers newly callable tools and drops the ones that are no longer callable. The SDK sends
     * the list-changed notification for each change.
     */
    private synchronized void syncAdvertisedTools() {
        if (server == null) {
            return;
        }
        List<ToolDescriptor> callable = dispatcher.callableTools();
        Set<String> callableNames = callable.stream()
                .map(ToolDescriptor::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        for (String name : List.copyOf(advertised)) {
            if (!callableNames.contains(name)) {
                server.removeTool(name);
                advertised.remove(name);
            }
        }
        for (ToolDescriptor descriptor : callable) {
            if (advertised.add(descriptor.name())) {
                server.addTool(toToolSpecification(descriptor));
            }
        }
        LOGGER.debug("Advertised tools: {}", advertised);
    }

    private JsonNode toArgumentsNode(McpSchema.CallToolRequest request) {
        if (request.arguments() == null) {
            return mapper.createObjectNode();
        }
        return mapper.valueToTree(request.arguments());
    }
}
