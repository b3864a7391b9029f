package com.example.toolgate.tools.registry;

import com.example.toolgate.tools.EnableOutcome;
import com.example.toolgate.tools.GatingControl;
import com.example.toolgate.tools.GatingPolicy;
import com.example.toolgate.tools.GatingSnapshot;
import com.example.toolgate.tools.InputSchema;
import com.example.toolgate.tools.ToolArguments;
import com.example.toolgate.tools.ToolCatalog;
import com.example.toolgate.tools.ToolCategory;
import com.example.toolgate.tools.ToolDescriptor;
import com.example.toolgate.tools.ToolException;
import com.example.toolgate.tools.ToolProvider;
import com.example.toolgate.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class RegistryToolProvider implements ToolProvider {

    public static final ToolCategory CATEGORY = new ToolCategory("registry",
            "Discover tools and enable additional ones for a limited time.");

    public static final String LIST = "tools.list";
    public static final String ENABLE = "tools.enable";
    public static final String ENABLE_CATEGORIES = "tools.enable_categories";
    public static final String ENABLE_TTL = "tools.enable_ttl";
    public static final String RESET = "tools.reset";

    record NamesArgs(List<String> names) {
    }

    record CategoriesArgs(List<String> categories) {
    }

    private final ObjectMapper mapper;
    private volatile GatingControl control;

    public RegistryToolProvider(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Hands the provider the policy it operates on. Until this is called every meta-tool reports
     * the registry as unavailable.
     */
    public void attach(GatingControl control) {
        this.control = control;
    }

    @Override
    public List<ToolDescriptor> descriptors() {
        return List.of(
                ToolDescriptor.builder(LIST, CATEGORY)
                        .description("List tool names grouped by category, category descriptions and the currently enabled tools. Does not include full schemas.")
                        .baseline()
                        .build(),
                ToolDescriptor.builder(ENABLE, CATEGORY)
                        .description("Enable a set of tools by name. Replaces the previously enabled set; baseline tools are always available.")
                        .schema(InputSchema.builder()
                                .stringArray("names", "Tool names to enable", true)
                                .build())
                        .baseline()
                        .build(),
                ToolDescriptor.builder(ENABLE_CATEGORIES, CATEGORY)
                        .description("Enable every tool in the given categories (e.g. agent, agent_edit, settings, telegram, context, search, shell). Replaces the previously enabled set.")
                        .schema(InputSchema.builder()
                                .stringArray("categories", "Category names to enable", true)
                                .build())
                        .baseline()
                        .build(),
                ToolDescriptor.builder(ENABLE_TTL, CATEGORY)
                        .description("Set how many minutes the enabled tools stay enabled.")
                        .schema(InputSchema.builder()
                                .integer("minutes", "TTL in minutes (positive, at most one year)", true)
                                .build())
                        .baseline()
                        .build(),
                ToolDescriptor.builder(RESET, CATEGORY)
                        .description("Reset enabled tools back to baseline only.")
                        .baseline()
                        .build()
        );
    }

    @Override
    public ToolResult invoke(String name, JsonNode arguments) throws ToolException {
        GatingControl gating = control;
        if (gating == null) {
            throw ToolException.hostUnavailable("Tool registry");
        }
        return switch (name) {
            case LIST -> ToolResult.success(mapper, list(gating));
            case ENABLE -> enable(gating, arguments);
            case ENABLE_CATEGORIES -> enableCategories(gating, arguments);
            case ENABLE_TTL -> enableTtl(gating, arguments);
            case RESET -> {
                gating.reset();
                yield ToolResult.success("Tool registry reset to baseline.");
            }
            default -> throw ToolException.unknownTool(name);
        };
    }

    private ObjectNode list(GatingControl gating) {
        ToolCatalog catalog = gating.catalog();
        GatingSnapshot snapshot = gating.snapshot();
        Set<String> active = snapshot.activeNames();

        ObjectNode result = mapper.createObjectNode();
        ObjectNode catalogNode = result.putObject("catalog");
        for (Map.Entry<String, List<String>> entry : catalog.byCategory().entrySet()) {
            ArrayNode names = catalogNode.putArray(entry.getKey());
            entry.getValue().forEach(names::add);
        }
        ObjectNode descriptions = result.putObject("descriptions");
        catalog.categoryDescriptions().forEach(descriptions::put);

        ArrayNode enabled = result.putArray("enabled");
        catalog.all().stream()
                .map(ToolDescriptor::name)
                .filter(active::contains)
                .forEach(enabled::add);

        long baselineCount = catalog.baselineCount();
        long elevatedCount = catalog.all().stream()
                .filter(descriptor -> !descriptor.baseline() && active.contains(descriptor.name()))
                .count();
        result.put("baseline_count", baselineCount);
        result.put("available_tool_count", baselineCount + elevatedCount);
        if (snapshot.expiresAt() != null) {
            result.put("expires_at", snapshot.expiresAt().toString());
        } else {
            result.putNull("expires_at");
        }

        ArrayNode tools = result.putArray("tools");
        for (ToolDescriptor descriptor : catalog.all()) {
            ObjectNode tool = tools.addObject();
            tool.put("name", descriptor.name());
            tool.put("category", descriptor.category().name());
            tool.put("description", descriptor.description());
            tool.put("status", status(descriptor, active));
        }
        return result;
    }

    private static String status(ToolDescriptor descriptor, Collection<String> active) {
        if (descriptor.baseline()) {
            return "baseline";
        }
        return active.contains(descriptor.name()) ? "enabled" : "disabled";
    }

    private ToolResult enable(GatingControl gating, JsonNode arguments) throws ToolException {
        NamesArgs args = ToolArguments.decode(mapper, arguments, NamesArgs.class);
        if (args.names() == null || args.names().isEmpty()) {
            throw ToolException.invalidArguments("'names' must be a non-empty array; use tools.reset to clear");
        }
        EnableOutcome outcome = gating.enable(args.names());
        ObjectNode result = mapper.createObjectNode();
        writeNames(result.putArray("enabled"), outcome.enabled());
        writeNames(result.putArray("unknown"), outcome.unknown());
        return ToolResult.success(mapper, result);
    }

    private ToolResult enableCategories(GatingControl gating, JsonNode arguments) throws ToolException {
        CategoriesArgs args = ToolArguments.decode(mapper, arguments, CategoriesArgs.class);
        if (args.categories() == null || args.categories().isEmpty()) {
            throw ToolException.invalidArguments("'categories' must be a non-empty array");
        }
        EnableOutcome outcome = gating.enableCategories(args.categories());
        ObjectNode result = mapper.createObjectNode();
        writeNames(result.putArray("enabled"), outcome.enabled());
        writeNames(result.putArray("unknown_categories"), outcome.unknown());
        return ToolResult.success(mapper, result);
    }

    private ToolResult enableTtl(GatingControl gating, JsonNode arguments) throws ToolException {
        JsonNode node = arguments.path("minutes");
        long minutes = node.canConvertToLong() ? node.asLong() : -1;
        if (minutes <= 0 || minutes > GatingPolicy.MAX_TTL_MINUTES) {
            throw ToolException.invalidArguments("'minutes' must be a positive integer no greater than "
                    + GatingPolicy.MAX_TTL_MINUTES);
        }
        Instant expiresAt = gating.enableTtl(minutes);
        ObjectNode result = mapper.createObjectNode();
        result.put("ttl_minutes", minutes);
        result.put("expires_at", expiresAt.toString());
        return ToolResult.success(mapper, result);
    }

    private static void writeNames(ArrayNode target, List<String> names) {
        names.forEach(target::add);
    }
}
