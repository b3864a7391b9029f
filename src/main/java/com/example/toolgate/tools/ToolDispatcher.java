package com.example.toolgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Single entry point for tool calls. Resolves the name, checks gating, validates the argument
 * shape, asks for confirmation where the tool's risk demands it, and delegates to the provider.
 * Every outcome comes back as a {@link ToolResult}; nothing is thrown to the caller.
 *
 * <p>The gating lock is only held for the callable check, never while a provider runs.
 */
public final class ToolDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolCatalog catalog;
    private final GatingPolicy gating;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ConfirmationHandler confirmationHandler;

    public ToolDispatcher(ToolCatalog catalog, GatingPolicy gating, ObjectMapper mapper, Clock clock) {
        this(catalog, gating, mapper, clock, null);
    }

    public ToolDispatcher(ToolCatalog catalog, GatingPolicy gating, ObjectMapper mapper, Clock clock,
                          ConfirmationHandler confirmationHandler) {
        this.catalog = catalog;
        this.gating = gating;
        this.mapper = mapper;
        this.clock = clock;
        this.confirmationHandler = confirmationHandler;
    }

    public ToolResult invoke(String name, JsonNode arguments) {
        return invoke(name, arguments, clock.instant());
    }

    public ToolResult invoke(String name, JsonNode arguments, Instant now) {
        String resolvedName = name == null ? "" : FunctionSchemas.desanitize(name);
        try {
            ToolDescriptor descriptor = catalog.descriptor(resolvedName)
                    .orElseThrow(() -> ToolException.unknownTool(name));
            ToolProvider provider = catalog.resolve(resolvedName)
                    .orElseThrow(() -> ToolException.unknownTool(name));
            if (!gating.isCallable(descriptor, now)) {
                throw ToolException.toolDisabled(resolvedName);
            }

            JsonNode args = arguments == null || arguments.isNull() ? mapper.createObjectNode() : arguments;
            ArgumentValidator.validate(descriptor.inputSchema(), args);
            confirm(descriptor, args);

            LOGGER.info("Executing tool: {}", resolvedName);
            ToolResult result = provider.invoke(resolvedName, args);
            if (result == null) {
                LOGGER.warn("Tool '{}' returned no result", resolvedName);
                return ToolResult.error("Tool '" + resolvedName + "' returned no result");
            }
            if (result.isError()) {
                LOGGER.warn("Tool '{}' returned error: {}", resolvedName, result.content());
            } else {
                LOGGER.debug("Tool '{}' completed successfully", resolvedName);
            }
            return result;
        } catch (ToolException e) {
            LOGGER.warn("Tool '{}' rejected ({}): {}", resolvedName, e.getKind(), e.getMessage());
            return ToolResult.error(e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("Tool '{}' execution failed", resolvedName, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ToolResult.error("Tool execution failed: " + message);
        }
    }

    private void confirm(ToolDescriptor descriptor, JsonNode arguments) throws ToolException {
        if (confirmationHandler == null || !descriptor.risk().requiresConfirmation()) {
            return;
        }
        if (!confirmationHandler.confirm(descriptor, arguments)) {
            LOGGER.info("Tool '{}' denied by user", descriptor.name());
            throw ToolException.confirmationDenied(descriptor.name());
        }
    }

    public List<ToolDescriptor> callableTools() {
        return gating.callable(clock.instant());
    }

    public ArrayNode functionSchemas() {
        return FunctionSchemas.export(mapper, callableTools());
    }

    public ToolCatalog catalog() {
        return catalog;
    }
}
