package com.example.toolgate.tools;

public class ToolException extends Exception {

    private final ToolErrorKind kind;

    public ToolException(ToolErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ToolException(ToolErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ToolErrorKind getKind() {
        return kind;
    }

    public static ToolException unknownTool(String name) {
        return new ToolException(ToolErrorKind.UNKNOWN_TOOL,
                "Unknown tool: " + name + ". Call tools.list to see available tools.");
    }

    public static ToolException toolDisabled(String name) {
        return new ToolException(ToolErrorKind.TOOL_DISABLED,
                "Tool '" + name + "' is not enabled. Call tools.enable or tools.enable_categories first.");
    }

    public static ToolException missingApiKey(String service) {
        return new ToolException(ToolErrorKind.MISSING_API_KEY, service + " API key is not configured");
    }

    public static ToolException invalidArguments(String reason) {
        return new ToolException(ToolErrorKind.INVALID_ARGUMENTS, "Invalid arguments: " + reason);
    }

    public static ToolException apiError(String detail) {
        return new ToolException(ToolErrorKind.API_ERROR, detail);
    }

    public static ToolException apiError(String detail, Throwable cause) {
        return new ToolException(ToolErrorKind.API_ERROR, detail, cause);
    }

    public static ToolException invalidResponse(String detail) {
        return new ToolException(ToolErrorKind.INVALID_RESPONSE, detail);
    }

    public static ToolException hostUnavailable(String dependency) {
        return new ToolException(ToolErrorKind.HOST_UNAVAILABLE, dependency + " is not available");
    }

    public static ToolException confirmationDenied(String name) {
        return new ToolException(ToolErrorKind.CONFIRMATION_DENIED, "Tool '" + name + "' was denied by the user.");
    }
}
