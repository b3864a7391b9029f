package com.example.toolgate.tools;

public enum ToolErrorKind {
    /** No provider registered the name. */
    UNKNOWN_TOOL,
    /** The tool exists but is neither baseline nor currently elevated. */
    TOOL_DISABLED,
    MISSING_API_KEY,
    INVALID_ARGUMENTS,
    API_ERROR,
    INVALID_RESPONSE,
    /** A collaborator the provider needs was never wired in. */
    HOST_UNAVAILABLE,
    CONFIRMATION_DENIED
}
