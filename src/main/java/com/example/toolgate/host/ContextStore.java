package com.example.toolgate.host;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Per-agent text blobs (persona, memory, config) plus the shared base system prompt.
 * {@code workspaceId} may be {@code null} for the local, non-workspace scope.
 */
public interface ContextStore {

    List<String> listAgents(String workspaceId);

    /**
     * @return {@code false} if an agent with that name already exists in the scope
     */
    boolean createAgent(String workspaceId, String name, String wakeWord, String description);

    String read(String agentName, AgentDocument document);

    void write(String agentName, AgentDocument document, String content);

    /**
     * Applies {@code edit} to the current content and stores the result as one atomic step.
     *
     * @return the stored content
     */
    String update(String agentName, AgentDocument document, UnaryOperator<String> edit);

    String readBaseSystemPrompt();

    void writeBaseSystemPrompt(String content);

    String updateBaseSystemPrompt(UnaryOperator<String> edit);
}
