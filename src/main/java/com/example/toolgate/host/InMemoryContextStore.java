package com.example.toolgate.host;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

public class InMemoryContextStore implements ContextStore {

    private static final String LOCAL_SCOPE = "";
    private static final ObjectMapper CONFIG_MAPPER = new ObjectMapper();

    private final Map<String, Map<String, String>> agentsByScope = new LinkedHashMap<>();
    private final Map<String, String> documents = new LinkedHashMap<>();
    private String baseSystemPrompt = "";

    @Override
    public synchronized List<String> listAgents(String workspaceId) {
        Map<String, String> agents = agentsByScope.get(scope(workspaceId));
        return agents == null ? List.of() : new ArrayList<>(agents.keySet());
    }

    @Override
    public synchronized boolean createAgent(String workspaceId, String name, String wakeWord, String description) {
        Map<String, String> agents = agentsByScope.computeIfAbsent(scope(workspaceId), key -> new LinkedHashMap<>());
        if (agents.containsKey(name)) {
            return false;
        }
        agents.put(name, description == null ? "" : description);
        ObjectNode config = CONFIG_MAPPER.createObjectNode();
        config.put("name", name);
        config.put("wakeWord", wakeWord == null ? "" : wakeWord);
        documents.put(documentKey(name, AgentDocument.CONFIG), config.toString());
        return true;
    }

    @Override
    public synchronized String read(String agentName, AgentDocument document) {
        return documents.getOrDefault(documentKey(agentName, document), "");
    }

    @Override
    public synchronized void write(String agentName, AgentDocument document, String content) {
        documents.put(documentKey(agentName, document), content);
    }

    @Override
    public synchronized String update(String agentName, AgentDocument document, UnaryOperator<String> edit) {
        String key = documentKey(agentName, document);
        String updated = edit.apply(documents.getOrDefault(key, ""));
        documents.put(key, updated);
        return updated;
    }

    @Override
    public synchronized String readBaseSystemPrompt() {
        return baseSystemPrompt;
    }

    @Override
    public synchronized void writeBaseSystemPrompt(String content) {
        baseSystemPrompt = content == null ? "" : content;
    }

    @Override
    public synchronized String updateBaseSystemPrompt(UnaryOperator<String> edit) {
        String updated = edit.apply(baseSystemPrompt);
        baseSystemPrompt = updated == null ? "" : updated;
        return baseSystemPrompt;
    }

    private static String scope(String workspaceId) {
        return workspaceId == null ? LOCAL_SCOPE : workspaceId;
    }

    private static String documentKey(String agentName, AgentDocument document) {
        return agentName + "/" + document.fileName();
    }
}
