package com.example.toolgate.host;

public enum AgentDocument {
    PERSONA("persona.md"),
    MEMORY("memory.md"),
    CONFIG("config.json");

    private final String fileName;

    AgentDocument(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
