package com.example.toolgate.tools;

public enum RiskLevel {
    SAFE,
    SENSITIVE,
    RESTRICTED;

    public boolean requiresConfirmation() {
        return this != SAFE;
    }
}
