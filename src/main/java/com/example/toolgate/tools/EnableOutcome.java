package com.example.toolgate.tools;

import java.util.List;

public record EnableOutcome(List<String> enabled, List<String> unknown) {

    public EnableOutcome {
        enabled = List.copyOf(enabled);
        unknown = List.copyOf(unknown);
    }
}
