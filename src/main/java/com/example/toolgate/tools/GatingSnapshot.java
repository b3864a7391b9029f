package com.example.toolgate.tools;

import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time copy of the elevation state.
 *
 * @param enabledNames elevated names, or {@code null} when only baseline tools are callable
 * @param expiresAt    when the elevation lapses, or {@code null} for no expiry
 * @param takenAt      the instant the snapshot was evaluated against
 */
public record GatingSnapshot(Set<String> enabledNames, Instant expiresAt, Instant takenAt) {

    public GatingSnapshot {
        enabledNames = enabledNames == null ? null : Set.copyOf(enabledNames);
    }

    public boolean expired() {
        return expiresAt != null && !takenAt.isBefore(expiresAt);
    }

    /** Names that are callable right now beyond the baseline. */
    public Set<String> activeNames() {
        if (enabledNames == null || expired()) {
            return Set.of();
        }
        return enabledNames;
    }
}
