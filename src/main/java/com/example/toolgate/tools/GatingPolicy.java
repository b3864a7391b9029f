package com.example.toolgate.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory elevation state. A tool is callable when it is baseline, or when it is in the enabled
 * set and the TTL (if any) has not passed. Expiry is evaluated lazily on every check.
 *
 * <p>All reads and writes go through one monitor; none of them does I/O, so holding it is cheap.
 */
public final class GatingPolicy implements GatingControl {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatingPolicy.class);

    public static final long MAX_TTL_MINUTES = Duration.ofDays(365).toMinutes();

    private final ToolCatalog catalog;
    private final Clock clock;
    private final Object lock = new Object();

    private Set<String> enabledNames;
    private Instant expiresAt;

    public GatingPolicy(ToolCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.clock = clock;
    }

    @Override
    public ToolCatalog catalog() {
        return catalog;
    }

    public boolean isCallable(ToolDescriptor descriptor) {
        return isCallable(descriptor, clock.instant());
    }

    public boolean isCallable(ToolDescriptor descriptor, Instant now) {
        if (descriptor.baseline()) {
            return true;
        }
        synchronized (lock) {
            if (enabledNames == null || !enabledNames.contains(descriptor.name())) {
                return false;
            }
            return expiresAt == null || now.isBefore(expiresAt);
        }
    }

    public List<ToolDescriptor> callable(Instant now) {
        List<ToolDescriptor> result = new ArrayList<>();
        for (ToolDescriptor descriptor : catalog.all()) {
            if (isCallable(descriptor, now)) {
                result.add(descriptor);
            }
        }
        return result;
    }

    @Override
    public GatingSnapshot snapshot() {
        Instant now = clock.instant();
        synchronized (lock) {
            return new GatingSnapshot(enabledNames, expiresAt, now);
        }
    }

    /**
     * Replaces the elevated set with the known names in {@code names}. An existing TTL is kept.
     */
    @Override
    public EnableOutcome enable(Collection<String> names) {
        Set<String> accepted = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            if (catalog.contains(name)) {
                accepted.add(name);
            } else if (!unknown.contains(name)) {
                unknown.add(name);
            }
        }
        synchronized (lock) {
            enabledNames = Set.copyOf(accepted);
        }
        LOGGER.info("Enabled tools replaced: {}", accepted);
        if (!unknown.isEmpty()) {
            LOGGER.warn("Ignored unknown tool names: {}", unknown);
        }
        return new EnableOutcome(new ArrayList<>(accepted), unknown);
    }

    @Override
    public EnableOutcome enableCategories(Collection<String> categories) {
        Set<String> names = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String category : categories) {
            if (catalog.hasCategory(category)) {
                names.addAll(catalog.byCategory().get(category));
            } else if (!unknown.contains(category)) {
                unknown.add(category);
            }
        }
        if (!unknown.isEmpty()) {
            LOGGER.warn("Ignored unknown tool categories: {}", unknown);
        }
        EnableOutcome outcome = enable(names);
        return new EnableOutcome(outcome.enabled(), unknown);
    }

    @Override
    public Instant enableTtl(long minutes) {
        if (minutes <= 0 || minutes > MAX_TTL_MINUTES) {
            throw new IllegalArgumentException("TTL minutes must be between 1 and " + MAX_TTL_MINUTES + ": " + minutes);
        }
        Instant expiry = clock.instant().plus(Duration.ofMinutes(minutes));
        synchronized (lock) {
            expiresAt = expiry;
        }
        LOGGER.info("Tool elevation TTL set to {} minute(s), expires at {}", minutes, expiry);
        return expiry;
    }

    @Override
    public void reset() {
        synchronized (lock) {
            enabledNames = null;
            expiresAt = null;
        }
        LOGGER.info("Tool registry reset to baseline");
    }
}
