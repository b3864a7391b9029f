package com.example.toolgate.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public final class ToolCatalog {

    private final Map<String, ToolDescriptor> descriptors;
    private final Map<String, ToolProvider> providers;
    private final Map<String, List<String>> namesByCategory;
    private final Map<String, String> categoryDescriptions;

    private ToolCatalog(Map<String, ToolDescriptor> descriptors,
                        Map<String, ToolProvider> providers,
                        Map<String, List<String>> namesByCategory,
                        Map<String, String> categoryDescriptions) {
        this.descriptors = descriptors;
        this.providers = providers;
        this.namesByCategory = namesByCategory;
        this.categoryDescriptions = categoryDescriptions;
    }

    /**
     * @throws IllegalStateException if two descriptors share a name, or one category name is
     *                               declared with two different descriptions
     */
    public static ToolCatalog of(List<? extends ToolProvider> providers) {
        Map<String, ToolDescriptor> descriptors = new LinkedHashMap<>();
        Map<String, ToolProvider> owners = new LinkedHashMap<>();
        Map<String, List<String>> byCategory = new TreeMap<>();
        Map<String, String> descriptions = new TreeMap<>();

        for (ToolProvider provider : providers) {
            for (ToolDescriptor descriptor : provider.descriptors()) {
                String name = descriptor.name();
                ToolProvider existing = owners.putIfAbsent(name, provider);
                if (existing != null) {
                    throw new IllegalStateException("Duplicate tool name '" + name + "' registered by "
                            + existing.getClass().getSimpleName() + " and " + provider.getClass().getSimpleName());
                }
                descriptors.put(name, descriptor);

                ToolCategory category = descriptor.category();
                String known = descriptions.putIfAbsent(category.name(), category.description());
                if (known != null && !known.equals(category.description())) {
                    throw new IllegalStateException("Category '" + category.name()
                            + "' declared with conflicting descriptions");
                }
                byCategory.computeIfAbsent(category.name(), key -> new ArrayList<>()).add(name);
            }
        }

        Map<String, List<String>> frozenCategories = new TreeMap<>();
        byCategory.forEach((category, names) -> frozenCategories.put(category, List.copyOf(names)));
        return new ToolCatalog(
                Collections.unmodifiableMap(descriptors),
                Collections.unmodifiableMap(owners),
                Collections.unmodifiableMap(frozenCategories),
                Collections.unmodifiableMap(descriptions));
    }

    public List<ToolDescriptor> all() {
        return List.copyOf(descriptors.values());
    }

    public Map<String, List<String>> byCategory() {
        return namesByCategory;
    }

    public Map<String, String> categoryDescriptions() {
        return categoryDescriptions;
    }

    public Optional<ToolProvider> resolve(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public Optional<ToolDescriptor> descriptor(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    public boolean contains(String name) {
        return descriptors.containsKey(name);
    }

    public boolean hasCategory(String category) {
        return namesByCategory.containsKey(category);
    }

    public int size() {
        return descriptors.size();
    }

    public long baselineCount() {
        return descriptors.values().stream().filter(ToolDescriptor::baseline).count();
    }
}
