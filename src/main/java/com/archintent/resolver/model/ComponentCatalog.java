package com.archintent.resolver.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable, insertion-ordered snapshot of registered components keyed by name.
 */
public final class ComponentCatalog {

    private static final ComponentCatalog EMPTY = new ComponentCatalog(List.of());

    private final Map<String, ComponentDescriptor> components;

    public ComponentCatalog(Collection<ComponentDescriptor> descriptors) {
        Map<String, ComponentDescriptor> map = new LinkedHashMap<>();
        for (ComponentDescriptor descriptor : descriptors) {
            map.put(key(descriptor.name()), descriptor);
        }
        this.components = Collections.unmodifiableMap(map);
    }

    public static ComponentCatalog empty() {
        return EMPTY;
    }

    public List<ComponentDescriptor> components() {
        return List.copyOf(components.values());
    }

    public Optional<ComponentDescriptor> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(components.get(key(name)));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public List<ComponentDescriptor> inDomain(String domain) {
        return components.values().stream()
                .filter(c -> c.domain() != null && c.domain().equalsIgnoreCase(domain))
                .collect(Collectors.toList());
    }

    public int size() {
        return components.size();
    }

    /**
     * Returns a new catalog with the descriptor appended; this instance is left untouched.
     */
    public ComponentCatalog with(ComponentDescriptor descriptor) {
        LinkedHashMap<String, ComponentDescriptor> copy = new LinkedHashMap<>(components);
        copy.put(key(descriptor.name()), descriptor);
        return new ComponentCatalog(copy.values());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
