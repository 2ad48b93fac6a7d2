package com.archintent.resolver.model;

import java.util.List;

/**
 * Catalog entry for a deployable or packageable unit registered against exactly one domain.
 * Speculative descriptors are proposed by answers during refinement and are never part of the
 * shared catalog.
 */
public record ComponentDescriptor(
        String name,
        String domain,
        ComponentType type,
        String technology,
        List<String> apis,
        List<String> publishedEvents,
        List<String> consumedEvents,
        boolean speculative
) {
    public static final String UNKNOWN_DOMAIN = "unknown";

    public ComponentDescriptor {
        apis = apis == null ? List.of() : List.copyOf(apis);
        publishedEvents = publishedEvents == null ? List.of() : List.copyOf(publishedEvents);
        consumedEvents = consumedEvents == null ? List.of() : List.copyOf(consumedEvents);
    }

    public static ComponentDescriptor speculative(String name) {
        return new ComponentDescriptor(name, UNKNOWN_DOMAIN, null, null, List.of(), List.of(), List.of(), true);
    }
}
