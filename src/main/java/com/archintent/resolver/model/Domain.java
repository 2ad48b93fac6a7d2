package com.archintent.resolver.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named business capability grouping. Trigger phrases and owned entities are stored in their
 * normalized form (lower case, single spaces).
 */
public record Domain(
        String name,
        String responsibility,
        DomainRole role,
        Map<String, Integer> triggers,
        Set<String> ownedEntities,
        List<String> components
) {
    public Domain {
        role = role == null ? DomainRole.CORE : role;
        triggers = triggers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(triggers));
        ownedEntities = ownedEntities == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ownedEntities));
        components = components == null ? List.of() : List.copyOf(components);
    }

    public int triggerWeight(String term) {
        Integer weight = triggers.get(term);
        return weight == null ? 0 : weight;
    }
}
