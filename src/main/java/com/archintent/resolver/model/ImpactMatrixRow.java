package com.archintent.resolver.model;

import java.util.List;

public record ImpactMatrixRow(
        String domain,
        ImpactType impactType,
        Confidence confidence,
        List<String> components,
        String reasoning
) {
    public ImpactMatrixRow {
        components = components == null ? List.of() : List.copyOf(components);
    }
}
