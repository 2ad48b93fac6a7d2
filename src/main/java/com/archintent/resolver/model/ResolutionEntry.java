package com.archintent.resolver.model;

import java.util.List;

/**
 * One applied answer and the changes it caused.
 */
public record ResolutionEntry(int step, String questionId, String answer, boolean override, List<String> effects) {

    public ResolutionEntry {
        effects = effects == null ? List.of() : List.copyOf(effects);
    }
}
