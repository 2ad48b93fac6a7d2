package com.archintent.resolver.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Verbs and modifiers the tagger recognizes besides the domains' own vocabulary.
 */
public record Lexicon(Map<String, ActionCategory> actions, Set<String> qualifiers) {

    public Lexicon {
        actions = actions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        qualifiers = qualifiers == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(qualifiers));
    }

    public static Lexicon empty() {
        return new Lexicon(Map.of(), Set.of());
    }

    public ActionCategory categoryOf(String term) {
        return actions.get(term);
    }

    public boolean isAction(String term) {
        return actions.containsKey(term);
    }

    public boolean isQualifier(String term) {
        return qualifiers.contains(term);
    }
}
