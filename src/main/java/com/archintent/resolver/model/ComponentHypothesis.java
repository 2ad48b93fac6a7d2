package com.archintent.resolver.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A candidate component for a change, with the questions still attached to it.
 */
public record ComponentHypothesis(
        String componentName,
        String domain,
        ImpactType changeKind,
        List<String> probableChanges,
        List<OpenQuestion> openQuestions,
        boolean speculative,
        boolean rejected
) {
    public ComponentHypothesis {
        probableChanges = probableChanges == null ? List.of() : List.copyOf(probableChanges);
        openQuestions = openQuestions == null ? List.of() : List.copyOf(openQuestions);
    }

    public ComponentHypothesis withChangeKind(ImpactType kind) {
        return new ComponentHypothesis(componentName, domain, kind, probableChanges, openQuestions, speculative, rejected);
    }

    public ComponentHypothesis withProbableChanges(List<String> additional) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(probableChanges);
        merged.addAll(additional);
        return new ComponentHypothesis(componentName, domain, changeKind, new ArrayList<>(merged), openQuestions, speculative, rejected);
    }

    /**
     * Replaces the question with the same id, or appends it.
     */
    public ComponentHypothesis withQuestion(OpenQuestion question) {
        List<OpenQuestion> updated = new ArrayList<>(openQuestions);
        boolean replaced = false;
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).id().equals(question.id())) {
                updated.set(i, question);
                replaced = true;
            }
        }
        if (!replaced) {
            updated.add(question);
        }
        return new ComponentHypothesis(componentName, domain, changeKind, probableChanges, updated, speculative, rejected);
    }

    public ComponentHypothesis reject() {
        return new ComponentHypothesis(componentName, domain, changeKind, probableChanges, openQuestions, speculative, true);
    }
}
