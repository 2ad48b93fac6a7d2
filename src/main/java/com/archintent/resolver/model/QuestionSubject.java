package com.archintent.resolver.model;

import java.util.List;

/**
 * What a question is about: one component, one domain, or (for ownership ties) several domains.
 */
public record QuestionSubject(SubjectKind kind, List<String> references) {

    public QuestionSubject {
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static QuestionSubject component(String name) {
        return new QuestionSubject(SubjectKind.COMPONENT, List.of(name));
    }

    public static QuestionSubject domain(String name) {
        return new QuestionSubject(SubjectKind.DOMAIN, List.of(name));
    }

    public static QuestionSubject domains(List<String> names) {
        return new QuestionSubject(SubjectKind.DOMAIN, names);
    }

    public String primary() {
        return references.isEmpty() ? null : references.get(0);
    }
}
