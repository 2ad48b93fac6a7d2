package com.archintent.resolver.model;

import java.util.List;

/**
 * A question the refinement session needs answered. The id is derived from what the question is
 * about, so it is stable for the lifetime of the session.
 */
public record OpenQuestion(
        String id,
        Priority priority,
        QuestionKind kind,
        QuestionSubject subject,
        String prompt,
        List<String> options,
        QuestionState state,
        String answer,
        long sequence
) {
    public OpenQuestion {
        options = options == null ? List.of() : List.copyOf(options);
        state = state == null ? QuestionState.OPEN : state;
    }

    public static OpenQuestion open(String id, Priority priority, QuestionKind kind,
                                    QuestionSubject subject, String prompt, List<String> options) {
        return new OpenQuestion(id, priority, kind, subject, prompt, options, QuestionState.OPEN, null, 0L);
    }

    public boolean isOpen() {
        return state == QuestionState.OPEN;
    }

    public OpenQuestion answered(String value) {
        return new OpenQuestion(id, priority, kind, subject, prompt, options, QuestionState.ANSWERED, value, sequence);
    }

    public OpenQuestion withOptions(List<String> newOptions) {
        return new OpenQuestion(id, priority, kind, subject, prompt, newOptions, state, answer, sequence);
    }

    public OpenQuestion withSequence(long newSequence) {
        return new OpenQuestion(id, priority, kind, subject, prompt, options, state, answer, newSequence);
    }
}
