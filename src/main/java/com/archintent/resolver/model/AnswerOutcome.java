package com.archintent.resolver.model;

import java.util.List;

public record AnswerOutcome(
        String questionId,
        boolean applied,
        SessionState state,
        String message,
        List<String> spawnedQuestionIds
) {
    public AnswerOutcome {
        spawnedQuestionIds = spawnedQuestionIds == null ? List.of() : List.copyOf(spawnedQuestionIds);
    }
}
