package com.archintent.resolver.dto;

import com.archintent.resolver.model.AnswerOutcome;
import com.archintent.resolver.model.Hypothesis;
import com.archintent.resolver.model.OpenQuestion;
import com.archintent.resolver.model.SessionState;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * What a client sees after each step of a refinement session.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(
        UUID sessionId,
        SessionState state,
        OpenQuestion nextQuestion,
        AnswerOutcome lastOutcome,
        Hypothesis hypothesis
) {
}
