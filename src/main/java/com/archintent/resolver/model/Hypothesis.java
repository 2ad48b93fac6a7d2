package com.archintent.resolver.model;

import java.util.List;
import java.util.UUID;

/**
 * The engine's output: everything a document renderer needs, with no renderer-specific fields.
 */
public record Hypothesis(
        UUID sessionId,
        String requestText,
        String ontologyVersion,
        SessionState state,
        List<ImpactMatrixRow> impactMatrix,
        List<ComponentHypothesis> components,
        List<DependencyEdge> dependencyEdges,
        List<PendingQuestion> blockingQuestions,
        List<PendingQuestion> openLowPriorityQuestions,
        List<ResolutionEntry> resolutionLog
) {
    public Hypothesis {
        impactMatrix = List.copyOf(impactMatrix);
        components = List.copyOf(components);
        dependencyEdges = List.copyOf(dependencyEdges);
        blockingQuestions = List.copyOf(blockingQuestions);
        openLowPriorityQuestions = List.copyOf(openLowPriorityQuestions);
        resolutionLog = List.copyOf(resolutionLog);
    }
}
