package com.archintent.resolver.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Consistent copy of a refinement session's state, taken under the session lock.
 */
public record SessionSnapshot(
        UUID sessionId,
        String requestText,
        String ontologyVersion,
        SessionState state,
        List<ImpactRecord> records,
        List<ComponentHypothesis> hypotheses,
        List<OpenQuestion> questions,
        Map<String, ComponentDescriptor> descriptors,
        Map<String, String> assignedOwners,
        List<ResolutionEntry> resolutionLog
) {
    public SessionSnapshot {
        records = List.copyOf(records);
        hypotheses = List.copyOf(hypotheses);
        questions = List.copyOf(questions);
        descriptors = Map.copyOf(descriptors);
        assignedOwners = Map.copyOf(assignedOwners);
        resolutionLog = List.copyOf(resolutionLog);
    }
}
