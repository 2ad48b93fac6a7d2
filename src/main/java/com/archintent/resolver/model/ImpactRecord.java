package com.archintent.resolver.model;

import java.util.List;

/**
 * Per-domain impact assessment. Instances are immutable; the refinement session replaces them
 * when an answer changes confidence or impact type.
 */
public record ImpactRecord(
        String domain,
        ImpactType impactType,
        Confidence confidence,
        List<String> matchedTriggers,
        String reasoning,
        int score,
        boolean ambiguous,
        boolean rejected
) {
    public ImpactRecord {
        matchedTriggers = matchedTriggers == null ? List.of() : List.copyOf(matchedTriggers);
    }

    public ImpactRecord withConfidence(Confidence newConfidence, String reason) {
        return new ImpactRecord(domain, impactType, newConfidence, matchedTriggers,
                appendReason(reason), score, ambiguous, rejected);
    }

    public ImpactRecord withImpactType(ImpactType newType, String reason) {
        return new ImpactRecord(domain, newType, confidence, matchedTriggers,
                appendReason(reason), score, ambiguous, rejected);
    }

    public ImpactRecord disambiguated(String reason) {
        return new ImpactRecord(domain, impactType, confidence, matchedTriggers,
                appendReason(reason), score, false, rejected);
    }

    public ImpactRecord reject(String reason) {
        return new ImpactRecord(domain, impactType, confidence, matchedTriggers,
                appendReason(reason), score, ambiguous, true);
    }

    private String appendReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return reasoning;
        }
        return reasoning == null || reasoning.isBlank() ? reason : reasoning + "; " + reason;
    }
}
