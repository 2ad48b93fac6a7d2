package com.archintent.resolver.model;

/**
 * Tunable numbers of the domain scorer.
 *
 * @param ownershipBonus         added once per owned entity term found in the request
 * @param highThreshold          score at or above which a vocabulary-only domain is HIGH
 * @param defaultTriggerWeight   weight used when the ontology lists a trigger without one
 */
public record ScoringPolicy(int ownershipBonus, int highThreshold, int defaultTriggerWeight) {

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(5, 5, 3);
    }
}
