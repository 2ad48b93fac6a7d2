package com.archintent.resolver.model;

/**
 * Qualitative certainty that an impact assignment is correct.
 */
public enum Confidence {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    Confidence(int rank) {
        this.rank = rank;
    }

    public boolean isAtLeast(Confidence other) {
        return rank >= other.rank;
    }
}
