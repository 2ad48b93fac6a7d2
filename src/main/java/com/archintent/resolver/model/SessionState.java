package com.archintent.resolver.model;

/**
 * Lifecycle of a refinement session.
 * <p>
 * {@code OPEN -> AWAITING_ANSWER -> OPEN ... -> RESOLVED}. {@code STALLED} is reported when an
 * answer did not reduce the number of blocking questions; the session accepts another answer or
 * a manual override from there.
 */
public enum SessionState {
    OPEN,
    AWAITING_ANSWER,
    RESOLVED,
    STALLED
}
