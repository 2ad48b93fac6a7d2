package com.archintent.resolver.model;

/**
 * Marks the domains that the presentation and side-effect rules add to an analysis.
 * Every other domain is {@link #CORE}.
 */
public enum DomainRole {
    CORE,
    FRONTEND,
    INTEGRATION
}
