package com.archintent.resolver.service;

import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.DiscoveryMatch;

import java.util.Collection;
import java.util.List;

/**
 * Ranked search of components for a business context. Implementations must return an empty list,
 * never throw, when nothing matches, and must order ties deterministically.
 */
public interface DiscoveryBackend {

    /**
     * Searches the current catalog.
     */
    List<DiscoveryMatch> discover(Collection<String> contextTerms);

    /**
     * Searches a given catalog snapshot, so a session only sees components it can also resolve.
     */
    List<DiscoveryMatch> discover(Collection<String> contextTerms, ComponentCatalog catalog);
}
