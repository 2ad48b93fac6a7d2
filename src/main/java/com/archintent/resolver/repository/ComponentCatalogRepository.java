package com.archintent.resolver.repository;

import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.ComponentDescriptor;
import com.archintent.resolver.model.Ontology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Holds the current catalog snapshot. Reads are lock-free; registration copies the catalog and
 * publishes the new snapshot under a writer lock, so analyses in flight keep the snapshot they
 * started with.
 */
@Repository
public class ComponentCatalogRepository {

    private static final Logger logger = LoggerFactory.getLogger(ComponentCatalogRepository.class);

    private final Ontology ontology;
    private final Object writeLock = new Object();
    private volatile ComponentCatalog snapshot;

    public ComponentCatalogRepository(Ontology ontology, ComponentCatalog initialCatalog) {
        this.ontology = ontology;
        this.snapshot = initialCatalog == null ? ComponentCatalog.empty() : initialCatalog;
    }

    public ComponentCatalog snapshot() {
        return snapshot;
    }

    /**
     * Registers a new component.
     *
     * @throws IllegalArgumentException if the domain is unknown or the name is already registered
     */
    public ComponentDescriptor register(ComponentDescriptor descriptor) {
        if (descriptor == null || descriptor.name() == null || descriptor.name().isBlank()) {
            throw new IllegalArgumentException("Component name is required");
        }
        if (!ontology.hasDomain(descriptor.domain())) {
            throw new IllegalArgumentException("Unknown domain '" + descriptor.domain() + "' for component " + descriptor.name());
        }
        String canonicalDomain = ontology.domain(descriptor.domain()).orElseThrow().name();
        ComponentDescriptor stored = new ComponentDescriptor(
                descriptor.name().trim(),
                canonicalDomain,
                descriptor.type(),
                descriptor.technology(),
                descriptor.apis(),
                descriptor.publishedEvents(),
                descriptor.consumedEvents(),
                false);
        synchronized (writeLock) {
            ComponentCatalog current = snapshot;
            if (current.contains(stored.name())) {
                throw new IllegalArgumentException("Component already registered: " + stored.name());
            }
            snapshot = current.with(stored);
        }
        logger.info("Registered component '{}' in domain '{}' ({} components in catalog).",
                stored.name(), stored.domain(), snapshot.size());
        return stored;
    }
}
