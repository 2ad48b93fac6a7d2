package com.archintent.resolver.service;

import com.archintent.resolver.dto.CatalogDocument;
import com.archintent.resolver.dto.ComponentDocument;
import com.archintent.resolver.dto.DomainDocument;
import com.archintent.resolver.dto.LexiconDocument;
import com.archintent.resolver.dto.OntologyDocument;
import com.archintent.resolver.model.ActionCategory;
import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.ComponentDescriptor;
import com.archintent.resolver.model.ComponentType;
import com.archintent.resolver.model.Domain;
import com.archintent.resolver.model.DomainRole;
import com.archintent.resolver.model.Lexicon;
import com.archintent.resolver.model.Ontology;
import com.archintent.resolver.model.ScoringPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the ontology and component catalog files and validates them once. Any problem raises
 * {@link OntologyValidationException}, which aborts startup.
 */
@Service
public class OntologyLoader {

    private static final Logger logger = LoggerFactory.getLogger(OntologyLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final ScoringPolicy scoringPolicy;

    public OntologyLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader, ScoringPolicy scoringPolicy) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.scoringPolicy = scoringPolicy;
    }

    public Ontology loadOntology(String location) {
        OntologyDocument document = read(location, OntologyDocument.class);
        Ontology ontology = toOntology(document, location);
        logger.info("Loaded ontology '{}' from {}: {} domain(s), {} vocabulary phrase(s).",
                ontology.version(), location, ontology.domains().size(), ontology.vocabulary().size());
        return ontology;
    }

    public ComponentCatalog loadCatalog(String location, Ontology ontology) {
        CatalogDocument document = read(location, CatalogDocument.class);
        ComponentCatalog catalog = toCatalog(document, ontology, location);
        logger.info("Loaded component catalog from {}: {} component(s).", location, catalog.size());
        return catalog;
    }

    public Ontology toOntology(OntologyDocument document, String source) {
        if (document == null || document.getDomains() == null || document.getDomains().isEmpty()) {
            throw new OntologyValidationException(source + ": ontology declares no domains");
        }
        Set<String> names = new LinkedHashSet<>();
        Map<String, String> owners = new HashMap<>();
        Map<DomainRole, String> roles = new EnumMap<>(DomainRole.class);
        List<Domain> domains = new ArrayList<>();

        for (DomainDocument doc : document.getDomains()) {
            if (doc == null || !StringUtils.hasText(doc.getName())) {
                throw new OntologyValidationException(source + ": domain without a name");
            }
            String name = doc.getName().trim();
            if (!names.add(name.toLowerCase(Locale.ROOT))) {
                throw new OntologyValidationException(source + ": duplicate domain '" + name + "'");
            }
            DomainRole role = parseRole(doc.getRole(), name, source);
            if (role != DomainRole.CORE) {
                String previous = roles.putIfAbsent(role, name);
                if (previous != null) {
                    throw new OntologyValidationException(source + ": both '" + previous + "' and '" + name
                            + "' declare role " + role);
                }
            }

            Map<String, Integer> triggers = new LinkedHashMap<>();
            if (doc.getTriggers() != null) {
                for (Map.Entry<String, Integer> entry : doc.getTriggers().entrySet()) {
                    String phrase = phrase(entry.getKey(), name, source);
                    int weight = entry.getValue() == null ? scoringPolicy.defaultTriggerWeight() : entry.getValue();
                    if (weight <= 0) {
                        throw new OntologyValidationException(source + ": trigger '" + phrase + "' of domain '"
                                + name + "' must have a positive weight");
                    }
                    triggers.put(phrase, weight);
                }
            }

            Set<String> entities = new LinkedHashSet<>();
            if (doc.getEntities() != null) {
                for (String raw : doc.getEntities()) {
                    String entity = phrase(raw, name, source);
                    String owner = owners.putIfAbsent(entity, name);
                    if (owner != null && !owner.equals(name)) {
                        throw new OntologyValidationException(source + ": entity '" + entity + "' owned by both '"
                                + owner + "' and '" + name + "'");
                    }
                    entities.add(entity);
                }
            }

            domains.add(new Domain(name, doc.getResponsibility(), role, triggers, entities, doc.getComponents()));
        }
        return new Ontology(document.getVersion(), domains, toLexicon(document.getLexicon(), source));
    }

    public ComponentCatalog toCatalog(CatalogDocument document, Ontology ontology, String source) {
        if (document == null || document.getComponents() == null) {
            return ComponentCatalog.empty();
        }
        Set<String> names = new LinkedHashSet<>();
        List<ComponentDescriptor> descriptors = new ArrayList<>();
        for (ComponentDocument doc : document.getComponents()) {
            ComponentDescriptor descriptor = toDescriptor(doc, ontology, source);
            if (!names.add(descriptor.name().toLowerCase(Locale.ROOT))) {
                throw new OntologyValidationException(source + ": duplicate component '" + descriptor.name() + "'");
            }
            descriptors.add(descriptor);
        }
        for (Domain domain : ontology.domains()) {
            for (String expected : domain.components()) {
                if (!names.contains(expected.toLowerCase(Locale.ROOT))) {
                    logger.warn("Domain '{}' lists component '{}' which is not in the catalog", domain.name(), expected);
                }
            }
        }
        return new ComponentCatalog(descriptors);
    }

    /**
     * Converts one catalog entry, resolving its domain to the ontology's spelling.
     */
    public ComponentDescriptor toDescriptor(ComponentDocument doc, Ontology ontology, String source) {
        if (doc == null || !StringUtils.hasText(doc.getName())) {
            throw new OntologyValidationException(source + ": component without a name");
        }
        String name = doc.getName().trim();
        Domain domain = ontology.domain(doc.getDomain())
                .orElseThrow(() -> new OntologyValidationException(source + ": component '" + name
                        + "' references unknown domain '" + doc.getDomain() + "'"));
        ComponentType type;
        try {
            type = ComponentType.fromLabel(doc.getType());
        } catch (IllegalArgumentException e) {
            throw new OntologyValidationException(source + ": component '" + name + "': " + e.getMessage(), e);
        }
        return new ComponentDescriptor(name, domain.name(), type, doc.getTechnology(),
                doc.getApis(), doc.getPublishes(), doc.getConsumes(), false);
    }

    private Lexicon toLexicon(LexiconDocument document, String source) {
        if (document == null) {
            return Lexicon.empty();
        }
        Map<String, ActionCategory> actions = new LinkedHashMap<>();
        if (document.getActions() != null) {
            for (Map.Entry<String, String> entry : document.getActions().entrySet()) {
                String verb = phrase(entry.getKey(), "lexicon", source);
                try {
                    actions.put(verb, ActionCategory.valueOf(entry.getValue().trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException | NullPointerException e) {
                    throw new OntologyValidationException(source + ": action '" + verb + "' has unknown category '"
                            + entry.getValue() + "'", e);
                }
            }
        }
        Set<String> qualifiers = new LinkedHashSet<>();
        if (document.getQualifiers() != null) {
            for (String qualifier : document.getQualifiers()) {
                qualifiers.add(phrase(qualifier, "lexicon", source));
            }
        }
        return new Lexicon(actions, qualifiers);
    }

    private DomainRole parseRole(String raw, String domain, String source) {
        if (!StringUtils.hasText(raw)) {
            return DomainRole.CORE;
        }
        try {
            return DomainRole.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new OntologyValidationException(source + ": domain '" + domain + "' has unknown role '" + raw + "'", e);
        }
    }

    private String phrase(String raw, String owner, String source) {
        String normalized = Terms.normalizePhrase(raw);
        if (normalized.isEmpty()) {
            throw new OntologyValidationException(source + ": empty phrase in '" + owner + "'");
        }
        return normalized;
    }

    private <T> T read(String location, Class<T> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new OntologyValidationException("Configuration resource not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new OntologyValidationException("Failed to read " + location + ": " + e.getMessage(), e);
        }
    }
}
