package com.archintent.resolver.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable knowledge base shared read-only by every analysis. Built once by
 * {@link com.archintent.resolver.service.OntologyLoader} and never mutated afterwards.
 */
public final class Ontology {

    private final String version;
    private final List<Domain> domains;
    private final Lexicon lexicon;
    private final Map<String, Domain> domainsByKey;
    private final Map<String, String> entityOwners;
    private final Set<String> vocabulary;

    public Ontology(String version, List<Domain> domains, Lexicon lexicon) {
        this.version = version == null ? "unversioned" : version;
        this.domains = List.copyOf(domains);
        this.lexicon = lexicon == null ? Lexicon.empty() : lexicon;

        Map<String, Domain> byKey = new LinkedHashMap<>();
        Map<String, String> owners = new LinkedHashMap<>();
        Set<String> phrases = new LinkedHashSet<>();
        for (Domain domain : this.domains) {
            byKey.put(key(domain.name()), domain);
            for (String entity : domain.ownedEntities()) {
                owners.putIfAbsent(entity, domain.name());
                phrases.add(entity);
            }
            phrases.addAll(domain.triggers().keySet());
        }
        phrases.addAll(this.lexicon.actions().keySet());
        phrases.addAll(this.lexicon.qualifiers());

        this.domainsByKey = Collections.unmodifiableMap(byKey);
        this.entityOwners = Collections.unmodifiableMap(owners);
        this.vocabulary = Collections.unmodifiableSet(phrases);
    }

    public String version() {
        return version;
    }

    public List<Domain> domains() {
        return domains;
    }

    public Lexicon lexicon() {
        return lexicon;
    }

    /**
     * Case-insensitive lookup by domain name.
     */
    public Optional<Domain> domain(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(domainsByKey.get(key(name)));
    }

    public boolean hasDomain(String name) {
        return domain(name).isPresent();
    }

    public Optional<String> ownerOf(String term) {
        return Optional.ofNullable(entityOwners.get(term));
    }

    public Optional<Domain> domainWithRole(DomainRole role) {
        return domains.stream().filter(d -> d.role() == role).findFirst();
    }

    /**
     * Every phrase the tagger can recognize: owned entities, trigger phrases, action verbs and qualifiers.
     */
    public Set<String> vocabulary() {
        return vocabulary;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
