package com.archintent.resolver.service;

import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.ComponentDescriptor;
import com.archintent.resolver.model.DiscoveryMatch;
import com.archintent.resolver.repository.ComponentCatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Catalog-backed discovery. Score = 3 per term found in the component name, 2 per term matching a
 * word of its domain, 1 per term found in an API or event name. Ties keep catalog order.
 */
@Service
public class DiscoverySearchService implements DiscoveryBackend {

    private static final Logger logger = LoggerFactory.getLogger(DiscoverySearchService.class);

    static final int NAME_WEIGHT = 3;
    static final int DOMAIN_WEIGHT = 2;
    static final int FRAGMENT_WEIGHT = 1;

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "the", "of", "for", "to", "in", "on", "with", "at", "by", "or", "their", "its"
    );

    private final ComponentCatalogRepository catalogRepository;

    public DiscoverySearchService(ComponentCatalogRepository catalogRepository) {
        this.catalogRepository = catalogRepository;
    }

    @Override
    public List<DiscoveryMatch> discover(Collection<String> contextTerms) {
        return discover(contextTerms, catalogRepository.snapshot());
    }

    @Override
    public List<DiscoveryMatch> discover(Collection<String> contextTerms, ComponentCatalog catalog) {
        List<String> terms = contextTerms(contextTerms);
        if (terms.isEmpty()) {
            return List.of();
        }
        List<DiscoveryMatch> matches = new ArrayList<>();
        for (ComponentDescriptor component : catalog.components()) {
            int score = score(component, terms);
            if (score > 0) {
                matches.add(new DiscoveryMatch(component, score));
            }
        }
        // List.sort is stable, so equal scores keep catalog insertion order
        matches.sort(Comparator.comparingInt(DiscoveryMatch::matchScore).reversed());
        logger.debug("Discovery for {} returned {} match(es)", terms, matches.size());
        return matches;
    }

    private int score(ComponentDescriptor component, List<String> terms) {
        String name = component.name().toLowerCase(Locale.ROOT);
        Set<String> domainWords = component.domain() == null ? Set.of() : Set.copyOf(Terms.words(component.domain()));
        List<String> fragments = new ArrayList<>();
        component.apis().forEach(api -> fragments.add(api.toLowerCase(Locale.ROOT)));
        component.publishedEvents().forEach(e -> fragments.add(e.toLowerCase(Locale.ROOT)));
        component.consumedEvents().forEach(e -> fragments.add(e.toLowerCase(Locale.ROOT)));

        int score = 0;
        for (String term : terms) {
            if (name.contains(term)) {
                score += NAME_WEIGHT;
            }
            if (domainWords.contains(term)) {
                score += DOMAIN_WEIGHT;
            }
            if (fragments.stream().anyMatch(f -> f.contains(term))) {
                score += FRAGMENT_WEIGHT;
            }
        }
        return score;
    }

    private List<String> contextTerms(Collection<String> raw) {
        if (raw == null) {
            return List.of();
        }
        LinkedHashSet<String> terms = new LinkedHashSet<>();
        for (String value : raw) {
            for (String word : Terms.words(value)) {
                if (word.length() > 1 && !STOP_WORDS.contains(word)) {
                    terms.add(word);
                }
            }
        }
        return terms.stream().collect(Collectors.toList());
    }
}
