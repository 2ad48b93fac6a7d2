package com.archintent.resolver.service;

import com.archintent.resolver.model.ActionCategory;
import com.archintent.resolver.model.Confidence;
import com.archintent.resolver.model.Domain;
import com.archintent.resolver.model.DomainRole;
import com.archintent.resolver.model.ImpactRecord;
import com.archintent.resolver.model.ImpactType;
import com.archintent.resolver.model.Ontology;
import com.archintent.resolver.model.ScoringPolicy;
import com.archintent.resolver.model.Tag;
import com.archintent.resolver.model.TagKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches tags against the ontology and produces one {@link ImpactRecord} per impacted domain.
 * <p>
 * Raw score = sum of matched trigger weights + ownership bonus per owned entity. The fixed rules
 * (ownership, tie, dependency, side-effect, UI) are applied on top of the raw scores. Records come
 * back in ontology order.
 */
@Service
public class DomainScorerService {

    private static final Logger logger = LoggerFactory.getLogger(DomainScorerService.class);

    private final Ontology ontology;
    private final ScoringPolicy policy;

    public DomainScorerService(Ontology ontology, ScoringPolicy policy) {
        this.ontology = ontology;
        this.policy = policy;
    }

    public Set<ImpactRecord> score(List<Tag> tags) {
        if (tags == null || tags.isEmpty()) {
            return Set.of();
        }

        Map<String, Evidence> evidence = new LinkedHashMap<>();
        for (Domain domain : ontology.domains()) {
            evidence.put(domain.name(), new Evidence(domain));
        }

        LinkedHashSet<String> ownerOrder = new LinkedHashSet<>();
        Map<String, String> firstEntityByOwner = new LinkedHashMap<>();
        for (Tag tag : tags) {
            for (Evidence ev : evidence.values()) {
                int weight = ev.domain.triggerWeight(tag.term());
                if (weight > 0 && ev.triggers.add(tag.term())) {
                    ev.score += weight;
                }
            }
            if (tag.kind() == TagKind.ENTITY) {
                Optional<String> owner = ontology.ownerOf(tag.term());
                if (owner.isPresent()) {
                    Evidence ev = evidence.get(owner.get());
                    if (ev.ownedEntities.add(tag.term())) {
                        ev.score += policy.ownershipBonus();
                    }
                    ownerOrder.add(owner.get());
                    firstEntityByOwner.putIfAbsent(owner.get(), tag.term());
                }
            }
        }

        List<String> tied = tiedOwners(ownerOrder, evidence);
        String primary = tied.isEmpty() && !ownerOrder.isEmpty() ? ownerOrder.iterator().next() : null;

        Map<String, ImpactRecord> records = new LinkedHashMap<>();
        for (Evidence ev : evidence.values()) {
            String name = ev.domain.name();
            if (tied.contains(name)) {
                List<String> others = tied.stream().filter(d -> !d.equals(name)).collect(Collectors.toList());
                records.put(name, record(ev, ImpactType.CORE_CHANGE, Confidence.HIGH, true,
                        "tied top ownership score " + ev.score + " with " + String.join(", ", others)));
            } else if (name.equals(primary)) {
                records.put(name, record(ev, ImpactType.CORE_CHANGE, Confidence.HIGH, false,
                        "owns primary entity '" + firstEntityByOwner.get(name) + "'"));
            } else if (!ev.ownedEntities.isEmpty()) {
                records.put(name, record(ev, ImpactType.DEPENDENCY, Confidence.LOW, false,
                        "owns referenced entity '" + firstEntityByOwner.get(name) + "' outside the primary domain"));
            } else if (ev.score > 0) {
                Confidence confidence = ev.score >= policy.highThreshold() ? Confidence.HIGH : Confidence.MEDIUM;
                records.put(name, record(ev, vocabularyImpact(ev.domain, confidence, primary != null), confidence, false,
                        "vocabulary score " + ev.score + " (threshold " + policy.highThreshold() + ")"));
            }
        }

        applyActionRule(tags, ActionCategory.COMMUNICATION, DomainRole.INTEGRATION, ImpactType.SIDE_EFFECT,
                "side-effect rule", records, evidence);
        applyActionRule(tags, ActionCategory.PRESENTATION, DomainRole.FRONTEND, ImpactType.UI_CHANGE,
                "UI rule", records, evidence);

        // re-emit in ontology order; the action rules may have appended domains
        Set<ImpactRecord> ordered = new LinkedHashSet<>();
        for (Domain domain : ontology.domains()) {
            ImpactRecord record = records.get(domain.name());
            if (record != null) {
                logger.debug("Domain '{}' scored {} -> {} / {} ({})", record.domain(), record.score(),
                        record.confidence(), record.impactType(), record.reasoning());
                ordered.add(record);
            }
        }
        return ordered;
    }

    /**
     * Owners sharing the top owner score, when there are two or more of them.
     */
    private List<String> tiedOwners(Set<String> owners, Map<String, Evidence> evidence) {
        if (owners.size() < 2) {
            return List.of();
        }
        int top = owners.stream().mapToInt(o -> evidence.get(o).score).max().orElse(0);
        List<String> tied = new ArrayList<>();
        for (Domain domain : ontology.domains()) {
            if (owners.contains(domain.name()) && evidence.get(domain.name()).score == top) {
                tied.add(domain.name());
            }
        }
        return tied.size() >= 2 ? tied : List.of();
    }

    private ImpactType vocabularyImpact(Domain domain, Confidence confidence, boolean hasPrimary) {
        switch (domain.role()) {
            case FRONTEND:
                return ImpactType.UI_CHANGE;
            case INTEGRATION:
                return ImpactType.SIDE_EFFECT;
            default:
                if (hasPrimary) {
                    return ImpactType.API_CHANGE;
                }
                return confidence == Confidence.HIGH ? ImpactType.CORE_CHANGE : ImpactType.POSSIBLE;
        }
    }

    private void applyActionRule(List<Tag> tags,
                                 ActionCategory category,
                                 DomainRole role,
                                 ImpactType impactType,
                                 String ruleName,
                                 Map<String, ImpactRecord> records,
                                 Map<String, Evidence> evidence) {
        List<String> verbs = tags.stream()
                .filter(t -> t.kind() == TagKind.ACTION)
                .filter(t -> ontology.lexicon().categoryOf(t.term()) == category)
                .map(Tag::term)
                .distinct()
                .collect(Collectors.toList());
        if (verbs.isEmpty()) {
            return;
        }
        Optional<Domain> target = ontology.domainWithRole(role);
        if (target.isEmpty()) {
            logger.debug("No {} domain in ontology {}; {} skipped", role, ontology.version(), ruleName);
            return;
        }
        String name = target.get().name();
        String reason = ruleName + ": " + String.join(", ", verbs);
        ImpactRecord existing = records.get(name);
        if (existing == null) {
            Evidence ev = evidence.get(name);
            ev.triggers.addAll(verbs);
            records.put(name, record(ev, impactType, Confidence.MEDIUM, false, reason));
            return;
        }
        ImpactRecord updated = existing;
        if (!updated.confidence().isAtLeast(Confidence.MEDIUM)) {
            updated = updated.withConfidence(Confidence.MEDIUM, reason + " raises confidence to MEDIUM");
        }
        if (updated.impactType() == ImpactType.DEPENDENCY || updated.impactType() == ImpactType.POSSIBLE) {
            updated = updated.withImpactType(impactType, reason);
        }
        records.put(name, updated);
    }

    private ImpactRecord record(Evidence ev, ImpactType type, Confidence confidence, boolean ambiguous, String reason) {
        List<String> matched = new ArrayList<>(ev.ownedEntities);
        for (String trigger : ev.triggers) {
            if (!matched.contains(trigger)) {
                matched.add(trigger);
            }
        }
        return new ImpactRecord(ev.domain.name(), type, confidence, matched, reason, ev.score, ambiguous, false);
    }

    private static final class Evidence {
        final Domain domain;
        final LinkedHashSet<String> triggers = new LinkedHashSet<>();
        final LinkedHashSet<String> ownedEntities = new LinkedHashSet<>();
        int score;

        Evidence(Domain domain) {
            this.domain = domain;
        }
    }
}
