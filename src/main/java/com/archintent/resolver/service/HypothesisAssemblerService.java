package com.archintent.resolver.service;

import com.archintent.resolver.model.ComponentDescriptor;
import com.archintent.resolver.model.ComponentHypothesis;
import com.archintent.resolver.model.DependencyEdge;
import com.archintent.resolver.model.EdgeKind;
import com.archintent.resolver.model.Hypothesis;
import com.archintent.resolver.model.ImpactMatrixRow;
import com.archintent.resolver.model.ImpactRecord;
import com.archintent.resolver.model.OpenQuestion;
import com.archintent.resolver.model.PendingQuestion;
import com.archintent.resolver.model.SessionSnapshot;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Folds a session's current state into a {@link Hypothesis}. Dependency edges come only from
 * explicit references: a published event consumed by another component, or an exposed API that
 * another component's probable changes say it calls. Domain adjacency alone never yields an edge.
 */
@Service
public class HypothesisAssemblerService {

    public Hypothesis assemble(RefinementSession session) {
        return assemble(session.snapshot());
    }

    public Hypothesis assemble(SessionSnapshot snapshot) {
        List<ComponentHypothesis> active = snapshot.hypotheses().stream()
                .filter(h -> !h.rejected())
                .collect(Collectors.toList());

        List<ImpactMatrixRow> matrix = new ArrayList<>();
        for (ImpactRecord record : snapshot.records()) {
            if (record.rejected()) {
                continue;
            }
            List<String> components = active.stream()
                    .filter(h -> record.domain().equalsIgnoreCase(h.domain()))
                    .map(ComponentHypothesis::componentName)
                    .collect(Collectors.toCollection(ArrayList::new));
            // an owner assigned from another domain's catalog entry keeps that domain but is listed here too
            String assignedOwner = snapshot.assignedOwners().get(record.domain());
            if (assignedOwner != null && !components.contains(assignedOwner)
                    && active.stream().anyMatch(h -> h.componentName().equals(assignedOwner))) {
                components.add(assignedOwner);
            }
            matrix.add(new ImpactMatrixRow(record.domain(), record.impactType(), record.confidence(),
                    components, record.reasoning()));
        }

        List<PendingQuestion> blocking = new ArrayList<>();
        List<PendingQuestion> nonBlocking = new ArrayList<>();
        for (OpenQuestion question : snapshot.questions()) {
            if (!question.isOpen()) {
                continue;
            }
            if (question.priority().isBlocking()) {
                blocking.add(PendingQuestion.of(question));
            } else {
                nonBlocking.add(PendingQuestion.of(question));
            }
        }

        return new Hypothesis(
                snapshot.sessionId(),
                snapshot.requestText(),
                snapshot.ontologyVersion(),
                snapshot.state(),
                matrix,
                active,
                dependencyEdges(active, snapshot.descriptors()),
                blocking,
                nonBlocking,
                snapshot.resolutionLog());
    }

    List<DependencyEdge> dependencyEdges(List<ComponentHypothesis> hypotheses,
                                         Map<String, ComponentDescriptor> descriptors) {
        LinkedHashSet<DependencyEdge> edges = new LinkedHashSet<>();
        for (ComponentHypothesis producer : hypotheses) {
            ComponentDescriptor produced = descriptors.get(producer.componentName());
            if (produced == null) {
                continue;
            }
            for (ComponentHypothesis consumer : hypotheses) {
                if (consumer.componentName().equals(producer.componentName())) {
                    continue;
                }
                ComponentDescriptor consumed = descriptors.get(consumer.componentName());
                if (consumed != null) {
                    for (String event : produced.publishedEvents()) {
                        if (consumed.consumedEvents().contains(event)) {
                            edges.add(new DependencyEdge(producer.componentName(), consumer.componentName(), EdgeKind.EVENT, event));
                        }
                    }
                }
                for (String api : produced.apis()) {
                    if (mentionsCall(consumer.probableChanges(), api)) {
                        edges.add(new DependencyEdge(producer.componentName(), consumer.componentName(), EdgeKind.API_CALL, api));
                    }
                }
            }
        }
        return new ArrayList<>(edges);
    }

    private boolean mentionsCall(List<String> probableChanges, String api) {
        String needle = api.toLowerCase(Locale.ROOT);
        for (String change : probableChanges) {
            String text = change.toLowerCase(Locale.ROOT);
            if (text.contains("call") && text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
