package com.archintent.resolver.service;

import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.ComponentDescriptor;
import com.archintent.resolver.model.ComponentHypothesis;
import com.archintent.resolver.model.Confidence;
import com.archintent.resolver.model.Domain;
import com.archintent.resolver.model.ImpactRecord;
import com.archintent.resolver.model.Ontology;
import com.archintent.resolver.model.OpenQuestion;
import com.archintent.resolver.model.Priority;
import com.archintent.resolver.model.QuestionKind;
import com.archintent.resolver.model.QuestionSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Narrows an impacted domain to the catalog components that must change.
 */
@Service
public class ComponentResolverService {

    private static final Logger logger = LoggerFactory.getLogger(ComponentResolverService.class);

    static final String CALL_API_PREFIX = "call API ";
    static final String PUBLISH_EVENT_PREFIX = "publish event ";

    private final Ontology ontology;

    public ComponentResolverService(Ontology ontology) {
        this.ontology = ontology;
    }

    public List<ComponentHypothesis> resolve(ImpactRecord record, ComponentCatalog catalog) {
        List<ComponentDescriptor> components = catalog.inDomain(record.domain());
        if (components.isEmpty()) {
            logger.debug("No catalog component for domain '{}'; emitting placeholder", record.domain());
            return List.of(placeholder(record));
        }

        List<ComponentHypothesis> hypotheses = new ArrayList<>(components.size());
        for (ComponentDescriptor component : components) {
            List<OpenQuestion> questions = new ArrayList<>();
            if (record.confidence() != Confidence.HIGH) {
                questions.add(ownershipQuestion(record, component));
            }
            hypotheses.add(new ComponentHypothesis(
                    component.name(),
                    component.domain(),
                    record.impactType(),
                    describeChanges(record, component),
                    questions,
                    false,
                    false));
        }
        return hypotheses;
    }

    /**
     * Generic change descriptors templated from the matched triggers and the component's declared
     * events and APIs.
     */
    public List<String> describeChanges(ImpactRecord record, ComponentDescriptor component) {
        String subject = record.matchedTriggers().isEmpty()
                ? record.domain()
                : record.matchedTriggers().stream().map(t -> "'" + t + "'").collect(Collectors.joining(", "));
        List<String> changes = new ArrayList<>();
        switch (record.impactType()) {
            case CORE_CHANGE:
                changes.add("update core logic for " + subject);
                break;
            case UI_CHANGE:
                changes.add("render " + subject + " in the user interface");
                break;
            case API_CHANGE:
                changes.add("extend API contract for " + subject);
                if (component != null) {
                    component.apis().forEach(api -> changes.add("review API " + api));
                }
                break;
            case SIDE_EFFECT:
                changes.add("emit side effect for " + subject);
                if (component != null) {
                    component.publishedEvents().forEach(event -> changes.add(PUBLISH_EVENT_PREFIX + event));
                }
                break;
            case DEPENDENCY:
                changes.add("adapt to upstream change around " + subject);
                break;
            default:
                changes.add("assess possible impact of " + subject);
                break;
        }
        return changes;
    }

    public static String placeholderName(String domain) {
        return "<unassigned:" + domain + ">";
    }

    static String ownershipQuestionId(String domain, String component) {
        return "ownership:" + domain + ":" + component;
    }

    static String ownerQuestionId(String domain) {
        return "owner:" + domain;
    }

    private ComponentHypothesis placeholder(ImpactRecord record) {
        String responsibility = ontology.domain(record.domain())
                .map(Domain::responsibility)
                .filter(r -> r != null && !r.isBlank())
                .map(r -> " (" + r + ")")
                .orElse("");
        OpenQuestion question = OpenQuestion.open(
                ownerQuestionId(record.domain()),
                Priority.HIGH,
                QuestionKind.OWNER_ASSIGNMENT,
                QuestionSubject.domain(record.domain()),
                "No catalog component is registered for domain '" + record.domain() + "'" + responsibility
                        + ". Which component owns this capability?",
                List.of());
        return new ComponentHypothesis(
                placeholderName(record.domain()),
                record.domain(),
                record.impactType(),
                describeChanges(record, null),
                List.of(question),
                true,
                false);
    }

    private OpenQuestion ownershipQuestion(ImpactRecord record, ComponentDescriptor component) {
        // tied records are HIGH and never get here; the session's tie question covers them
        Priority priority = Priority.of(record.confidence());
        String triggers = record.matchedTriggers().isEmpty()
                ? "this"
                : String.join(", ", record.matchedTriggers());
        return OpenQuestion.open(
                ownershipQuestionId(record.domain(), component.name()),
                priority,
                QuestionKind.OWNERSHIP_CONFIRMATION,
                QuestionSubject.component(component.name()),
                "Does '" + component.name() + "' own the " + triggers + " change for domain '"
                        + record.domain() + "' (" + record.impactType().label() + ")?",
                List.of("yes", "no"));
    }
}
