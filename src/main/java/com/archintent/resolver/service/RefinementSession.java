package com.archintent.resolver.service;

import com.archintent.resolver.model.AnswerOutcome;
import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.ComponentDescriptor;
import com.archintent.resolver.model.ComponentHypothesis;
import com.archintent.resolver.model.ComponentType;
import com.archintent.resolver.model.Confidence;
import com.archintent.resolver.model.DiscoveryMatch;
import com.archintent.resolver.model.ImpactRecord;
import com.archintent.resolver.model.ImpactType;
import com.archintent.resolver.model.OpenQuestion;
import com.archintent.resolver.model.Priority;
import com.archintent.resolver.model.QuestionKind;
import com.archintent.resolver.model.QuestionSubject;
import com.archintent.resolver.model.ResolutionEntry;
import com.archintent.resolver.model.SessionSnapshot;
import com.archintent.resolver.model.SessionState;
import com.archintent.resolver.model.SubjectKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Question/answer loop that refines one analysis until no blocking (HIGH or MEDIUM) question is
 * left open.
 * <p>
 * The session hands out exactly one question at a time through {@link #nextQuestion()}. Every
 * answer to a blocking question must close at least one blocking question; when it does not, the
 * session reports {@link SessionState#STALLED} and keeps the question open for a different answer
 * or a manual {@link #override(String, String)}. Follow-up questions spawned by answers are always
 * LOW, so the number of steps is bounded by the initial number of blocking questions.
 * <p>
 * A session is owned by one analysis and shares no mutable state with other sessions. Public
 * methods are synchronized because HTTP clients may issue overlapping calls for the same session.
 */
public class RefinementSession {

    private static final Logger logger = LoggerFactory.getLogger(RefinementSession.class);

    static final String REPHRASE_QUESTION_ID = "input:rephrase";
    static final String REPHRASE_PROMPT = "could not identify any business domain; please rephrase";

    private static final Set<String> YES = Set.of("yes", "y", "true", "confirm", "confirmed", "correct");
    private static final Set<String> NO = Set.of("no", "n", "false", "reject", "rejected", "incorrect");
    private static final Set<String> NO_OWNER = Set.of("none", "nobody", "n/a", "no owner", "no");
    private static final int MAX_DISCOVERY_OPTIONS = 5;

    private final UUID id;
    private final String requestText;
    private final String ontologyVersion;
    private final ComponentCatalog catalog;
    private final DiscoveryBackend discovery;
    private final ComponentResolverService resolver;

    private final Map<String, ImpactRecord> records = new LinkedHashMap<>();
    private final Map<String, ComponentHypothesis> hypotheses = new LinkedHashMap<>();
    private final Map<String, OpenQuestion> questions = new LinkedHashMap<>();
    private final Map<String, ComponentDescriptor> speculativeEntries = new LinkedHashMap<>();
    private final Map<String, String> assignedOwners = new LinkedHashMap<>();
    private final Set<String> discoveryAttempted = new HashSet<>();
    private final List<ResolutionEntry> resolutionLog = new ArrayList<>();

    private long nextSequence = 1;
    private String dispatchedId;
    private String stalledQuestionId;
    private SessionState state;

    RefinementSession(UUID id,
                      String requestText,
                      String ontologyVersion,
                      ComponentCatalog catalog,
                      Collection<ImpactRecord> initialRecords,
                      List<ComponentHypothesis> initialHypotheses,
                      DiscoveryBackend discovery,
                      ComponentResolverService resolver) {
        this.id = id;
        this.requestText = requestText;
        this.ontologyVersion = ontologyVersion;
        this.catalog = catalog;
        this.discovery = discovery;
        this.resolver = resolver;

        for (ImpactRecord record : initialRecords) {
            records.put(record.domain(), record);
        }

        List<String> tied = initialRecords.stream()
                .filter(ImpactRecord::ambiguous)
                .map(ImpactRecord::domain)
                .collect(Collectors.toList());
        if (tied.size() >= 2) {
            register(OpenQuestion.open(
                    "tie:" + String.join("|", tied),
                    Priority.HIGH,
                    QuestionKind.AMBIGUOUS_OWNERSHIP,
                    QuestionSubject.domains(tied),
                    "Domains " + String.join(" and ", tied) + " are tied for ownership of this change. Which one owns it?",
                    tied));
        }

        for (ComponentHypothesis hypothesis : initialHypotheses) {
            ComponentHypothesis stored = hypothesis;
            for (OpenQuestion question : hypothesis.openQuestions()) {
                OpenQuestion registered = register(question);
                if (registered != null) {
                    stored = stored.withQuestion(registered);
                }
            }
            hypotheses.put(stored.componentName(), stored);
        }

        if (records.isEmpty()) {
            register(OpenQuestion.open(
                    REPHRASE_QUESTION_ID,
                    Priority.LOW,
                    QuestionKind.REPHRASE,
                    QuestionSubject.domains(List.of()),
                    REPHRASE_PROMPT,
                    List.of()));
        }

        this.state = computeState();
        logger.info("Refinement session {} created: {} domain(s), {} component hypothesis(es), {} blocking question(s), state {}",
                id, records.size(), hypotheses.size(), blockingOpenCount(), state);
    }

    public UUID id() {
        return id;
    }

    public String requestText() {
        return requestText;
    }

    public synchronized SessionState state() {
        return state;
    }

    public synchronized long blockingOpenCount() {
        return questions.values().stream()
                .filter(OpenQuestion::isOpen)
                .filter(q -> q.priority().isBlocking())
                .count();
    }

    public synchronized Optional<OpenQuestion> question(String questionId) {
        return Optional.ofNullable(questions.get(questionId));
    }

    /**
     * Dispatches the highest-priority open question (HIGH, then MEDIUM, then LOW; earliest created
     * first within a tier). Repeated calls return the same question until it is answered.
     * A resolved session still hands out its remaining LOW questions; returns empty once nothing
     * is open.
     */
    public synchronized Optional<OpenQuestion> nextQuestion() {
        if (dispatchedId != null) {
            OpenQuestion dispatched = questions.get(dispatchedId);
            if (dispatched != null && dispatched.isOpen()) {
                return Optional.of(dispatched);
            }
            dispatchedId = null;
        }
        Optional<OpenQuestion> next = questions.values().stream()
                .filter(OpenQuestion::isOpen)
                .min(Comparator.comparingInt((OpenQuestion q) -> q.priority().order())
                        .thenComparingLong(OpenQuestion::sequence));
        if (next.isEmpty()) {
            state = computeState();
            return Optional.empty();
        }
        OpenQuestion question = withDiscoveryOptions(next.get());
        dispatchedId = question.id();
        if (question.priority().isBlocking() && state != SessionState.STALLED) {
            state = SessionState.AWAITING_ANSWER;
        }
        logger.debug("Session {} dispatched question {} ({})", id, question.id(), question.priority());
        return Optional.of(question);
    }

    /**
     * Applies an answer to an open question. Any open question may be answered by id.
     *
     * @throws UnknownQuestionException if the id is not part of this session
     * @throws IllegalStateException    if the question was already answered
     */
    public synchronized AnswerOutcome answer(String questionId, String value) {
        OpenQuestion question = requireOpen(questionId);
        SessionState previous = state;
        long blockingBefore = blockingOpenCount();
        String answer = value == null ? "" : value.trim();

        List<String> effects = new ArrayList<>();
        List<String> spawned = new ArrayList<>();
        boolean applied = apply(question, answer, effects, spawned);
        if (applied) {
            close(question.id(), answer);
            resolutionLog.add(new ResolutionEntry(resolutionLog.size() + 1, questionId, answer, false, effects));
        }

        if (question.priority().isBlocking() && blockingOpenCount() >= blockingBefore) {
            stalledQuestionId = questionId;
            dispatchedId = questionId;
            state = SessionState.STALLED;
            logger.warn("Session {} stalled: answer '{}' to {} did not reduce the {} blocking question(s)",
                    id, answer, questionId, blockingBefore);
            return new AnswerOutcome(questionId, false, state,
                    "answer did not resolve the question; give a different answer or override it", List.of());
        }

        if (questionId.equals(dispatchedId)) {
            dispatchedId = null;
        }
        if (questionId.equals(stalledQuestionId)) {
            stalledQuestionId = null;
        }
        state = computeState();
        if (state == SessionState.RESOLVED && previous != SessionState.RESOLVED) {
            logger.info("Refinement session {} resolved after {} answer(s)", id, resolutionLog.size());
        }
        String message = applied ? String.join("; ", effects) : "answer not applicable to question " + questionId;
        return new AnswerOutcome(questionId, applied, state, message, spawned);
    }

    /**
     * Accepts the current hypothesis for a question as-is. Used when a stalled question cannot be
     * answered with one of the expected values.
     */
    public synchronized AnswerOutcome override(String questionId, String note) {
        OpenQuestion question = requireOpen(questionId);
        List<String> effects = new ArrayList<>();
        switch (question.kind()) {
            case OWNERSHIP_CONFIRMATION: {
                ComponentHypothesis hypothesis = hypotheses.get(question.subject().primary());
                if (hypothesis != null && records.containsKey(hypothesis.domain())) {
                    changeConfidence(records.get(hypothesis.domain()), Confidence.HIGH, "manual override", effects);
                }
                break;
            }
            case OWNER_ASSIGNMENT: {
                ImpactRecord record = records.get(question.subject().primary());
                if (record != null) {
                    changeConfidence(record, Confidence.HIGH, "manual override; owner left unassigned", effects);
                }
                break;
            }
            case AMBIGUOUS_OWNERSHIP:
                for (String domain : question.subject().references()) {
                    ImpactRecord record = records.get(domain);
                    if (record != null) {
                        records.put(domain, record.disambiguated("manual override keeps shared ownership"));
                        effects.add(domain + ": shared ownership kept");
                    }
                }
                break;
            default:
                break;
        }
        String recorded = note == null || note.isBlank() ? "override" : "override: " + note.trim();
        close(questionId, recorded);
        resolutionLog.add(new ResolutionEntry(resolutionLog.size() + 1, questionId, recorded, true, effects));
        logger.warn("Session {}: question {} overridden manually ({})", id, questionId, recorded);

        if (questionId.equals(dispatchedId)) {
            dispatchedId = null;
        }
        if (questionId.equals(stalledQuestionId)) {
            stalledQuestionId = null;
        }
        state = computeState();
        return new AnswerOutcome(questionId, true, state, "overridden", List.of());
    }

    public synchronized SessionSnapshot snapshot() {
        Map<String, ComponentDescriptor> descriptors = new LinkedHashMap<>();
        for (String name : hypotheses.keySet()) {
            ComponentDescriptor descriptor = descriptorFor(name);
            if (descriptor != null) {
                descriptors.put(name, descriptor);
            }
        }
        return new SessionSnapshot(
                id,
                requestText,
                ontologyVersion,
                state,
                new ArrayList<>(records.values()),
                new ArrayList<>(hypotheses.values()),
                new ArrayList<>(questions.values()),
                descriptors,
                assignedOwners,
                resolutionLog);
    }

    private boolean apply(OpenQuestion question, String answer, List<String> effects, List<String> spawned) {
        String lower = answer.toLowerCase(Locale.ROOT);
        switch (question.kind()) {
            case OWNERSHIP_CONFIRMATION:
                return applyOwnershipConfirmation(question, lower, effects, spawned);
            case OWNER_ASSIGNMENT:
                return applyOwnerAssignment(question, answer, effects);
            case AMBIGUOUS_OWNERSHIP:
                return applyTieBreak(question, answer, effects);
            case EVENT_SCHEMA:
                return addProbableChange(question, answer, ComponentResolverService.PUBLISH_EVENT_PREFIX, effects);
            case API_USAGE:
                return addProbableChange(question, answer, ComponentResolverService.CALL_API_PREFIX, effects);
            case REPHRASE:
                if (answer.isEmpty()) {
                    return false;
                }
                effects.add("rephrased request noted; start a new analysis with it");
                return true;
            default:
                return false;
        }
    }

    private boolean applyOwnershipConfirmation(OpenQuestion question, String lower,
                                               List<String> effects, List<String> spawned) {
        String name = question.subject().primary();
        ComponentHypothesis hypothesis = hypotheses.get(name);
        if (hypothesis == null) {
            return false;
        }
        ImpactRecord record = records.get(hypothesis.domain());
        if (YES.contains(lower)) {
            if (record != null) {
                changeConfidence(record, Confidence.HIGH, "ownership confirmed for '" + name + "'", effects);
            }
            spawnFollowUps(name, records.get(hypothesis.domain()), effects, spawned);
            return true;
        }
        if (NO.contains(lower)) {
            hypotheses.put(name, hypothesis.reject());
            effects.add("component '" + name + "' rejected");
            if (record != null && everyHypothesisRejected(record.domain())) {
                records.put(record.domain(), record.reject("every candidate component rejected"));
                effects.add(record.domain() + ": rejected");
                logger.info("Session {}: domain '{}' rejected ({} confidence)", id, record.domain(), record.confidence());
            }
            return true;
        }
        return false;
    }

    private void spawnFollowUps(String name, ImpactRecord record, List<String> effects, List<String> spawned) {
        ComponentDescriptor descriptor = descriptorFor(name);
        if (record != null && record.impactType() == ImpactType.SIDE_EFFECT) {
            List<String> events = descriptor == null ? List.of() : descriptor.publishedEvents();
            spawnFollowUp(name, OpenQuestion.open(
                    "event-schema:" + name,
                    Priority.LOW,
                    QuestionKind.EVENT_SCHEMA,
                    QuestionSubject.component(name),
                    "Which event should '" + name + "' publish for this change?",
                    events), effects, spawned);
        }
        if (descriptor != null && descriptor.type() == ComponentType.FRONTEND_APP) {
            LinkedHashSet<String> apis = new LinkedHashSet<>();
            for (ComponentHypothesis other : hypotheses.values()) {
                if (other.rejected() || other.componentName().equals(name)) {
                    continue;
                }
                ComponentDescriptor otherDescriptor = descriptorFor(other.componentName());
                if (otherDescriptor != null) {
                    apis.addAll(otherDescriptor.apis());
                }
            }
            if (!apis.isEmpty()) {
                spawnFollowUp(name, OpenQuestion.open(
                        "api-usage:" + name,
                        Priority.LOW,
                        QuestionKind.API_USAGE,
                        QuestionSubject.component(name),
                        "Which API should '" + name + "' call to support this change?",
                        new ArrayList<>(apis)), effects, spawned);
            }
        }
    }

    private void spawnFollowUp(String name, OpenQuestion followUp, List<String> effects, List<String> spawned) {
        OpenQuestion registered = register(followUp);
        if (registered == null) {
            return;
        }
        ComponentHypothesis hypothesis = hypotheses.get(name);
        if (hypothesis != null) {
            hypotheses.put(name, hypothesis.withQuestion(registered));
        }
        spawned.add(registered.id());
        effects.add("follow-up question " + registered.id());
    }

    private boolean applyOwnerAssignment(OpenQuestion question, String answer, List<String> effects) {
        String domain = question.subject().primary();
        ImpactRecord record = records.get(domain);
        if (record == null || answer.isEmpty()) {
            return false;
        }
        String placeholderName = ComponentResolverService.placeholderName(domain);
        ComponentHypothesis placeholder = hypotheses.get(placeholderName);

        if (NO_OWNER.contains(answer.toLowerCase(Locale.ROOT))) {
            if (placeholder != null) {
                hypotheses.put(placeholderName, placeholder.reject());
            }
            records.put(domain, record.reject("no owning component"));
            effects.add(domain + ": rejected, no owning component");
            return true;
        }

        ComponentDescriptor descriptor = catalog.find(answer)
                .orElse(speculativeEntries.get(answer.toLowerCase(Locale.ROOT)));
        if (descriptor == null) {
            descriptor = ComponentDescriptor.speculative(answer);
            speculativeEntries.put(answer.toLowerCase(Locale.ROOT), descriptor);
            logger.warn("Session {}: answer to {} names unknown component '{}'; accepted as speculative entry",
                    id, question.id(), answer);
            effects.add("speculative catalog entry '" + answer + "' with domain " + ComponentDescriptor.UNKNOWN_DOMAIN);
        }

        List<String> changes = resolver.describeChanges(record, descriptor.speculative() ? null : descriptor);
        ComponentHypothesis existing = hypotheses.get(descriptor.name());
        ComponentHypothesis assigned = existing != null
                ? existing.withProbableChanges(changes)
                : new ComponentHypothesis(
                        descriptor.name(),
                        descriptor.speculative() ? domain : descriptor.domain(),
                        record.impactType(),
                        changes,
                        List.of(),
                        descriptor.speculative(),
                        false);
        hypotheses.remove(placeholderName);
        hypotheses.put(assigned.componentName(), assigned);
        assignedOwners.put(domain, assigned.componentName());
        effects.add("'" + assigned.componentName() + "' assigned as owner of " + domain);
        String reason = "owner assigned: '" + assigned.componentName() + "'";
        if (!domain.equalsIgnoreCase(assigned.domain())) {
            reason += " (catalog domain " + assigned.domain() + ")";
        }
        changeConfidence(record, Confidence.HIGH, reason, effects);
        return true;
    }

    private boolean applyTieBreak(OpenQuestion question, String answer, List<String> effects) {
        Optional<String> chosen = question.subject().references().stream()
                .filter(domain -> domain.equalsIgnoreCase(answer))
                .findFirst();
        if (chosen.isEmpty()) {
            return false;
        }
        for (String domain : question.subject().references()) {
            ImpactRecord record = records.get(domain);
            if (record == null) {
                continue;
            }
            if (domain.equals(chosen.get())) {
                records.put(domain, record.disambiguated("chosen as owner"));
                effects.add(domain + ": confirmed owner");
                continue;
            }
            ImpactRecord dependency = record
                    .disambiguated("ownership tie resolved in favour of '" + chosen.get() + "'")
                    .withImpactType(ImpactType.DEPENDENCY, null);
            records.put(domain, dependency);
            changeConfidence(dependency, Confidence.LOW, "downgraded after ownership tie", effects);
            for (ComponentHypothesis hypothesis : new ArrayList<>(hypotheses.values())) {
                if (domain.equalsIgnoreCase(hypothesis.domain())) {
                    hypotheses.put(hypothesis.componentName(), hypothesis.withChangeKind(ImpactType.DEPENDENCY));
                }
            }
        }
        return true;
    }

    private boolean addProbableChange(OpenQuestion question, String answer, String prefix, List<String> effects) {
        if (answer.isEmpty()) {
            return false;
        }
        String name = question.subject().primary();
        ComponentHypothesis hypothesis = hypotheses.get(name);
        if (hypothesis == null) {
            return false;
        }
        hypotheses.put(name, hypothesis.withProbableChanges(List.of(prefix + answer)));
        effects.add("'" + name + "': " + prefix + answer);
        return true;
    }

    private void changeConfidence(ImpactRecord record, Confidence target, String reason, List<String> effects) {
        if (record.confidence() == target) {
            return;
        }
        records.put(record.domain(), record.withConfidence(target, reason));
        effects.add(record.domain() + ": " + record.confidence() + " -> " + target);
        logger.info("Session {}: domain '{}' confidence {} -> {} ({})",
                id, record.domain(), record.confidence(), target, reason);
    }

    private boolean everyHypothesisRejected(String domain) {
        return hypotheses.values().stream()
                .filter(h -> domain.equalsIgnoreCase(h.domain()))
                .allMatch(ComponentHypothesis::rejected);
    }

    private OpenQuestion withDiscoveryOptions(OpenQuestion question) {
        if (question.kind() != QuestionKind.OWNER_ASSIGNMENT
                || !question.options().isEmpty()
                || !discoveryAttempted.add(question.id())) {
            return question;
        }
        String domain = question.subject().primary();
        List<String> terms = new ArrayList<>();
        terms.add(domain);
        ImpactRecord record = records.get(domain);
        if (record != null) {
            terms.addAll(record.matchedTriggers());
        }
        List<DiscoveryMatch> matches = discovery.discover(terms, catalog);
        if (matches.isEmpty()) {
            logger.debug("Session {}: no discovery evidence for {}; asking directly", id, question.id());
            return question;
        }
        List<String> options = matches.stream()
                .limit(MAX_DISCOVERY_OPTIONS)
                .map(match -> match.component().name())
                .collect(Collectors.toList());
        OpenQuestion enriched = questions.get(question.id()).withOptions(options);
        questions.put(enriched.id(), enriched);
        syncIntoHypothesis(enriched);
        return enriched;
    }

    private OpenQuestion register(OpenQuestion question) {
        if (questions.containsKey(question.id())) {
            return null;
        }
        OpenQuestion stored = question.withSequence(nextSequence++);
        questions.put(stored.id(), stored);
        return stored;
    }

    private void close(String questionId, String answer) {
        OpenQuestion answered = questions.get(questionId).answered(answer);
        questions.put(questionId, answered);
        syncIntoHypothesis(answered);
    }

    private void syncIntoHypothesis(OpenQuestion question) {
        String owner;
        if (question.subject().kind() == SubjectKind.COMPONENT) {
            owner = question.subject().primary();
        } else if (question.kind() == QuestionKind.OWNER_ASSIGNMENT) {
            owner = ComponentResolverService.placeholderName(question.subject().primary());
        } else {
            return;
        }
        ComponentHypothesis hypothesis = owner == null ? null : hypotheses.get(owner);
        if (hypothesis != null) {
            hypotheses.put(owner, hypothesis.withQuestion(question));
        }
    }

    private OpenQuestion requireOpen(String questionId) {
        OpenQuestion question = questionId == null ? null : questions.get(questionId);
        if (question == null) {
            throw new UnknownQuestionException(questionId);
        }
        if (!question.isOpen()) {
            throw new IllegalStateException("Question already answered: " + questionId);
        }
        return question;
    }

    private ComponentDescriptor descriptorFor(String name) {
        return catalog.find(name).orElse(speculativeEntries.get(name.toLowerCase(Locale.ROOT)));
    }

    private SessionState computeState() {
        if (blockingOpenCount() == 0) {
            return SessionState.RESOLVED;
        }
        // only a closing answer or an override clears a stall
        if (stalledQuestionId != null && questions.get(stalledQuestionId).isOpen()) {
            return SessionState.STALLED;
        }
        if (dispatchedId != null && questions.containsKey(dispatchedId) && questions.get(dispatchedId).isOpen()) {
            return SessionState.AWAITING_ANSWER;
        }
        return SessionState.OPEN;
    }
}
