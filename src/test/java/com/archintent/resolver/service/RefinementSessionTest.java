package com.archintent.resolver.service;

import com.archintent.resolver.TestOntologies;
import com.archintent.resolver.model.AnswerOutcome;
import com.archintent.resolver.model.ComponentHypothesis;
import com.archintent.resolver.model.ComponentType;
import com.archintent.resolver.model.Confidence;
import com.archintent.resolver.model.Hypothesis;
import com.archintent.resolver.model.ImpactRecord;
import com.archintent.resolver.model.ImpactType;
import com.archintent.resolver.model.Ontology;
import com.archintent.resolver.model.OpenQuestion;
import com.archintent.resolver.model.Priority;
import com.archintent.resolver.model.QuestionKind;
import com.archintent.resolver.model.ScoringPolicy;
import com.archintent.resolver.model.SessionSnapshot;
import com.archintent.resolver.model.SessionState;
import com.archintent.resolver.repository.ComponentCatalogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.archintent.resolver.TestOntologies.ANALYTICS;
import static com.archintent.resolver.TestOntologies.BILLING;
import static com.archintent.resolver.TestOntologies.FRONTEND;
import static com.archintent.resolver.TestOntologies.INTEGRATION;
import static com.archintent.resolver.TestOntologies.ORDERS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RefinementSessionTest {

    private static final String TIE_REQUEST = "Add the invoice number to the order confirmation";
    private static final String ALERT_REQUEST = "Alert the customer";
    private static final String NOTIFICATION_OWNERSHIP = "ownership:" + INTEGRATION + ":notification-service";
    private static final String PROFILE_REQUEST = "Update the customer profile with the latest order and show a banner";
    private static final String DASHBOARD_OWNERSHIP = "ownership:" + FRONTEND + ":agent-dashboard";
    private static final String ORDER_OWNERSHIP = "ownership:" + ORDERS + ":order-service";

    private IntentAnalysisService analysisService;
    private ComponentCatalogRepository catalogRepository;

    @BeforeEach
    void setUp() {
        Ontology ontology = TestOntologies.standard();
        catalogRepository = new ComponentCatalogRepository(ontology, TestOntologies.catalog());
        ComponentResolverService resolver = new ComponentResolverService(ontology);
        analysisService = new IntentAnalysisService(
                ontology,
                new TaggerService(ontology),
                new DomainScorerService(ontology, ScoringPolicy.defaults()),
                resolver,
                catalogRepository,
                new DiscoverySearchService(catalogRepository),
                new HypothesisAssemblerService());
    }

    @Test
    void allHighConfidenceSessionIsResolvedImmediately() {
        RefinementSession session = analysisService.startSession(TestOntologies.PREMIUM_TICKET_REQUEST);

        assertThat(session.state()).isEqualTo(SessionState.RESOLVED);
        assertThat(session.blockingOpenCount()).isZero();
        assertThat(session.nextQuestion()).isEmpty();
    }

    @Test
    void nextQuestionDispatchesOneQuestionAtATime() {
        RefinementSession session = analysisService.startSession(ALERT_REQUEST);

        OpenQuestion first = session.nextQuestion().orElseThrow();

        assertThat(first.id()).isEqualTo(NOTIFICATION_OWNERSHIP);
        assertThat(first.priority()).isEqualTo(Priority.MEDIUM);
        assertThat(session.state()).isEqualTo(SessionState.AWAITING_ANSWER);
        assertThat(session.nextQuestion()).contains(first);
    }

    @Test
    void confirmingOwnershipRaisesConfidenceAndSpawnsLowFollowUp() {
        RefinementSession session = analysisService.startSession(ALERT_REQUEST);
        session.nextQuestion();

        AnswerOutcome outcome = session.answer(NOTIFICATION_OWNERSHIP, "yes");

        assertThat(outcome.applied()).isTrue();
        assertThat(outcome.state()).isEqualTo(SessionState.RESOLVED);
        assertThat(outcome.spawnedQuestionIds()).containsExactly("event-schema:notification-service");
        assertThat(records(session).get(INTEGRATION).confidence()).isEqualTo(Confidence.HIGH);

        OpenQuestion followUp = session.question("event-schema:notification-service").orElseThrow();
        assertThat(followUp.priority()).isEqualTo(Priority.LOW);
        assertThat(followUp.options()).containsExactly("NotificationSent");
        assertThat(session.nextQuestion()).contains(followUp);
        assertThat(session.state()).isEqualTo(SessionState.RESOLVED);
    }

    @Test
    void answeringFollowUpAddsProbableChange() {
        RefinementSession session = analysisService.startSession(ALERT_REQUEST);
        session.answer(NOTIFICATION_OWNERSHIP, "yes");

        session.answer("event-schema:notification-service", "TicketEscalated");

        assertThat(hypotheses(session).get("notification-service").probableChanges())
                .contains("publish event TicketEscalated");
        assertThat(session.nextQuestion()).isEmpty();
    }

    @Test
    void rejectingEveryCandidateRejectsTheDomain() {
        RefinementSession session = analysisService.startSession(ALERT_REQUEST);

        AnswerOutcome outcome = session.answer(NOTIFICATION_OWNERSHIP, "no");

        assertThat(outcome.state()).isEqualTo(SessionState.RESOLVED);
        assertThat(hypotheses(session).get("notification-service").rejected()).isTrue();
        assertThat(records(session).get(INTEGRATION).rejected()).isTrue();
    }

    @Test
    void unusableAnswerStallsTheSession() {
        RefinementSession session = analysisService.startSession(ALERT_REQUEST);
        session.nextQuestion();

        AnswerOutcome outcome = session.answer(NOTIFICATION_OWNERSHIP, "maybe");

        assertThat(outcome.applied()).isFalse();
        assertThat(outcome.state()).isEqualTo(SessionState.STALLED);
        assertThat(session.state()).isEqualTo(SessionState.STALLED);
        assertThat(session.question(NOTIFICATION_OWNERSHIP).orElseThrow().isOpen()).isTrue();
        assertThat(session.nextQuestion().orElseThrow().id()).isEqualTo(NOTIFICATION_OWNERSHIP);
    }

    @Test
    void stalledSessionRecoversWithDifferentAnswer() {
        RefinementSession session = analysisService.startSession(ALERT_REQUEST);
        session.answer(NOTIFICATION_OWNERSHIP, "maybe");

        AnswerOutcome outcome = session.answer(NOTIFICATION_OWNERSHIP, "y");

        assertThat(outcome.state()).isEqualTo(SessionState.RESOLVED);
    }

    @Test
    void stallPersistsWhileOtherQuestionsAreAnswered() {
        RefinementSession session = analysisService.startSession(PROFILE_REQUEST);
        assertThat(session.nextQuestion().orElseThrow().id()).isEqualTo(DASHBOARD_OWNERSHIP);
        session.answer(DASHBOARD_OWNERSHIP, "maybe");
        assertThat(session.question(ORDER_OWNERSHIP).orElseThrow().priority()).isEqualTo(Priority.LOW);

        AnswerOutcome outcome = session.answer(ORDER_OWNERSHIP, "yes");

        assertThat(outcome.applied()).isTrue();
        assertThat(outcome.state()).isEqualTo(SessionState.STALLED);
        assertThat(session.state()).isEqualTo(SessionState.STALLED);
        assertThat(session.question(DASHBOARD_OWNERSHIP).orElseThrow().isOpen()).isTrue();
        assertThat(session.nextQuestion().orElseThrow().id()).isEqualTo(DASHBOARD_OWNERSHIP);
        assertThat(session.state()).isEqualTo(SessionState.STALLED);
    }

    @Test
    void stallClearsOnceTheStalledQuestionIsClosed() {
        RefinementSession session = analysisService.startSession(PROFILE_REQUEST);
        session.answer(DASHBOARD_OWNERSHIP, "maybe");
        session.answer(ORDER_OWNERSHIP, "yes");

        AnswerOutcome outcome = session.answer(DASHBOARD_OWNERSHIP, "yes");

        assertThat(outcome.applied()).isTrue();
        assertThat(outcome.state()).isEqualTo(SessionState.RESOLVED);
        assertThat(records(session).get(FRONTEND).confidence()).isEqualTo(Confidence.HIGH);
    }

    @Test
    void overrideAcceptsCurrentHypothesisAndIsLogged() {
        RefinementSession session = analysisService.startSession(ALERT_REQUEST);
        session.answer(NOTIFICATION_OWNERSHIP, "maybe");

        AnswerOutcome outcome = session.override(NOTIFICATION_OWNERSHIP, "team confirmed offline");

        assertThat(outcome.state()).isEqualTo(SessionState.RESOLVED);
        SessionSnapshot snapshot = session.snapshot();
        assertThat(snapshot.resolutionLog()).singleElement().satisfies(entry -> {
            assertThat(entry.override()).isTrue();
            assertThat(entry.answer()).isEqualTo("override: team confirmed offline");
        });
        assertThat(records(session).get(INTEGRATION).confidence()).isEqualTo(Confidence.HIGH);
    }

    @Test
    void tieIsAskedAtHighPriorityAndNeverResolvedAutomatically() {
        RefinementSession session = analysisService.startSession(TIE_REQUEST);

        OpenQuestion tie = session.nextQuestion().orElseThrow();

        assertThat(tie.kind()).isEqualTo(QuestionKind.AMBIGUOUS_OWNERSHIP);
        assertThat(tie.priority()).isEqualTo(Priority.HIGH);
        assertThat(tie.options()).containsExactly(ORDERS, BILLING);
        assertThat(session.state()).isEqualTo(SessionState.AWAITING_ANSWER);
    }

    @Test
    void breakingTieDowngradesTheOtherDomainToDependency() {
        RefinementSession session = analysisService.startSession(TIE_REQUEST);
        OpenQuestion tie = session.nextQuestion().orElseThrow();

        AnswerOutcome outcome = session.answer(tie.id(), "billing");

        assertThat(outcome.state()).isEqualTo(SessionState.RESOLVED);
        Map<String, ImpactRecord> records = records(session);
        assertThat(records.get(BILLING).confidence()).isEqualTo(Confidence.HIGH);
        assertThat(records.get(BILLING).ambiguous()).isFalse();
        assertThat(records.get(ORDERS).impactType()).isEqualTo(ImpactType.DEPENDENCY);
        assertThat(records.get(ORDERS).confidence()).isEqualTo(Confidence.LOW);
        assertThat(hypotheses(session).get("order-service").changeKind()).isEqualTo(ImpactType.DEPENDENCY);
    }

    @Test
    void unknownComponentAnswerBecomesSpeculativeEntry() {
        RefinementSession session = analysisService.startSession("Export a report");
        OpenQuestion owner = session.nextQuestion().orElseThrow();
        assertThat(owner.kind()).isEqualTo(QuestionKind.OWNER_ASSIGNMENT);
        assertThat(owner.priority()).isEqualTo(Priority.HIGH);

        AnswerOutcome outcome = session.answer(owner.id(), "insights-service");

        assertThat(outcome.applied()).isTrue();
        assertThat(outcome.state()).isEqualTo(SessionState.RESOLVED);
        ComponentHypothesis speculative = hypotheses(session).get("insights-service");
        assertThat(speculative.speculative()).isTrue();
        assertThat(speculative.domain()).isEqualTo(ANALYTICS);
        assertThat(hypotheses(session)).doesNotContainKey(ComponentResolverService.placeholderName(ANALYTICS));
        assertThat(session.snapshot().descriptors().get("insights-service").domain()).isEqualTo("unknown");
        assertThat(catalogRepository.snapshot().contains("insights-service")).isFalse();
    }

    @Test
    void ownerQuestionOffersDiscoveredComponents() {
        catalogRepository.register(TestOntologies.component("report-builder", BILLING, null,
                List.of(), List.of(), List.of()));
        RefinementSession session = analysisService.startSession("Export a report");

        OpenQuestion owner = session.nextQuestion().orElseThrow();

        assertThat(owner.options()).containsExactly("report-builder");
    }

    @Test
    void componentRegisteredAfterStartIsNotOffered() {
        RefinementSession session = analysisService.startSession("Export a report");
        catalogRepository.register(TestOntologies.component("report-hub", ANALYTICS, null,
                List.of(), List.of(), List.of()));

        OpenQuestion owner = session.nextQuestion().orElseThrow();

        assertThat(owner.options()).doesNotContain("report-hub");
    }

    @Test
    void choosingDiscoveredOptionAssignsTheCatalogComponent() {
        catalogRepository.register(TestOntologies.component("report-builder", BILLING, ComponentType.BACKEND_SERVICE,
                List.of("report-api"), List.of(), List.of()));
        RefinementSession session = analysisService.startSession("Export a report");
        OpenQuestion owner = session.nextQuestion().orElseThrow();
        assertThat(owner.options()).containsExactly("report-builder");

        AnswerOutcome outcome = session.answer(owner.id(), owner.options().get(0));

        assertThat(outcome.applied()).isTrue();
        assertThat(outcome.state()).isEqualTo(SessionState.RESOLVED);
        ComponentHypothesis assigned = hypotheses(session).get("report-builder");
        assertThat(assigned.speculative()).isFalse();
        assertThat(assigned.domain()).isEqualTo(BILLING);
        assertThat(session.snapshot().descriptors().get("report-builder").domain()).isEqualTo(BILLING);
        assertThat(records(session).get(ANALYTICS).reasoning()).contains("catalog domain " + BILLING);

        Hypothesis hypothesis = new HypothesisAssemblerService().assemble(session);
        assertThat(hypothesis.impactMatrix())
                .filteredOn(row -> row.domain().equals(ANALYTICS))
                .singleElement()
                .satisfies(row -> assertThat(row.components()).containsExactly("report-builder"));
    }

    @Test
    void noOwnerAnswerRejectsTheDomain() {
        RefinementSession session = analysisService.startSession("Export a report");
        OpenQuestion owner = session.nextQuestion().orElseThrow();

        session.answer(owner.id(), "none");

        assertThat(records(session).get(ANALYTICS).rejected()).isTrue();
        assertThat(session.state()).isEqualTo(SessionState.RESOLVED);
    }

    @Test
    void emptyInputAsksToRephraseWithoutBlocking() {
        RefinementSession session = analysisService.startSession("Refactor the build scripts");

        assertThat(session.state()).isEqualTo(SessionState.RESOLVED);
        Optional<OpenQuestion> question = session.nextQuestion();
        assertThat(question).isPresent();
        assertThat(question.get().priority()).isEqualTo(Priority.LOW);
        assertThat(question.get().prompt()).isEqualTo(RefinementSession.REPHRASE_PROMPT);
    }

    @Test
    void answeringTwiceOrUnknownIdFails() {
        RefinementSession session = analysisService.startSession(ALERT_REQUEST);
        session.answer(NOTIFICATION_OWNERSHIP, "yes");

        assertThatThrownBy(() -> session.answer(NOTIFICATION_OWNERSHIP, "yes"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.answer("ownership:nowhere:nothing", "yes"))
                .isInstanceOf(UnknownQuestionException.class);
    }

    @Test
    void convergesWithinInitialBlockingQuestionCount() {
        RefinementSession session = analysisService.startSession("Alert the customer and show a banner");
        long initialBlocking = session.blockingOpenCount();
        assertThat(initialBlocking).isEqualTo(2);

        int steps = 0;
        Optional<OpenQuestion> next = session.nextQuestion();
        while (next.isPresent() && next.get().priority().isBlocking()) {
            session.answer(next.get().id(), "yes");
            steps++;
            next = session.nextQuestion();
        }

        assertThat(steps).isLessThanOrEqualTo((int) initialBlocking);
        assertThat(session.state()).isEqualTo(SessionState.RESOLVED);
        assertThat(records(session).get(FRONTEND).confidence()).isEqualTo(Confidence.HIGH);
    }

    @Test
    void sessionsDoNotShareState() {
        RefinementSession first = analysisService.startSession(ALERT_REQUEST);
        RefinementSession second = analysisService.startSession(ALERT_REQUEST);

        first.answer(NOTIFICATION_OWNERSHIP, "no");

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(second.question(NOTIFICATION_OWNERSHIP).orElseThrow().isOpen()).isTrue();
        assertThat(records(second).get(INTEGRATION).rejected()).isFalse();
    }

    private static Map<String, ImpactRecord> records(RefinementSession session) {
        return session.snapshot().records().stream()
                .collect(Collectors.toMap(ImpactRecord::domain, Function.identity()));
    }

    private static Map<String, ComponentHypothesis> hypotheses(RefinementSession session) {
        return session.snapshot().hypotheses().stream()
                .collect(Collectors.toMap(ComponentHypothesis::componentName, Function.identity()));
    }
}
