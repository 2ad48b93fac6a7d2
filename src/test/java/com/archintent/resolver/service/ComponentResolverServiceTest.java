package com.archintent.resolver.service;

import com.archintent.resolver.TestOntologies;
import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.ComponentHypothesis;
import com.archintent.resolver.model.Confidence;
import com.archintent.resolver.model.ImpactRecord;
import com.archintent.resolver.model.ImpactType;
import com.archintent.resolver.model.OpenQuestion;
import com.archintent.resolver.model.Priority;
import com.archintent.resolver.model.QuestionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.archintent.resolver.TestOntologies.ANALYTICS;
import static com.archintent.resolver.TestOntologies.CUSTOMER;
import static com.archintent.resolver.TestOntologies.INTEGRATION;
import static com.archintent.resolver.TestOntologies.ORDERS;
import static org.assertj.core.api.Assertions.assertThat;

class ComponentResolverServiceTest {

    private ComponentResolverService resolverService;
    private ComponentCatalog catalog;

    @BeforeEach
    void setUp() {
        resolverService = new ComponentResolverService(TestOntologies.standard());
        catalog = TestOntologies.catalog();
    }

    @Test
    void highConfidenceDomainSelectsEveryComponentWithoutQuestions() {
        ImpactRecord record = record(ORDERS, ImpactType.CORE_CHANGE, Confidence.HIGH, false, "order");

        List<ComponentHypothesis> hypotheses = resolverService.resolve(record, catalog);

        assertThat(hypotheses).extracting(ComponentHypothesis::componentName)
                .containsExactly("order-service", "fulfillment-service");
        assertThat(hypotheses).allSatisfy(h -> {
            assertThat(h.changeKind()).isEqualTo(ImpactType.CORE_CHANGE);
            assertThat(h.openQuestions()).isEmpty();
            assertThat(h.speculative()).isFalse();
            assertThat(h.probableChanges()).containsExactly("update core logic for 'order'");
        });
    }

    @Test
    void mediumConfidenceCarriesOwnershipQuestionWithMatchingPriority() {
        ImpactRecord record = record(INTEGRATION, ImpactType.SIDE_EFFECT, Confidence.MEDIUM, false, "email");

        ComponentHypothesis hypothesis = resolverService.resolve(record, catalog).get(0);

        assertThat(hypothesis.openQuestions()).singleElement().satisfies(q -> {
            assertThat(q.kind()).isEqualTo(QuestionKind.OWNERSHIP_CONFIRMATION);
            assertThat(q.priority()).isEqualTo(Priority.MEDIUM);
            assertThat(q.id()).isEqualTo("ownership:" + INTEGRATION + ":notification-service");
            assertThat(q.options()).containsExactly("yes", "no");
        });
        assertThat(hypothesis.probableChanges())
                .containsExactly("emit side effect for 'email'", "publish event NotificationSent");
    }

    @Test
    void lowConfidenceQuestionIsLowPriority() {
        ImpactRecord record = record(ORDERS, ImpactType.DEPENDENCY, Confidence.LOW, false, "order");

        List<ComponentHypothesis> hypotheses = resolverService.resolve(record, catalog);

        assertThat(hypotheses).flatExtracting(ComponentHypothesis::openQuestions)
                .extracting(OpenQuestion::priority)
                .containsOnly(Priority.LOW);
    }

    @Test
    void tiedRecordLeavesOwnershipToTheTieQuestion() {
        ImpactRecord record = record(CUSTOMER, ImpactType.CORE_CHANGE, Confidence.HIGH, true, "customer");

        List<ComponentHypothesis> hypotheses = resolverService.resolve(record, catalog);

        assertThat(hypotheses).isNotEmpty()
                .allSatisfy(h -> assertThat(h.openQuestions()).isEmpty());
    }

    @Test
    void domainWithoutComponentsYieldsSpeculativePlaceholder() {
        ImpactRecord record = record(ANALYTICS, ImpactType.POSSIBLE, Confidence.MEDIUM, false, "report");

        List<ComponentHypothesis> hypotheses = resolverService.resolve(record, catalog);

        assertThat(hypotheses).singleElement().satisfies(h -> {
            assertThat(h.speculative()).isTrue();
            assertThat(h.componentName()).isEqualTo(ComponentResolverService.placeholderName(ANALYTICS));
            assertThat(h.openQuestions()).singleElement().satisfies(q -> {
                assertThat(q.priority()).isEqualTo(Priority.HIGH);
                assertThat(q.kind()).isEqualTo(QuestionKind.OWNER_ASSIGNMENT);
                assertThat(q.prompt()).contains(ANALYTICS).contains("reports and metrics");
            });
        });
    }

    @Test
    void emptyCatalogNeverDropsAnImpactedDomain() {
        ImpactRecord record = record(ORDERS, ImpactType.CORE_CHANGE, Confidence.HIGH, false, "order");

        assertThat(resolverService.resolve(record, ComponentCatalog.empty()))
                .singleElement()
                .extracting(ComponentHypothesis::speculative)
                .isEqualTo(true);
    }

    static ImpactRecord record(String domain, ImpactType type, Confidence confidence, boolean ambiguous, String trigger) {
        return new ImpactRecord(domain, type, confidence, List.of(trigger), "test", 5, ambiguous, false);
    }
}
