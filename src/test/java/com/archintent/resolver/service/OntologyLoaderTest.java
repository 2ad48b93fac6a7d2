package com.archintent.resolver.service;

import com.archintent.resolver.dto.ComponentDocument;
import com.archintent.resolver.dto.DomainDocument;
import com.archintent.resolver.dto.OntologyDocument;
import com.archintent.resolver.model.ActionCategory;
import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.ComponentDescriptor;
import com.archintent.resolver.model.ComponentType;
import com.archintent.resolver.model.DomainRole;
import com.archintent.resolver.model.Ontology;
import com.archintent.resolver.model.ScoringPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OntologyLoaderTest {

    private OntologyLoader ontologyLoader;

    @BeforeEach
    void setUp() {
        ontologyLoader = new OntologyLoader(new ObjectMapper(), new DefaultResourceLoader(), ScoringPolicy.defaults());
    }

    @Test
    void loadsBundledOntologyAndCatalog() {
        Ontology ontology = ontologyLoader.loadOntology("classpath:ontology/default-ontology.json");
        ComponentCatalog catalog = ontologyLoader.loadCatalog("classpath:catalog/default-catalog.json", ontology);

        assertThat(ontology.version()).isEqualTo("2024.1");
        assertThat(ontology.domainWithRole(DomainRole.FRONTEND).orElseThrow().name()).isEqualTo("Frontend Experience");
        assertThat(ontology.ownerOf("support ticket")).contains("Customer & Identity");
        assertThat(ontology.lexicon().categoryOf("notify")).isEqualTo(ActionCategory.COMMUNICATION);
        assertThat(ontology.domain("billing").orElseThrow().triggerWeight("tax")).isEqualTo(3);
        assertThat(catalog.find("agent-dashboard").orElseThrow().type()).isEqualTo(ComponentType.FRONTEND_APP);
        assertThat(catalog.inDomain("Order Management")).extracting(ComponentDescriptor::name)
                .containsExactly("order-service", "fulfillment-service");
    }

    @Test
    void entityOwnedByTwoDomainsFailsValidation() {
        assertThatThrownBy(() -> ontologyLoader.loadOntology("classpath:fixtures/duplicate-entity-ontology.json"))
                .isInstanceOf(OntologyValidationException.class)
                .hasMessageContaining("'order' owned by both");
    }

    @Test
    void catalogEntryWithUnknownDomainFailsValidation() {
        Ontology ontology = ontologyLoader.loadOntology("classpath:ontology/default-ontology.json");

        assertThatThrownBy(() -> ontologyLoader.loadCatalog("classpath:fixtures/unknown-domain-catalog.json", ontology))
                .isInstanceOf(OntologyValidationException.class)
                .hasMessageContaining("unknown domain 'Weather'");
    }

    @Test
    void missingResourceFailsValidation() {
        assertThatThrownBy(() -> ontologyLoader.loadOntology("classpath:fixtures/absent.json"))
                .isInstanceOf(OntologyValidationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void secondFrontendDomainIsRejected() {
        OntologyDocument document = new OntologyDocument();
        document.setDomains(List.of(domain("Web", "FRONTEND"), domain("Mobile", "frontend")));

        assertThatThrownBy(() -> ontologyLoader.toOntology(document, "inline"))
                .isInstanceOf(OntologyValidationException.class)
                .hasMessageContaining("FRONTEND");
    }

    @Test
    void nonPositiveTriggerWeightIsRejected() {
        DomainDocument domain = domain("Billing", null);
        Map<String, Integer> triggers = new LinkedHashMap<>();
        triggers.put("charge", 0);
        domain.setTriggers(triggers);
        OntologyDocument document = new OntologyDocument();
        document.setDomains(List.of(domain));

        assertThatThrownBy(() -> ontologyLoader.toOntology(document, "inline"))
                .isInstanceOf(OntologyValidationException.class)
                .hasMessageContaining("positive weight");
    }

    @Test
    void emptyOntologyIsRejected() {
        assertThatThrownBy(() -> ontologyLoader.toOntology(new OntologyDocument(), "inline"))
                .isInstanceOf(OntologyValidationException.class);
    }

    @Test
    void phrasesAreNormalized() {
        DomainDocument domain = domain("Customer & Identity", null);
        domain.setEntities(List.of("  Support   Ticket "));
        OntologyDocument document = new OntologyDocument();
        document.setDomains(List.of(domain));

        Ontology ontology = ontologyLoader.toOntology(document, "inline");

        assertThat(ontology.ownerOf("support ticket")).contains("Customer & Identity");
        assertThat(ontology.domain("Customer & Identity").orElseThrow().role()).isEqualTo(DomainRole.CORE);
    }

    @Test
    void descriptorTakesCanonicalDomainSpelling() {
        Ontology ontology = ontologyLoader.loadOntology("classpath:ontology/default-ontology.json");
        ComponentDocument document = new ComponentDocument();
        document.setName(" tax-engine ");
        document.setDomain("BILLING");
        document.setType("shared_library");

        ComponentDescriptor descriptor = ontologyLoader.toDescriptor(document, ontology, "inline");

        assertThat(descriptor.name()).isEqualTo("tax-engine");
        assertThat(descriptor.domain()).isEqualTo("Billing");
        assertThat(descriptor.type()).isEqualTo(ComponentType.SHARED_LIBRARY);
        assertThat(descriptor.speculative()).isFalse();
    }

    @Test
    void unknownComponentTypeIsRejected() {
        Ontology ontology = ontologyLoader.loadOntology("classpath:ontology/default-ontology.json");
        ComponentDocument document = new ComponentDocument();
        document.setName("mystery");
        document.setDomain("Billing");
        document.setType("mainframe");

        assertThatThrownBy(() -> ontologyLoader.toDescriptor(document, ontology, "inline"))
                .isInstanceOf(OntologyValidationException.class)
                .hasMessageContaining("mainframe");
    }

    private static DomainDocument domain(String name, String role) {
        DomainDocument domain = new DomainDocument();
        domain.setName(name);
        domain.setRole(role);
        return domain;
    }
}
