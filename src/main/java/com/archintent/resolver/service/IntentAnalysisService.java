package com.archintent.resolver.service;

import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.ComponentHypothesis;
import com.archintent.resolver.model.Hypothesis;
import com.archintent.resolver.model.ImpactRecord;
import com.archintent.resolver.model.Ontology;
import com.archintent.resolver.model.Tag;
import com.archintent.resolver.repository.ComponentCatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Runs tag -> score -> resolve synchronously and hands the result to a new refinement session.
 */
@Service
public class IntentAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(IntentAnalysisService.class);

    private final Ontology ontology;
    private final TaggerService taggerService;
    private final DomainScorerService domainScorerService;
    private final ComponentResolverService componentResolverService;
    private final ComponentCatalogRepository catalogRepository;
    private final DiscoveryBackend discoveryBackend;
    private final HypothesisAssemblerService assemblerService;

    public IntentAnalysisService(Ontology ontology,
                                 TaggerService taggerService,
                                 DomainScorerService domainScorerService,
                                 ComponentResolverService componentResolverService,
                                 ComponentCatalogRepository catalogRepository,
                                 DiscoveryBackend discoveryBackend,
                                 HypothesisAssemblerService assemblerService) {
        this.ontology = ontology;
        this.taggerService = taggerService;
        this.domainScorerService = domainScorerService;
        this.componentResolverService = componentResolverService;
        this.catalogRepository = catalogRepository;
        this.discoveryBackend = discoveryBackend;
        this.assemblerService = assemblerService;
    }

    public RefinementSession startSession(String text) {
        List<Tag> tags = taggerService.tag(text);
        Set<ImpactRecord> records = domainScorerService.score(tags);
        ComponentCatalog catalog = catalogRepository.snapshot();

        List<ComponentHypothesis> hypotheses = new ArrayList<>();
        for (ImpactRecord record : records) {
            hypotheses.addAll(componentResolverService.resolve(record, catalog));
        }
        if (records.isEmpty()) {
            logger.info("No business domain matched request ({} tag(s))", tags.size());
        }
        return new RefinementSession(UUID.randomUUID(), text, ontology.version(), catalog,
                records, hypotheses, discoveryBackend, componentResolverService);
    }

    /**
     * One-shot analysis without refinement: open questions are reported in the hypothesis.
     */
    public Hypothesis analyze(String text) {
        return assemblerService.assemble(startSession(text));
    }
}
