package com.archintent.resolver.config;

import com.archintent.resolver.model.ComponentCatalog;
import com.archintent.resolver.model.Ontology;
import com.archintent.resolver.service.OntologyLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OntologyConfiguration {

    @Value("${app.ontology.path:classpath:ontology/default-ontology.json}")
    private String ontologyPath;

    @Value("${app.catalog.path:classpath:catalog/default-catalog.json}")
    private String catalogPath;

    @Bean
    public Ontology ontology(OntologyLoader ontologyLoader) {
        return ontologyLoader.loadOntology(ontologyPath);
    }

    @Bean
    public ComponentCatalog initialComponentCatalog(OntologyLoader ontologyLoader, Ontology ontology) {
        return ontologyLoader.loadCatalog(catalogPath, ontology);
    }
}
