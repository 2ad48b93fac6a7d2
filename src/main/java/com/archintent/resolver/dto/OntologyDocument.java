package com.archintent.resolver.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of the ontology configuration file.
 */
@Data
public class OntologyDocument {
    private String version;
    private List<DomainDocument> domains = new ArrayList<>();
    private LexiconDocument lexicon = new LexiconDocument();
}
