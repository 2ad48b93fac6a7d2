package com.archintent.resolver.service;

/**
 * Raised while loading the ontology or catalog; aborts application startup.
 */
public class OntologyValidationException extends RuntimeException {

    public OntologyValidationException(String message) {
        super(message);
    }

    public OntologyValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
