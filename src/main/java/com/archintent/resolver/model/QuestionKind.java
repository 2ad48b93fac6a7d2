package com.archintent.resolver.model;

public enum QuestionKind {
    /** Is this candidate component really the owner of the change? Answered yes/no. */
    OWNERSHIP_CONFIRMATION,
    /** Which component owns a domain that has nothing registered in the catalog? */
    OWNER_ASSIGNMENT,
    /** Two or more domains are tied for ownership of the primary entity. */
    AMBIGUOUS_OWNERSHIP,
    EVENT_SCHEMA,
    API_USAGE,
    REPHRASE
}
