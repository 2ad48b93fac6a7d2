package com.archintent.resolver.model;

public enum TagKind {
    ENTITY,
    ACTION,
    QUALIFIER
}
