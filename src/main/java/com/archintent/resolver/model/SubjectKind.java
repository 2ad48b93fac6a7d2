package com.archintent.resolver.model;

public enum SubjectKind {
    DOMAIN,
    COMPONENT
}
