package com.archintent.resolver.model;

public enum EdgeKind {
    EVENT,
    API_CALL
}
