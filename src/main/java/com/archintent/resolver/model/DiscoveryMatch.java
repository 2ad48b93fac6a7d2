package com.archintent.resolver.model;

public record DiscoveryMatch(ComponentDescriptor component, int matchScore) {
}
