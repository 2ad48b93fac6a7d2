package com.archintent.resolver.model;

/**
 * Directed edge from the producing component to the consuming one: an event publisher to an event
 * consumer, or an API provider to the component that calls it.
 */
public record DependencyEdge(String from, String to, EdgeKind kind, String via) {
}
