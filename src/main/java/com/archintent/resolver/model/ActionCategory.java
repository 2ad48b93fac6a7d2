package com.archintent.resolver.model;

public enum ActionCategory {
    COMMUNICATION,   // notify, publish, broadcast, escalate
    PRESENTATION,    // show, display, render
    MUTATION,
    QUERY
}
