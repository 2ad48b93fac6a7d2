package com.archintent.resolver.model;

/**
 * Kind of change a domain or component must undergo.
 */
public enum ImpactType {
    CORE_CHANGE("core change"),
    UI_CHANGE("UI change"),
    API_CHANGE("API change"),
    SIDE_EFFECT("side effect"),
    DEPENDENCY("dependency"),
    POSSIBLE("possible impact");

    private final String label;

    ImpactType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
