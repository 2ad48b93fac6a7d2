package com.archintent.resolver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ComponentType {
    BACKEND_SERVICE("backend-service"),
    FRONTEND_APP("frontend-app"),
    SHARED_LIBRARY("shared-library"),
    INTEGRATION("integration");

    private final String label;

    ComponentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Parses the catalog label ("backend-service") or the constant name ("BACKEND_SERVICE").
     */
    @JsonCreator
    public static ComponentType fromLabel(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ComponentType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown component type: " + value);
    }
}
