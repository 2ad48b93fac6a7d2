package com.archintent.resolver.model;

public enum Priority {
    HIGH(0),
    MEDIUM(1),
    LOW(2);

    private final int order;

    Priority(int order) {
        this.order = order;
    }

    /**
     * Lower values are dispatched first.
     */
    public int order() {
        return order;
    }

    /**
     * HIGH and MEDIUM questions must be answered before a session can resolve.
     */
    public boolean isBlocking() {
        return this != LOW;
    }

    public static Priority of(Confidence confidence) {
        switch (confidence) {
            case HIGH:
                return HIGH;
            case MEDIUM:
                return MEDIUM;
            default:
                return LOW;
        }
    }
}
