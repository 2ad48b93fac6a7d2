package com.archintent.resolver.model;

public record PendingQuestion(OpenQuestion question, String status) {

    public static final String NON_BLOCKING = "unresolved, non-blocking";
    public static final String BLOCKING = "unresolved, blocking";

    public static PendingQuestion of(OpenQuestion question) {
        return new PendingQuestion(question, question.priority().isBlocking() ? BLOCKING : NON_BLOCKING);
    }
}
