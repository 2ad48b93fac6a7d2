package com.archintent.resolver.service;

public class UnknownQuestionException extends RuntimeException {

    public UnknownQuestionException(String questionId) {
        super("Unknown question id: " + questionId);
    }
}
