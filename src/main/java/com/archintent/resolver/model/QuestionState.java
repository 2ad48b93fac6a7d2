package com.archintent.resolver.model;

public enum QuestionState {
    OPEN,
    ANSWERED
}
