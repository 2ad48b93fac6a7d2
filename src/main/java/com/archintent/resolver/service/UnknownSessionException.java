package com.archintent.resolver.service;

import java.util.UUID;

public class UnknownSessionException extends RuntimeException {

    public UnknownSessionException(UUID sessionId) {
        super("Unknown refinement session: " + sessionId);
    }
}
