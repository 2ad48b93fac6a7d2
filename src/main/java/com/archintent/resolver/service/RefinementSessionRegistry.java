package com.archintent.resolver.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory home of sessions driven over HTTP. Sessions stay until abandoned; an idle session
 * waiting for an answer is kept indefinitely.
 */
@Service
public class RefinementSessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RefinementSessionRegistry.class);

    private final ConcurrentHashMap<UUID, RefinementSession> sessions = new ConcurrentHashMap<>();

    public RefinementSession register(RefinementSession session) {
        sessions.put(session.id(), session);
        logger.info("Tracking refinement session {} ({} active).", session.id(), sessions.size());
        return session;
    }

    public RefinementSession get(UUID id) {
        RefinementSession session = id == null ? null : sessions.get(id);
        if (session == null) {
            throw new UnknownSessionException(id);
        }
        return session;
    }

    /**
     * Discards a session. It holds no external resources, so nothing else needs releasing.
     */
    public void abandon(UUID id) {
        RefinementSession removed = id == null ? null : sessions.remove(id);
        if (removed == null) {
            throw new UnknownSessionException(id);
        }
        logger.info("Refinement session {} abandoned in state {}.", id, removed.state());
    }

    public int size() {
        return sessions.size();
    }
}
