/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

/**
 * Process-local session storage for the authorization round trip.
 *
 * <p>
 * Sessions only need to live between the authorize redirect and the resumed GET callback, so they expire after
 * {@link #TTL} of inactivity. Expired entries are dropped on lookup and swept whenever a new session is created.
 */
@ApplicationScoped
public class SessionStore {

    private static final Logger LOG = Logger.getLogger(SessionStore.class);

    public static final String COOKIE_NAME = "appleauth_session";

    public static final Duration TTL = Duration.ofMinutes(10);

    @Inject
    Clock clock;

    private final Map<String, InMemorySession> sessions = new ConcurrentHashMap<>();

    /**
     * Returns the live session for the id, or a new one when the id is absent, unknown or expired.
     *
     * @param sessionId
     *            session cookie value, may be {@code null}
     * @return a live session with its expiry pushed back
     */
    public InMemorySession open(String sessionId) {
        Instant now = Instant.now(clock);
        if (sessionId != null) {
            Optional<InMemorySession> existing = find(sessionId);
            if (existing.isPresent()) {
                existing.get().extendUntil(now.plus(TTL));
                return existing.get();
            }
        }
        evictExpired();
        InMemorySession session = new InMemorySession(UUID.randomUUID().toString(), now.plus(TTL));
        sessions.put(session.id(), session);
        LOG.debugf("Created auth session %s", session.id());
        return session;
    }

    public Optional<InMemorySession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        InMemorySession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        if (session.isExpired(Instant.now(clock))) {
            sessions.remove(sessionId, session);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public void invalidate(String sessionId) {
        if (sessionId != null) {
            sessions.remove(sessionId);
        }
    }

    /**
     * @return number of sessions removed
     */
    public int evictExpired() {
        Instant now = Instant.now(clock);
        int before = sessions.size();
        sessions.values().removeIf(session -> session.isExpired(now));
        return before - sessions.size();
    }

    int size() {
        return sessions.size();
    }
}
