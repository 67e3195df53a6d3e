/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Session} held by {@link SessionStore}, identified by the value of the session cookie.
 */
public final class InMemorySession implements Session {

    private final String id;
    private final Map<String, String> values = new ConcurrentHashMap<>();
    private volatile Instant expiresAt;

    InMemorySession(String id, Instant expiresAt) {
        this.id = id;
        this.expiresAt = expiresAt;
    }

    /**
     * A session that is never registered with the store, for requests that must not create one (the form POST leg of
     * the callback).
     */
    public static InMemorySession detached() {
        return new InMemorySession("detached", Instant.MAX);
    }

    public String id() {
        return id;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public Optional<String> delete(String key) {
        return Optional.ofNullable(values.remove(key));
    }

    boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }

    void extendUntil(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
