/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.util.Optional;

/**
 * Key-value session storage scoped to one browser session.
 */
public interface Session {

    Optional<String> get(String key);

    void set(String key, String value);

    /**
     * Removes the key and returns the value it held.
     *
     * @param key
     *            session key
     * @return previous value, empty if none
     */
    Optional<String> delete(String key);
}
