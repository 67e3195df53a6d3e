/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.util.Map;
import java.util.Optional;

/**
 * The parts of an incoming HTTP request the adapter reads.
 *
 * <p>
 * Keeps the core independent from JAX-RS so every component can be tested with a plain map and an in-memory session.
 */
public interface RequestContext {

    /**
     * @return merged query and form parameters, first value per name
     */
    Map<String, String> params();

    /**
     * @return HTTP method in upper case ({@code GET}, {@code POST})
     */
    String method();

    Session session();

    /**
     * @return callback URL of this deployment derived from the request (scheme, host, port, callback path)
     */
    String defaultCallbackUrl();

    default Optional<String> param(String name) {
        String value = params().get(name);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    default boolean isPost() {
        return "POST".equalsIgnoreCase(method());
    }
}
