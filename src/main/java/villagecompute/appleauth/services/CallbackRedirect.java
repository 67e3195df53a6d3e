/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.net.URI;

/**
 * Instruction to answer the provider's POST callback with a redirect to the rebuilt GET callback.
 *
 * @param location
 *            canonical callback URL carrying {@code code}, {@code state} and {@code user}
 * @param skipSessionCookie
 *            {@code true} when the response must not issue or refresh a session cookie
 */
public record CallbackRedirect(URI location, boolean skipSessionCookie) {
}
