/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.util.Map;

/**
 * Structurally decoded identity token whose signature has not been checked yet.
 *
 * <p>
 * Package-private on purpose: only {@link IdTokenVerifier} handles unverified tokens, callers only ever receive
 * {@link villagecompute.appleauth.api.types.IdTokenClaims}.
 */
record DecodedIdToken(String raw, String kid, String sub, String iss, String aud, long iat, long exp,
        Map<String, Object> header, Map<String, Object> payload) {
}
