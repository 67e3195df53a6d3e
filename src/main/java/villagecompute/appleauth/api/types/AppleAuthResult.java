/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.types;

import java.util.Map;

/**
 * Outcome of a fully verified Sign in with Apple callback.
 *
 * @param uid
 *            stable user id ({@code sub})
 * @param profile
 *            normalized profile
 * @param claims
 *            verified identity token claims
 * @param extra
 *            pruned raw payload: {@code {raw_info: {id_info, user_info, id_token}}}
 */
public record AppleAuthResult(String uid, AppleProfile profile, IdTokenClaims claims, Map<String, Object> extra) {

    public AppleAuthResult {
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }
}
