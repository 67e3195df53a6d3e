/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Claims of an Apple identity token that passed signature and claim verification.
 *
 * <p>
 * Instances are only created by {@code IdTokenVerifier} after the whole pipeline succeeded; there is no partially
 * verified representation. {@code kid} comes from the JOSE header, everything else from the payload.
 *
 * @param sub
 *            Apple user id (stable per team)
 * @param iss
 *            issuer, always Apple's identity root
 * @param aud
 *            audience the token was issued to (one of the accepted client ids)
 * @param iat
 *            issued-at, epoch seconds
 * @param exp
 *            expiry, epoch seconds
 * @param nonce
 *            nonce echoed by Apple, if any
 * @param nonceSupported
 *            whether the token declares nonce support
 * @param email
 *            user email, possibly a private relay address
 * @param emailVerified
 *            coerced {@code email_verified}
 * @param isPrivateEmail
 *            coerced {@code is_private_email}
 * @param kid
 *            id of the Apple key that signed the token
 * @param raw
 *            every payload claim as decoded, for the raw-info payload
 */
public record IdTokenClaims(String sub, String iss, String aud, long iat, long exp, Optional<String> nonce,
        boolean nonceSupported, Optional<String> email, boolean emailVerified, boolean isPrivateEmail, String kid,
        Map<String, Object> raw) {

    public IdTokenClaims {
        nonce = nonce == null ? Optional.empty() : nonce;
        email = email == null ? Optional.empty() : email;
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }
}
