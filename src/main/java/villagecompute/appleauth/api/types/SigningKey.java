/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.types;

import java.security.PublicKey;

/**
 * One public key from Apple's published signing-key set.
 *
 * @param kid
 *            key id, matched against the identity token header
 * @param algorithm
 *            JWA algorithm the key is published for (e.g. RS256), may be {@code null}
 * @param publicKey
 *            key material
 */
public record SigningKey(String kid, String algorithm, PublicKey publicKey) {
}
