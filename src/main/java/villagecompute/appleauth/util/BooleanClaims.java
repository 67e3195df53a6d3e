/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.util;

/**
 * Coercion for Apple's boolean claims.
 *
 * <p>
 * Apple encodes {@code email_verified} and {@code is_private_email} either as JSON booleans or
 * as the strings {@code "true"}/{@code "false"}, depending on the endpoint.
 */
public final class BooleanClaims {

    private BooleanClaims() {
        // Utility class, no instantiation
    }

    /**
     * @param value
     *            raw claim value
     * @return {@code true} only for {@link Boolean#TRUE} or the exact string {@code "true"}
     */
    public static boolean coerce(Object value) {
        return Boolean.TRUE.equals(value) || "true".equals(value);
    }
}
