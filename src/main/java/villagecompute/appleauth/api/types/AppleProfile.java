/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.types;

import java.util.LinkedHashMap;
import java.util.Map;

import villagecompute.appleauth.util.MapPruner;

/**
 * Normalized user profile built from verified claims and the optional one-time name payload.
 *
 * @param sub
 *            Apple user id
 * @param email
 *            email claim, may be {@code null}
 * @param firstName
 *            first name from the user payload, may be {@code null}
 * @param lastName
 *            last name from the user payload, may be {@code null}
 * @param name
 *            "first last" when any name part exists, otherwise the email
 * @param emailVerified
 *            coerced {@code email_verified}
 * @param isPrivateEmail
 *            coerced {@code is_private_email}
 */
public record AppleProfile(String sub, String email, String firstName, String lastName, String name,
        boolean emailVerified, boolean isPrivateEmail) {

    /**
     * Wire form of the profile with absent fields removed.
     *
     * @return pruned map with snake_case keys
     */
    public Map<String, Object> toInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("sub", sub);
        info.put("email", email);
        info.put("first_name", firstName);
        info.put("last_name", lastName);
        info.put("name", name);
        info.put("email_verified", emailVerified);
        info.put("is_private_email", isPrivateEmail);
        return MapPruner.prune(info);
    }
}
