/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One-time name payload Apple posts as the {@code user} form field on a user's first authorization.
 *
 * <p>
 * Shape on the wire: {@code {"name":{"firstName":"Ada","lastName":"Lovelace"},"email":"..."}}. Absent on every later
 * sign-in, so callers that need the name must store it the first time they see it.
 *
 * @param firstName
 *            given name, if supplied
 * @param lastName
 *            family name, if supplied
 * @param raw
 *            the parsed JSON object as-is
 */
public record UserInfoPayload(Optional<String> firstName, Optional<String> lastName, Map<String, Object> raw) {

    public UserInfoPayload {
        firstName = firstName == null ? Optional.empty() : firstName;
        lastName = lastName == null ? Optional.empty() : lastName;
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    public static UserInfoPayload empty() {
        return new UserInfoPayload(Optional.empty(), Optional.empty(), Map.of());
    }

    public boolean hasName() {
        return firstName.isPresent() || lastName.isPresent();
    }
}
