/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.appleauth.api.types.AppleAuthResult;
import villagecompute.appleauth.api.types.AppleProfile;
import villagecompute.appleauth.api.types.IdTokenClaims;
import villagecompute.appleauth.api.types.UserInfoPayload;
import villagecompute.appleauth.util.MapPruner;

/**
 * Builds the normalized profile and the raw payload from verified claims and the one-time {@code user} field.
 *
 * <p>
 * Apple only sends the user's name on the first authorization, as a JSON form field outside the signed token. That
 * field is treated as best-effort data: when it is absent or not valid JSON the profile simply has no name parts and
 * the callback still succeeds.
 */
@ApplicationScoped
public class ProfileAssembler {

    private static final Logger LOG = Logger.getLogger(ProfileAssembler.class);

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    @Inject
    ObjectMapper objectMapper;

    /**
     * @param claims
     *            verified identity token claims
     * @param context
     *            callback request, read for the {@code user} parameter
     * @param rawIdToken
     *            the token string exactly as received
     * @return profile, claims and pruned raw payload
     */
    public AppleAuthResult assemble(IdTokenClaims claims, RequestContext context, String rawIdToken) {
        UserInfoPayload userInfo = parseUserInfo(context.param("user"));
        String email = claims.email().orElse(null);
        String firstName = userInfo.firstName().orElse(null);
        String lastName = userInfo.lastName().orElse(null);

        AppleProfile profile = new AppleProfile(claims.sub(), email, firstName, lastName,
                displayName(userInfo, email), claims.emailVerified(), claims.isPrivateEmail());

        Map<String, Object> rawInfo = new LinkedHashMap<>();
        rawInfo.put("id_info", claims.raw());
        rawInfo.put("user_info", userInfo.raw());
        rawInfo.put("id_token", rawIdToken);
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("raw_info", rawInfo);

        return new AppleAuthResult(claims.sub(), profile, claims, MapPruner.prune(extra));
    }

    /**
     * Parses the {@code user} JSON. Never fails: unparsable input yields an empty payload.
     *
     * @param user
     *            raw parameter value
     * @return parsed payload, {@link UserInfoPayload#empty()} when absent or invalid
     */
    UserInfoPayload parseUserInfo(Optional<String> user) {
        if (user.isEmpty()) {
            return UserInfoPayload.empty();
        }
        Map<String, Object> raw;
        try {
            raw = objectMapper.readValue(user.get(), JSON_OBJECT);
        } catch (JsonProcessingException e) {
            LOG.debugf("Ignoring unparsable Apple user payload: %s", e.getOriginalMessage());
            return UserInfoPayload.empty();
        }
        if (raw == null) {
            return UserInfoPayload.empty();
        }

        Optional<String> firstName = Optional.empty();
        Optional<String> lastName = Optional.empty();
        if (raw.get("name") instanceof Map<?, ?> name) {
            firstName = nonEmpty(name.get("firstName"));
            lastName = nonEmpty(name.get("lastName"));
        }
        return new UserInfoPayload(firstName, lastName, raw);
    }

    static String displayName(UserInfoPayload userInfo, String email) {
        if (!userInfo.hasName()) {
            return email;
        }
        StringJoiner name = new StringJoiner(" ");
        userInfo.firstName().ifPresent(name::add);
        userInfo.lastName().ifPresent(name::add);
        return name.toString();
    }

    private static Optional<String> nonEmpty(Object value) {
        return value instanceof String text && !text.isEmpty() ? Optional.of(text) : Optional.empty();
    }
}
