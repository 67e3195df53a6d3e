/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Apple Sign-In OAuth 2.0 token response.
 *
 * <p>
 * Returned by POST https://appleid.apple.com/auth/token during authorization code exchange. The {@code id_token} is
 * untrusted until it has been through signature and claim verification.
 *
 * @param accessToken
 *            the access token (not used for user info)
 * @param tokenType
 *            token type (always "Bearer")
 * @param expiresIn
 *            token lifetime in seconds (typically 3600)
 * @param refreshToken
 *            refresh token for offline access
 * @param idToken
 *            OpenID Connect ID token (JWT) containing user information
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppleTokenResponseType(@JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType, @JsonProperty("expires_in") Integer expiresIn,
        @JsonProperty("refresh_token") String refreshToken, @JsonProperty("id_token") String idToken) {
}
