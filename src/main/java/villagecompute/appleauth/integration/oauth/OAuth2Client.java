/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.integration.oauth;

import java.net.URI;
import java.util.Map;

import villagecompute.appleauth.api.types.AppleTokenResponseType;
import villagecompute.appleauth.exceptions.TokenExchangeException;

/**
 * Generic OAuth 2.0 authorization-code operations the Apple adapter delegates to.
 */
public interface OAuth2Client {

    /**
     * Builds the provider authorize URL.
     *
     * @param params
     *            query parameters ({@code client_id}, {@code redirect_uri}, {@code state}, {@code nonce}, ...)
     * @return full authorization URL to redirect the user to
     */
    URI buildAuthorizeUrl(Map<String, String> params);

    /**
     * Exchanges an authorization code at the token endpoint, authenticating with client credentials in the request
     * body.
     *
     * @param code
     *            authorization code from the callback
     * @param redirectUri
     *            redirect URI used in the authorization request (must match exactly)
     * @param clientId
     *            client id to present
     * @param clientSecret
     *            client secret to present
     * @return token response
     * @throws TokenExchangeException
     *             if the endpoint cannot be reached or rejects the code
     */
    AppleTokenResponseType exchangeCode(String code, String redirectUri, String clientId, String clientSecret);
}
