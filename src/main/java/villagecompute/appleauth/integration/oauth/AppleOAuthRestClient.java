/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.integration.oauth;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import villagecompute.appleauth.api.types.AppleTokenResponseType;

/**
 * REST client for Apple's token endpoint.
 *
 * <p>
 * The base URL is configured as {@code quarkus.rest-client.apple-oauth.url} (default https://appleid.apple.com).
 *
 * <p>
 * See: https://developer.apple.com/documentation/sign_in_with_apple/generate_and_validate_tokens
 */
@RegisterRestClient(
        configKey = "apple-oauth")
@Path("/")
public interface AppleOAuthRestClient {

    /**
     * Exchange authorization code for access token and ID token.
     *
     * <p>
     * The {@code clientSecret} parameter is NOT a static string - it is the ES256 assertion minted by
     * {@code ClientSecretIssuer} for this call.
     *
     * @param grantType
     *            always "authorization_code"
     * @param code
     *            the authorization code from OAuth callback
     * @param redirectUri
     *            the redirect URI used in authorization request (must match exactly)
     * @param clientId
     *            Apple Service ID (e.g., com.villagecompute.signin)
     * @param clientSecret
     *            JWT signed with ES256 using the Apple private key
     * @return token response with access_token, expires_in, refresh_token, id_token
     */
    @POST
    @Path("/auth/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    AppleTokenResponseType exchangeToken(@FormParam("grant_type") String grantType, @FormParam("code") String code,
            @FormParam("redirect_uri") String redirectUri, @FormParam("client_id") String clientId,
            @FormParam("client_secret") String clientSecret);
}
