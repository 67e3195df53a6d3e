/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.integration.oauth;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.UriBuilder;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import villagecompute.appleauth.api.types.AppleTokenResponseType;
import villagecompute.appleauth.config.AdapterConfig;
import villagecompute.appleauth.exceptions.TokenExchangeException;

/**
 * {@link OAuth2Client} backed by Apple's authorize endpoint and the {@link AppleOAuthRestClient} token call.
 */
@ApplicationScoped
public class AppleOAuth2Client implements OAuth2Client {

    private static final Logger LOG = Logger.getLogger(AppleOAuth2Client.class);

    static final String GRANT_TYPE = "authorization_code";

    @Inject
    AdapterConfig config;

    @Inject
    @RestClient
    AppleOAuthRestClient restClient;

    /**
     * Values go through template arguments rather than {@code queryParam(name, value)}, so braces supplied by the
     * caller are encoded instead of parsed as URI template variables.
     */
    @Override
    public URI buildAuthorizeUrl(Map<String, String> params) {
        UriBuilder builder = UriBuilder.fromUri(config.authorizeUri());
        List<Object> values = new ArrayList<>();
        params.forEach((name, value) -> {
            if (value != null) {
                builder.queryParam(name, "{p" + values.size() + "}");
                values.add(value);
            }
        });
        return builder.build(values.toArray());
    }

    @Override
    public AppleTokenResponseType exchangeCode(String code, String redirectUri, String clientId,
            String clientSecret) {
        try {
            AppleTokenResponseType response = restClient.exchangeToken(GRANT_TYPE, code, redirectUri, clientId,
                    clientSecret);
            LOG.infof("Exchanged Apple authorization code: clientId=%s, idTokenPresent=%s", clientId,
                    response != null && response.idToken() != null);
            return response;
        } catch (WebApplicationException e) {
            int status = e.getResponse() == null ? -1 : e.getResponse().getStatus();
            LOG.warnf("Apple token endpoint rejected code exchange: status=%d, clientId=%s", status, clientId);
            throw new TokenExchangeException("Apple token endpoint returned HTTP " + status, e);
        } catch (ProcessingException e) {
            LOG.errorf(e, "Apple token endpoint unreachable");
            throw new TokenExchangeException("Apple token endpoint unreachable", e);
        }
    }
}
