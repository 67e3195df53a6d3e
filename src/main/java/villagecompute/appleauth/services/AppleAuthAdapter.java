/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.appleauth.api.types.AppleAuthResult;
import villagecompute.appleauth.api.types.AppleTokenResponseType;
import villagecompute.appleauth.api.types.IdTokenClaims;
import villagecompute.appleauth.config.AdapterConfig;
import villagecompute.appleauth.exceptions.AppleAuthException;
import villagecompute.appleauth.exceptions.IdTokenClaimException;
import villagecompute.appleauth.exceptions.IdTokenFormatException;
import villagecompute.appleauth.exceptions.InvalidCallbackException;
import villagecompute.appleauth.exceptions.StateMismatchException;
import villagecompute.appleauth.integration.oauth.OAuth2Client;
import villagecompute.appleauth.observability.AppleAuthMetrics;

/**
 * Sign in with Apple orchestration.
 *
 * <p>
 * <b>Authorization leg:</b> {@link #buildAuthorizationRequest} merges provider defaults, caller overrides, a CSRF
 * {@code state} and (unless nonces are ignored) a fresh nonce into the authorize parameters.
 *
 * <p>
 * <b>Callback leg:</b> {@link #handleCallback} first lets {@link CallbackNormalizer} turn Apple's form POST into a
 * redirect. On the resumed GET it checks {@code state}, exchanges the code with a freshly minted client secret,
 * verifies the identity token and assembles the profile. Any failure is fatal to the callback; no partial profile is
 * returned.
 */
@ApplicationScoped
public class AppleAuthAdapter {

    private static final Logger LOG = Logger.getLogger(AppleAuthAdapter.class);

    public static final String STATE_SESSION_KEY = "appleauth.state";

    @Inject
    AdapterConfig config;

    @Inject
    NonceManager nonceManager;

    @Inject
    ClientSecretIssuer clientSecretIssuer;

    @Inject
    IdTokenVerifier idTokenVerifier;

    @Inject
    CallbackNormalizer callbackNormalizer;

    @Inject
    ProfileAssembler profileAssembler;

    @Inject
    OAuth2Client oauth2Client;

    @Inject
    AppleAuthMetrics metrics;

    /**
     * Builds the query parameters for Apple's authorize endpoint.
     *
     * <p>
     * Order of precedence: {@code response_mode} and {@code scope} defaults, then caller parameters. A caller-supplied
     * {@code state} is kept; otherwise one is generated. The state is always stored in the session. A nonce is added
     * last and overrides any caller value.
     *
     * @param context
     *            current request
     * @param callerParams
     *            additional or overriding authorize parameters
     * @return ordered authorize parameters
     */
    public Map<String, String> buildAuthorizationRequest(RequestContext context, Map<String, String> callerParams) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_mode", config.responseMode());
        params.put("scope", config.scope());
        if (callerParams != null) {
            callerParams.forEach((name, value) -> {
                if (value != null && !value.isEmpty()) {
                    params.put(name, value);
                }
            });
        }

        String state = params.computeIfAbsent("state", ignored -> NonceManager.generate());
        context.session().set(STATE_SESSION_KEY, state);

        nonceManager.issue(context).ifPresent(nonce -> params.put("nonce", nonce));
        return params;
    }

    /**
     * Full authorize URL including {@code client_id}, {@code redirect_uri} and {@code response_type}.
     */
    public URI authorizationUrl(RequestContext context, Map<String, String> callerParams) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", config.clientId());
        params.put("redirect_uri", callbackNormalizer.callbackUrl(context));
        params.put("response_type", "code");
        params.putAll(buildAuthorizationRequest(context, callerParams));

        URI url = oauth2Client.buildAuthorizeUrl(params);
        LOG.infof("Generated Apple authorization URL: clientId=%s, nonce=%s", config.clientId(),
                params.containsKey("nonce"));
        return url;
    }

    /**
     * Handles both legs of the callback.
     *
     * @param context
     *            callback request
     * @return a redirect for the POST leg, the authenticated result for the GET leg
     * @throws AppleAuthException
     *             on any verification or exchange failure
     */
    public CallbackOutcome handleCallback(RequestContext context) {
        Optional<CallbackRedirect> redirect = callbackNormalizer.normalize(context);
        if (redirect.isPresent()) {
            metrics.recordCallbackRedirect();
            LOG.debugf("Normalized Apple form_post callback to %s", redirect.get().location().getPath());
            return CallbackOutcome.redirect(redirect.get());
        }

        try {
            AppleAuthResult result = authenticate(context);
            metrics.recordCallbackSuccess();
            LOG.infof("Apple sign-in succeeded: sub=%s", result.uid());
            return CallbackOutcome.authenticated(result);
        } catch (AppleAuthException e) {
            metrics.recordCallbackFailure(e.kind());
            LOG.warnf("SECURITY: Apple sign-in failed: kind=%s, message=%s", e.kind().code(), e.getMessage());
            throw e;
        }
    }

    private AppleAuthResult authenticate(RequestContext context) {
        Optional<String> providerError = context.param("error");
        if (providerError.isPresent()) {
            throw new InvalidCallbackException("Apple returned error: " + providerError.get());
        }
        String code = context.param("code")
                .orElseThrow(() -> new InvalidCallbackException("Callback is missing the authorization code"));
        checkState(context);

        Optional<String> requestToken = context.param("id_token");
        IdTokenClaims claims = requestToken.map(raw -> idTokenVerifier.verify(raw, context)).orElse(null);

        String clientId = effectiveClientId(claims);
        AppleTokenResponseType tokenResponse = oauth2Client.exchangeCode(code, callbackNormalizer.callbackUrl(context),
                clientId, clientSecretIssuer.issue());

        String rawToken = requestToken.orElseGet(() -> tokenResponse == null ? null : tokenResponse.idToken());
        if (rawToken == null || rawToken.isEmpty()) {
            throw new IdTokenFormatException("No id_token in callback or token response");
        }
        if (claims == null) {
            claims = idTokenVerifier.verify(rawToken, context);
        }
        return profileAssembler.assemble(claims, context, rawToken);
    }

    /**
     * Client id presented to the token endpoint: the configured id before any identity token is known, otherwise the
     * token's own audience, which must be one of the accepted audiences.
     */
    String effectiveClientId(IdTokenClaims claims) {
        if (claims == null) {
            return config.clientId();
        }
        if (!config.acceptedAudiences().contains(claims.aud())) {
            throw new IdTokenClaimException("aud", "audience " + claims.aud() + " is not an authorized client id");
        }
        return claims.aud();
    }

    private void checkState(RequestContext context) {
        if (config.providerIgnoresState()) {
            return;
        }
        Optional<String> expected = context.session().delete(STATE_SESSION_KEY);
        Optional<String> actual = context.param("state");
        if (expected.isEmpty() || actual.isEmpty() || !constantTimeEquals(expected.get(), actual.get())) {
            throw new StateMismatchException("state parameter does not match the session");
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
