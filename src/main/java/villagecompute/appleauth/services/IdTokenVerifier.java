/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import villagecompute.appleauth.api.types.IdTokenClaims;
import villagecompute.appleauth.api.types.SigningKey;
import villagecompute.appleauth.config.AdapterConfig;
import villagecompute.appleauth.config.NonceMode;
import villagecompute.appleauth.exceptions.ConfigurationException;
import villagecompute.appleauth.exceptions.IdTokenClaimException;
import villagecompute.appleauth.exceptions.IdTokenFormatException;
import villagecompute.appleauth.exceptions.IdTokenSignatureException;
import villagecompute.appleauth.exceptions.KeyFetchException;
import villagecompute.appleauth.util.BooleanClaims;

/**
 * Verifies Apple identity tokens end to end.
 *
 * <p>
 * Pipeline, in this order:
 * <ol>
 * <li><b>Decode</b> - split the compact JWS and read header and payload without trusting them. Missing or mistyped
 * required fields fail with {@link IdTokenFormatException}.</li>
 * <li><b>Key resolution</b> - look up the header {@code kid} in {@link SigningKeyStore}
 * ({@link KeyFetchException}).</li>
 * <li><b>Signature</b> - verify the JWS against that key ({@link IdTokenSignatureException}).</li>
 * <li><b>Claims</b> - {@code iss}, {@code aud}, {@code iat}, {@code exp}, then {@code nonce} when the token declares
 * {@code nonce_supported} ({@link IdTokenClaimException} naming the first rejected claim).</li>
 * </ol>
 *
 * <p>
 * A malformed token therefore never causes a key download, and claims of a forged token are never inspected. This
 * includes a header without {@code kid}: it is rejected at decode time as {@link IdTokenFormatException} rather than
 * reaching the key store and failing as {@link KeyFetchException}.
 *
 * <p>
 * Any {@code nonce_supported} value other than {@code false} (including the string {@code "false"}) requires the nonce
 * check.
 */
@ApplicationScoped
public class IdTokenVerifier {

    private static final Logger LOG = Logger.getLogger(IdTokenVerifier.class);

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    @Inject
    AdapterConfig config;

    @Inject
    SigningKeyStore keyStore;

    @Inject
    NonceManager nonceManager;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    /**
     * Runs the full pipeline over a raw identity token.
     *
     * @param rawToken
     *            compact JWS as received from Apple
     * @param context
     *            current callback request, used for nonce retrieval
     * @return verified claims
     */
    public IdTokenClaims verify(String rawToken, RequestContext context) {
        DecodedIdToken token = decode(rawToken);
        SigningKey key = keyStore.fetch(token.kid());
        verifySignature(token, key);

        ClaimCheck check = validateClaims(token, context);
        if (!check.valid()) {
            LOG.warnf("SECURITY: Rejected Apple id_token: claim=%s, reason=%s, sub=%s, kid=%s", check.claim(),
                    check.reason(), token.sub(), token.kid());
            throw new IdTokenClaimException(check.claim(), check.reason());
        }

        LOG.debugf("Verified Apple id_token: sub=%s, aud=%s, kid=%s", token.sub(), token.aud(), token.kid());
        return toClaims(token);
    }

    DecodedIdToken decode(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new IdTokenFormatException("id_token is empty");
        }
        String[] segments = rawToken.split("\\.", -1);
        if (segments.length != 3 || segments[0].isEmpty() || segments[1].isEmpty()) {
            throw new IdTokenFormatException("id_token is not a compact JWS (expected 3 segments)");
        }

        Map<String, Object> header = readSegment(segments[0], "header");
        Map<String, Object> payload = readSegment(segments[1], "payload");

        return new DecodedIdToken(rawToken, requireString(header, "kid", "header"), requireString(payload, "sub",
                "payload"), requireString(payload, "iss", "payload"), readAudience(payload),
                requireEpochSeconds(payload, "iat"), requireEpochSeconds(payload, "exp"), header, payload);
    }

    void verifySignature(DecodedIdToken token, SigningKey key) {
        try {
            Jwts.parser().verifyWith(key.publicKey()).build().parseSignedClaims(token.raw());
        } catch (ExpiredJwtException | PrematureJwtException e) {
            // Signature already verified at this point; timing is judged by the claim checks.
            LOG.tracef("Deferring time validation of id_token kid=%s to claim checks", token.kid());
        } catch (JwtException | IllegalArgumentException e) {
            LOG.warnf("SECURITY: Apple id_token signature invalid: kid=%s, error=%s", token.kid(), e.getMessage());
            throw new IdTokenSignatureException("id_token signature verification failed", e);
        }
    }

    /**
     * Claim validation pipeline. Stops at the first rejected claim.
     *
     * @return {@link ClaimCheck#ok()} or the first failure
     * @throws ConfigurationException
     *             if the token requires a nonce check while nonce handling is disabled
     */
    ClaimCheck validateClaims(DecodedIdToken token, RequestContext context) {
        long now = clock.instant().getEpochSecond();

        if (!config.issuerUrl().equals(token.iss())) {
            return ClaimCheck.invalid("iss", "expected " + config.issuerUrl());
        }
        if (!config.acceptedAudiences().contains(token.aud())) {
            return ClaimCheck.invalid("aud", "not an authorized client id");
        }
        if (token.iat() > now) {
            return ClaimCheck.invalid("iat", "issued in the future");
        }
        if (token.exp() < now) {
            return ClaimCheck.invalid("exp", "expired");
        }
        if (requiresNonce(token.payload())) {
            return checkNonce(token, context);
        }
        return ClaimCheck.ok();
    }

    static boolean requiresNonce(Map<String, Object> payload) {
        Object value = payload.get("nonce_supported");
        return value != null && !Boolean.FALSE.equals(value);
    }

    private ClaimCheck checkNonce(DecodedIdToken token, RequestContext context) {
        NonceMode mode = nonceManager.mode();
        if (mode == NonceMode.IGNORE) {
            throw new ConfigurationException(
                    "id_token requires nonce verification but nonce mode is ignore. Must be session or param");
        }
        Object tokenNonce = token.payload().get("nonce");
        Optional<String> expected = nonceManager.retrieveForVerification(context);
        if (!(tokenNonce instanceof String value) || expected.isEmpty() || !expected.get().equals(value)) {
            return ClaimCheck.invalid("nonce", "missing or does not match the issued nonce");
        }
        return ClaimCheck.ok();
    }

    private IdTokenClaims toClaims(DecodedIdToken token) {
        Map<String, Object> payload = token.payload();
        return new IdTokenClaims(token.sub(), token.iss(), token.aud(), token.iat(), token.exp(),
                optionalString(payload, "nonce"), requiresNonce(payload),
                optionalString(payload, "email"), BooleanClaims.coerce(payload.get("email_verified")),
                BooleanClaims.coerce(payload.get("is_private_email")), token.kid(), payload);
    }

    private Map<String, Object> readSegment(String segment, String part) {
        try {
            byte[] json = Base64.getUrlDecoder().decode(segment);
            Map<String, Object> value = objectMapper.readValue(json, JSON_OBJECT);
            if (value == null) {
                throw new IdTokenFormatException("id_token " + part + " is not a JSON object");
            }
            return value;
        } catch (IllegalArgumentException | IOException e) {
            throw new IdTokenFormatException("id_token " + part + " cannot be decoded", e);
        }
    }

    private static String requireString(Map<String, Object> source, String name, String part) {
        if (source.get(name) instanceof String value && !value.isEmpty()) {
            return value;
        }
        throw new IdTokenFormatException("id_token " + part + " lacks " + name);
    }

    private static long requireEpochSeconds(Map<String, Object> payload, String name) {
        if (payload.get(name) instanceof Number value) {
            return value.longValue();
        }
        throw new IdTokenFormatException("id_token payload lacks numeric " + name);
    }

    private static String readAudience(Map<String, Object> payload) {
        Object aud = payload.get("aud");
        if (aud instanceof String value && !value.isEmpty()) {
            return value;
        }
        if (aud instanceof List<?> values && values.size() == 1 && values.get(0) instanceof String value) {
            return value;
        }
        throw new IdTokenFormatException("id_token payload lacks aud");
    }

    private static Optional<String> optionalString(Map<String, Object> payload, String name) {
        return payload.get(name) instanceof String value && !value.isEmpty() ? Optional.of(value) : Optional.empty();
    }
}
