/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.security.KeyPair;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.appleauth.TestFixtures;
import villagecompute.appleauth.api.types.IdTokenClaims;
import villagecompute.appleauth.api.types.SigningKey;
import villagecompute.appleauth.config.AdapterConfig;
import villagecompute.appleauth.config.NonceMode;
import villagecompute.appleauth.exceptions.ConfigurationException;
import villagecompute.appleauth.exceptions.FailureKind;
import villagecompute.appleauth.exceptions.IdTokenClaimException;
import villagecompute.appleauth.exceptions.IdTokenFormatException;
import villagecompute.appleauth.exceptions.IdTokenSignatureException;
import villagecompute.appleauth.exceptions.KeyFetchException;

/**
 * Unit tests for {@link IdTokenVerifier}.
 */
class IdTokenVerifierTest {

    @Mock
    SigningKeyStore keyStore;

    private IdTokenVerifier verifier;
    private NonceManager nonceManager;
    private KeyPair appleKey;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        appleKey = TestFixtures.rsaKeyPair();
        when(keyStore.fetch(TestFixtures.SIGNING_KID))
                .thenReturn(new SigningKey(TestFixtures.SIGNING_KID, "RS256", appleKey.getPublic()));

        AdapterConfig config = TestFixtures.configBuilder().nonceMode(NonceMode.SESSION).build();
        nonceManager = new NonceManager();
        nonceManager.config = config;

        verifier = new IdTokenVerifier();
        verifier.config = config;
        verifier.keyStore = keyStore;
        verifier.nonceManager = nonceManager;
        verifier.objectMapper = new ObjectMapper();
        verifier.clock = TestFixtures.fixedClock();
    }

    @Test
    void testVerify_validTokenYieldsItsClaims() {
        Map<String, Object> claims = TestFixtures.validClaims();

        IdTokenClaims verified = verifier.verify(sign(claims), TestRequestContext.get());

        assertEquals(TestFixtures.SUBJECT, verified.sub());
        assertEquals("https://appleid.apple.com", verified.iss());
        assertEquals(TestFixtures.CLIENT_ID, verified.aud());
        assertEquals(claims.get("iat"), verified.iat());
        assertEquals(claims.get("exp"), verified.exp());
        assertEquals(Optional.of(TestFixtures.EMAIL), verified.email());
        assertTrue(verified.emailVerified());
        assertTrue(verified.isPrivateEmail());
        assertEquals(TestFixtures.SIGNING_KID, verified.kid());
        assertEquals(claims.get("auth_time"), ((Number) verified.raw().get("auth_time")).longValue());
    }

    @Test
    void testVerify_authorizedSecondaryAudience() {
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("aud", TestFixtures.IOS_CLIENT_ID);

        assertEquals(TestFixtures.IOS_CLIENT_ID, verifier.verify(sign(claims), TestRequestContext.get()).aud());
    }

    @Test
    void testVerify_wrongIssuer() {
        assertClaimRejected("iss", "iss", "https://evil.example.com");
    }

    @Test
    void testVerify_unauthorizedAudience() {
        assertClaimRejected("aud", "aud", "com.someone.else");
    }

    @Test
    void testVerify_issuedInFuture() {
        assertClaimRejected("iat", "iat", TestFixtures.NOW.plusSeconds(30).getEpochSecond());
    }

    @Test
    void testVerify_expired() {
        assertClaimRejected("exp", "exp", TestFixtures.NOW.minusSeconds(1).getEpochSecond());
    }

    @Test
    void testVerify_boundaryTimesAccepted() {
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("iat", TestFixtures.NOW.getEpochSecond());
        claims.put("exp", TestFixtures.NOW.getEpochSecond());

        verifier.verify(sign(claims), TestRequestContext.get());
    }

    @Test
    void testVerify_sessionNonceMatches() {
        TestRequestContext authorize = TestRequestContext.get();
        String nonce = nonceManager.issue(authorize).orElseThrow();
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("nonce_supported", true);
        claims.put("nonce", nonce);

        IdTokenClaims verified = verifier.verify(sign(claims), authorize.followUp());

        assertEquals(Optional.of(nonce), verified.nonce());
        assertTrue(verified.nonceSupported());
    }

    @Test
    void testVerify_replayedTokenFailsOnConsumedNonce() {
        TestRequestContext authorize = TestRequestContext.get();
        String nonce = nonceManager.issue(authorize).orElseThrow();
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("nonce_supported", "true");
        claims.put("nonce", nonce);
        String token = sign(claims);

        verifier.verify(token, authorize.followUp());
        IdTokenClaimException ex = assertThrows(IdTokenClaimException.class,
                () -> verifier.verify(token, authorize.followUp()));

        assertEquals("nonce", ex.claim());
    }

    @Test
    void testVerify_mismatchedNonce() {
        TestRequestContext authorize = TestRequestContext.get();
        nonceManager.issue(authorize);
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("nonce_supported", true);
        claims.put("nonce", "not-the-issued-one");

        IdTokenClaimException ex = assertThrows(IdTokenClaimException.class,
                () -> verifier.verify(sign(claims), authorize.followUp()));

        assertEquals("nonce", ex.claim());
        assertEquals(FailureKind.ID_TOKEN_CLAIMS_INVALID, ex.kind());
    }

    @Test
    void testVerify_paramNonce() {
        AdapterConfig paramConfig = TestFixtures.configBuilder().nonceMode(NonceMode.PARAM).build();
        nonceManager.config = paramConfig;
        verifier.config = paramConfig;
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("nonce_supported", true);
        claims.put("nonce", "echoed");

        verifier.verify(sign(claims), TestRequestContext.get().with("nonce", "echoed"));
    }

    @Test
    void testVerify_nonceNotCheckedWhenTokenDoesNotSupportIt() {
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("nonce_supported", false);
        claims.put("nonce", "anything");

        verifier.verify(sign(claims), TestRequestContext.get());
    }

    @Test
    void testVerify_stringFalseNonceSupportedStillChecksNonce() {
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("nonce_supported", "false");
        claims.put("nonce", "never-issued");

        IdTokenClaimException ex = assertThrows(IdTokenClaimException.class,
                () -> verifier.verify(sign(claims), TestRequestContext.get()));

        assertEquals("nonce", ex.claim());
    }

    @Test
    void testVerify_ignoreModeWithNonceSupportingTokenIsConfigurationError() {
        AdapterConfig ignoreConfig = TestFixtures.configBuilder().nonceMode(NonceMode.IGNORE).build();
        nonceManager.config = ignoreConfig;
        verifier.config = ignoreConfig;
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("nonce_supported", true);
        claims.put("nonce", "anything");

        assertThrows(ConfigurationException.class, () -> verifier.verify(sign(claims), TestRequestContext.get()));
    }

    @Test
    void testVerify_tamperedSignatureIsSignatureError() {
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("iss", "https://evil.example.com");
        String token = sign(claims);
        int signatureStart = token.lastIndexOf('.') + 1;
        char flipped = token.charAt(signatureStart) == 'A' ? 'B' : 'A';
        String tampered = token.substring(0, signatureStart) + flipped + token.substring(signatureStart + 1);

        IdTokenSignatureException ex = assertThrows(IdTokenSignatureException.class,
                () -> verifier.verify(tampered, TestRequestContext.get()));

        assertEquals(FailureKind.ID_TOKEN_SIGNATURE_INVALID, ex.kind());
    }

    @Test
    void testVerify_tokenSignedByOtherKeyIsSignatureError() {
        String forged = TestFixtures.signIdToken(TestFixtures.validClaims(), TestFixtures.SIGNING_KID,
                TestFixtures.rsaKeyPair().getPrivate());

        assertThrows(IdTokenSignatureException.class, () -> verifier.verify(forged, TestRequestContext.get()));
    }

    @Test
    void testVerify_unsignedTokenIsSignatureError() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        String header = encoder.encodeToString(
                mapper.writeValueAsBytes(Map.of("alg", "none", "kid", TestFixtures.SIGNING_KID)));
        String payload = encoder.encodeToString(mapper.writeValueAsBytes(TestFixtures.validClaims()));

        assertThrows(IdTokenSignatureException.class,
                () -> verifier.verify(header + "." + payload + ".", TestRequestContext.get()));
    }

    @Test
    void testVerify_unknownKidIsKeyFetchError() {
        when(keyStore.fetch("rotated-away")).thenThrow(new KeyFetchException("no key rotated-away"));
        String token = TestFixtures.signIdToken(TestFixtures.validClaims(), "rotated-away", appleKey.getPrivate());

        KeyFetchException ex = assertThrows(KeyFetchException.class,
                () -> verifier.verify(token, TestRequestContext.get()));
        assertEquals(FailureKind.JWKS_FETCHING_FAILED, ex.kind());
    }

    @Test
    void testVerify_missingKidIsFormatError() {
        String token = TestFixtures.signIdToken(TestFixtures.validClaims(), null, appleKey.getPrivate());

        assertThrows(IdTokenFormatException.class, () -> verifier.verify(token, TestRequestContext.get()));
        verifyNoInteractions(keyStore);
    }

    @Test
    void testVerify_malformedTokenNeverReachesKeyStore() {
        for (String malformed : List.of("", "abc", "a.b", "not.a.jwt", "e30.e30.sig")) {
            assertThrows(IdTokenFormatException.class, () -> verifier.verify(malformed, TestRequestContext.get()),
                    "expected format error for '" + malformed + "'");
        }
        verifyNoInteractions(keyStore);
    }

    @Test
    void testDecode_audienceArrayWithSingleValue() {
        DecodedIdToken decoded = verifier.decode(sign(TestFixtures.validClaims()));

        assertEquals(TestFixtures.CLIENT_ID, decoded.aud());
        assertEquals(TestFixtures.SIGNING_KID, decoded.kid());
    }

    @Test
    void testVerify_stringFalseIsNotVerified() {
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put("email_verified", "false");
        claims.put("is_private_email", "yes");

        IdTokenClaims verified = verifier.verify(sign(claims), TestRequestContext.get());

        assertFalse(verified.emailVerified());
        assertFalse(verified.isPrivateEmail());
    }

    private void assertClaimRejected(String expectedClaim, String name, Object value) {
        Map<String, Object> claims = TestFixtures.validClaims();
        claims.put(name, value);

        IdTokenClaimException ex = assertThrows(IdTokenClaimException.class,
                () -> verifier.verify(sign(claims), TestRequestContext.get()));

        assertEquals(expectedClaim, ex.claim());
        assertEquals(FailureKind.ID_TOKEN_CLAIMS_INVALID, ex.kind());
    }

    private String sign(Map<String, Object> claims) {
        return TestFixtures.signIdToken(claims, TestFixtures.SIGNING_KID, appleKey.getPrivate());
    }
}
