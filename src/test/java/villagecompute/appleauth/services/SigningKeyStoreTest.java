/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import java.security.KeyPair;
import java.security.interfaces.RSAPublicKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.appleauth.TestFixtures;
import villagecompute.appleauth.api.types.SigningKey;
import villagecompute.appleauth.exceptions.FailureKind;
import villagecompute.appleauth.exceptions.KeyFetchException;
import villagecompute.appleauth.observability.AppleAuthMetrics;

/**
 * Unit tests for {@link SigningKeyStore} against a WireMock key endpoint.
 */
class SigningKeyStoreTest {

    private WireMockServer wireMockServer;
    private SigningKeyStore keyStore;
    private SimpleMeterRegistry meterRegistry;
    private KeyPair first;
    private KeyPair second;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        meterRegistry = new SimpleMeterRegistry();
        AppleAuthMetrics metrics = new AppleAuthMetrics(meterRegistry);

        keyStore = new SigningKeyStore();
        keyStore.config = TestFixtures.configBuilder()
                .issuer(URI.create("http://localhost:" + wireMockServer.port())).build();
        keyStore.metrics = metrics;

        first = TestFixtures.rsaKeyPair();
        second = TestFixtures.rsaKeyPair();
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.resetAll();
            wireMockServer.stop();
        }
    }

    @Test
    void testFetch_downloadsOnceThenServesFromCache() {
        stubKeys(Map.of("kid-1", (RSAPublicKey) first.getPublic()));

        SigningKey key = keyStore.fetch("kid-1");
        SigningKey again = keyStore.fetch("kid-1");

        assertEquals("kid-1", key.kid());
        assertEquals("RS256", key.algorithm());
        assertEquals(first.getPublic(), key.publicKey());
        assertSame(key, again);
        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/auth/keys")));
        assertEquals(1.0, meterRegistry.get("appleauth_jwks_fetches_total").tag("result", "success").counter()
                .count());
    }

    @Test
    void testFetch_unknownKidRefreshesWholeSet() {
        stubKeys(Map.of("kid-1", (RSAPublicKey) first.getPublic()));
        keyStore.fetch("kid-1");

        Map<String, RSAPublicKey> rotated = new LinkedHashMap<>();
        rotated.put("kid-2", (RSAPublicKey) second.getPublic());
        stubKeys(rotated);

        SigningKey rotatedKey = keyStore.fetch("kid-2");

        assertEquals(second.getPublic(), rotatedKey.publicKey());
        assertEquals(Set.of("kid-2"), keyStore.cachedKeyIds());
        wireMockServer.verify(2, getRequestedFor(urlEqualTo("/auth/keys")));
    }

    @Test
    void testFetch_kidMissingFromSet() {
        stubKeys(Map.of("kid-1", (RSAPublicKey) first.getPublic()));

        KeyFetchException ex = assertThrows(KeyFetchException.class, () -> keyStore.fetch("unknown"));

        assertEquals(FailureKind.JWKS_FETCHING_FAILED, ex.kind());
        assertEquals(Set.of("kid-1"), keyStore.cachedKeyIds());
    }

    @Test
    void testFetch_serverErrorIsKeyFetchFailure() {
        wireMockServer.stubFor(get(urlEqualTo("/auth/keys")).willReturn(aResponse().withStatus(503)));

        assertThrows(KeyFetchException.class, () -> keyStore.fetch("kid-1"));
        assertEquals(1.0, meterRegistry.get("appleauth_jwks_fetches_total").tag("result", "failure").counter()
                .count());
    }

    @Test
    void testFetch_malformedBodyIsKeyFetchFailure() {
        wireMockServer.stubFor(get(urlEqualTo("/auth/keys")).willReturn(okJson("{\"keys\": \"nope\"}")));

        KeyFetchException ex = assertThrows(KeyFetchException.class, () -> keyStore.fetch("kid-1"));
        assertEquals(FailureKind.JWKS_FETCHING_FAILED, ex.kind());
    }

    @Test
    void testFetch_unreachableEndpointIsKeyFetchFailure() {
        int port = wireMockServer.port();
        wireMockServer.stop();
        keyStore.config = TestFixtures.configBuilder().issuer(URI.create("http://localhost:" + port)).build();

        KeyFetchException ex = assertThrows(KeyFetchException.class, () -> keyStore.fetch("kid-1"));
        assertEquals(FailureKind.JWKS_FETCHING_FAILED, ex.kind());
    }

    @Test
    void testFetch_concurrentRefreshesAllSeeCompleteKeys() throws Exception {
        Map<String, RSAPublicKey> published = new LinkedHashMap<>();
        published.put("kid-1", (RSAPublicKey) first.getPublic());
        published.put("kid-2", (RSAPublicKey) second.getPublic());
        stubKeys(published);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<SigningKey>> lookups = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String kid = i % 2 == 0 ? "kid-1" : "kid-2";
                lookups.add(() -> keyStore.fetch(kid));
            }
            for (Future<SigningKey> result : executor.invokeAll(lookups)) {
                SigningKey key = result.get();
                Object expected = "kid-1".equals(key.kid()) ? first.getPublic() : second.getPublic();
                assertEquals(expected, key.publicKey());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(Set.of("kid-1", "kid-2"), keyStore.cachedKeyIds());
    }

    private void stubKeys(Map<String, RSAPublicKey> keys) {
        wireMockServer.stubFor(get(urlEqualTo("/auth/keys")).willReturn(okJson(TestFixtures.jwksJson(keys))));
    }
}
