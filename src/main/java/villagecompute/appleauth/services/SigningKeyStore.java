/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.Key;
import java.security.PublicKey;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;
import villagecompute.appleauth.api.types.SigningKey;
import villagecompute.appleauth.config.AdapterConfig;
import villagecompute.appleauth.exceptions.KeyFetchException;
import villagecompute.appleauth.observability.AppleAuthMetrics;

/**
 * Cache of Apple's identity-token signing keys, indexed by key id.
 *
 * <p>
 * Entries never expire on their own. A lookup for an unknown {@code kid} downloads the whole key set from
 * {@code {issuer}/auth/keys} and replaces the cache with it, which also picks up Apple's key rotations.
 *
 * <p>
 * <b>Concurrency:</b> the cache is an immutable map behind a volatile reference. Readers always see a complete map;
 * concurrent refreshes may both download, and the last one to finish wins. No key is ever visible half-written.
 */
@ApplicationScoped
public class SigningKeyStore {

    private static final Logger LOG = Logger.getLogger(SigningKeyStore.class);

    private static final int CONNECT_TIMEOUT_SECONDS = 10;

    @Inject
    AdapterConfig config;

    @Inject
    AppleAuthMetrics metrics;

    private final HttpClient httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS)).build();

    private volatile Map<String, SigningKey> keys = Map.of();

    /**
     * Returns the signing key with the given id, downloading the key set on a cache miss.
     *
     * @param kid
     *            key id from the identity token header
     * @return the matching key
     * @throws KeyFetchException
     *             if the key set cannot be downloaded or parsed, or has no key with this id
     */
    public SigningKey fetch(String kid) {
        SigningKey cached = keys.get(kid);
        if (cached != null) {
            return cached;
        }

        LOG.infof("Apple signing key %s not cached, refreshing key set", kid);
        Map<String, SigningKey> refreshed = download();
        keys = refreshed;

        SigningKey key = refreshed.get(kid);
        if (key == null) {
            LOG.warnf("SECURITY: Apple key set has no key with kid=%s (published: %s)", kid, refreshed.keySet());
            throw new KeyFetchException("Apple key set has no key with kid " + kid);
        }
        return key;
    }

    /**
     * @return ids of the currently cached keys
     */
    public Set<String> cachedKeyIds() {
        return keys.keySet();
    }

    Map<String, SigningKey> download() {
        URI keysUri = config.keysUri();
        HttpRequest request = HttpRequest.newBuilder(keysUri).header("Accept", "application/json")
                .timeout(config.httpTimeout()).GET().build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new KeyFetchException(
                        "Apple key set request to " + keysUri + " returned HTTP " + response.statusCode());
            }
            Map<String, SigningKey> parsed = parse(response.body());
            metrics.recordJwksFetch(true);
            LOG.infof("Fetched Apple signing key set: %d keys %s", parsed.size(), parsed.keySet());
            return parsed;
        } catch (KeyFetchException e) {
            metrics.recordJwksFetch(false);
            throw e;
        } catch (IOException e) {
            metrics.recordJwksFetch(false);
            throw new KeyFetchException("Apple key set request to " + keysUri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordJwksFetch(false);
            throw new KeyFetchException("Interrupted while fetching Apple key set", e);
        }
    }

    static Map<String, SigningKey> parse(String json) {
        JwkSet jwkSet;
        try {
            jwkSet = Jwks.setParser().build().parse(json);
        } catch (JwtException | IllegalArgumentException e) {
            throw new KeyFetchException("Apple key set response is not a valid JWK set", e);
        }

        Map<String, SigningKey> parsed = new HashMap<>();
        for (Jwk<?> jwk : jwkSet.getKeys()) {
            Key key = jwk.toKey();
            if (jwk.getId() == null || !(key instanceof PublicKey publicKey)) {
                continue;
            }
            parsed.put(jwk.getId(), new SigningKey(jwk.getId(), jwk.getAlgorithm(), publicKey));
        }
        return Map.copyOf(parsed);
    }
}
