/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.config;

import java.net.URI;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.appleauth.exceptions.ConfigurationException;
import villagecompute.appleauth.util.PrivateKeyLoader;

/**
 * Reads the {@code apple.*} properties and produces the immutable {@link AdapterConfig} shared by every component.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code apple.client-id} - Services ID (from APPLE_CLIENT_ID env var)</li>
 * <li>{@code apple.team-id} - Apple Developer team id (from APPLE_TEAM_ID env var)</li>
 * <li>{@code apple.key-id} - signing key id (from APPLE_KEY_ID env var)</li>
 * <li>{@code apple.private-key} / {@code apple.private-key-path} - PKCS#8 PEM content or file</li>
 * <li>{@code apple.authorized-client-ids} - additional accepted audiences (comma separated)</li>
 * <li>{@code apple.nonce} - session, param or ignore (default: session)</li>
 * <li>{@code apple.redirect-uri} - callback URL override</li>
 * <li>{@code apple.issuer}, {@code apple.authorize-path}, {@code apple.keys-path} - endpoint locations</li>
 * <li>{@code apple.scope}, {@code apple.response-mode} - authorize defaults</li>
 * <li>{@code apple.provider-ignores-state} - skip the {@code state} check (default: false)</li>
 * <li>{@code apple.http-timeout-seconds} - key-set request timeout (default: 10)</li>
 * </ul>
 *
 * <p>
 * Invalid settings fail bean creation with {@link ConfigurationException}. Both produced beans are {@code @Singleton}
 * because records and {@link Clock} cannot be client-proxied.
 */
@ApplicationScoped
public class AppleAuthConfig {

    private static final Logger LOG = Logger.getLogger(AppleAuthConfig.class);

    @ConfigProperty(
            name = "apple.client-id")
    String clientId;

    @ConfigProperty(
            name = "apple.team-id")
    String teamId;

    @ConfigProperty(
            name = "apple.key-id")
    String keyId;

    @ConfigProperty(
            name = "apple.private-key")
    Optional<String> privateKeyPem;

    @ConfigProperty(
            name = "apple.private-key-path")
    Optional<String> privateKeyPath;

    @ConfigProperty(
            name = "apple.authorized-client-ids")
    Optional<List<String>> authorizedClientIds;

    @ConfigProperty(
            name = "apple.nonce",
            defaultValue = "session")
    String nonce;

    @ConfigProperty(
            name = "apple.redirect-uri")
    Optional<String> redirectUri;

    @ConfigProperty(
            name = "apple.issuer",
            defaultValue = AdapterConfig.APPLE_ISSUER)
    String issuer;

    @ConfigProperty(
            name = "apple.authorize-path",
            defaultValue = "/auth/authorize")
    String authorizePath;

    @ConfigProperty(
            name = "apple.keys-path",
            defaultValue = "/auth/keys")
    String keysPath;

    @ConfigProperty(
            name = "apple.scope",
            defaultValue = "email name")
    String scope;

    @ConfigProperty(
            name = "apple.response-mode",
            defaultValue = "form_post")
    String responseMode;

    @ConfigProperty(
            name = "apple.provider-ignores-state",
            defaultValue = "false")
    boolean providerIgnoresState;

    @ConfigProperty(
            name = "apple.http-timeout-seconds",
            defaultValue = "10")
    int httpTimeoutSeconds;

    @ConfigProperty(
            name = "apple.callback-path",
            defaultValue = "/auth/apple/callback")
    String callbackPath;

    @Produces
    @Singleton
    public AdapterConfig adapterConfig() {
        requireText(clientId, "apple.client-id");
        requireText(teamId, "apple.team-id");
        requireText(keyId, "apple.key-id");
        if (httpTimeoutSeconds <= 0) {
            throw new ConfigurationException("apple.http-timeout-seconds must be positive");
        }

        AdapterConfig config = AdapterConfig.builder().clientId(clientId).teamId(teamId).keyId(keyId)
                .signingPrivateKey(loadPrivateKey())
                .authorizedClientIds(authorizedClientIds.orElse(List.of()).stream().map(String::trim)
                        .filter(id -> !id.isEmpty()).toList())
                .nonceMode(NonceMode.fromValue(nonce)).issuer(parseIssuer()).redirectUri(redirectUri.orElse(null))
                .authorizePath(authorizePath).keysPath(keysPath).scope(scope).responseMode(responseMode)
                .providerIgnoresState(providerIgnoresState).httpTimeout(Duration.ofSeconds(httpTimeoutSeconds))
                .callbackPath(callbackPath).build();

        LOG.infof("Sign in with Apple configured: clientId=%s, teamId=%s, keyId=%s, nonce=%s, extraAudiences=%d",
                config.clientId(), config.teamId(), config.keyId(), config.nonceMode(),
                config.authorizedClientIds().size());
        return config;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    private PrivateKey loadPrivateKey() {
        if (privateKeyPem.isPresent() && !privateKeyPem.get().isBlank()) {
            return PrivateKeyLoader.fromPem(privateKeyPem.get());
        }
        if (privateKeyPath.isPresent() && !privateKeyPath.get().isBlank()) {
            return PrivateKeyLoader.fromFile(Path.of(privateKeyPath.get()));
        }
        throw new ConfigurationException("One of apple.private-key or apple.private-key-path is required");
    }

    private URI parseIssuer() {
        try {
            URI uri = URI.create(issuer);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigurationException("apple.issuer must be an absolute URL: " + issuer);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("apple.issuer is not a valid URL: " + issuer, e);
        }
    }

    private static void requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(property + " is required");
        }
    }
}
