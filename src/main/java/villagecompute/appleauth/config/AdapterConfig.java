/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.config;

import java.net.URI;
import java.security.PrivateKey;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings of the Sign in with Apple adapter.
 *
 * <p>
 * Produced once per process by {@link AppleAuthConfig} and shared by every component. {@code redirectUri} is
 * {@code null} when no override is configured.
 *
 * @param clientId
 *            Services ID presented as {@code client_id}, always an accepted audience
 * @param teamId
 *            Apple Developer team id, issuer of the client secret
 * @param keyId
 *            id of the signing key registered with Apple, sent in the client-secret header
 * @param signingPrivateKey
 *            EC P-256 key used to sign the client secret (ES256)
 * @param authorizedClientIds
 *            additional audiences accepted besides {@code clientId}
 * @param nonceMode
 *            replay-protection strategy
 * @param issuer
 *            Apple's identity root, expected verbatim in the {@code iss} claim
 * @param redirectUri
 *            callback URL override, or {@code null}
 * @param authorizePath
 *            authorize endpoint path below the issuer
 * @param keysPath
 *            signing-key set path below the issuer
 * @param scope
 *            default authorization scope
 * @param responseMode
 *            default authorization response mode
 * @param providerIgnoresState
 *            when {@code true} the callback {@code state} is not compared with the session
 * @param httpTimeout
 *            timeout of the key-set request
 * @param callbackPath
 *            path of the adapter's own callback endpoint, used to build the default callback URL
 */
public record AdapterConfig(String clientId, String teamId, String keyId, PrivateKey signingPrivateKey,
        Set<String> authorizedClientIds, NonceMode nonceMode, URI issuer, String redirectUri, String authorizePath,
        String keysPath, String scope, String responseMode, boolean providerIgnoresState, Duration httpTimeout,
        String callbackPath) {

    public static final String APPLE_ISSUER = "https://appleid.apple.com";

    public AdapterConfig {
        Objects.requireNonNull(clientId, "clientId");
        authorizedClientIds = authorizedClientIds == null ? Set.of() : Set.copyOf(authorizedClientIds);
        issuer = issuer == null ? URI.create(APPLE_ISSUER) : issuer;
        httpTimeout = httpTimeout == null ? Duration.ofSeconds(10) : httpTimeout;
    }

    /**
     * Every audience an identity token may be issued to: {@code clientId} first, then the authorized ids.
     *
     * @return ordered, de-duplicated audience set
     */
    public Set<String> acceptedAudiences() {
        Set<String> audiences = new LinkedHashSet<>();
        audiences.add(clientId);
        audiences.addAll(authorizedClientIds);
        return audiences;
    }

    /**
     * @return issuer as it must appear in the {@code iss} claim (no trailing slash)
     */
    public String issuerUrl() {
        String value = issuer.toString();
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    public URI authorizeUri() {
        return resolve(authorizePath);
    }

    public URI keysUri() {
        return resolve(keysPath);
    }

    private URI resolve(String path) {
        String suffix = path.startsWith("/") ? path : "/" + path;
        return URI.create(issuerUrl() + suffix);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder with the provider defaults pre-filled.
     */
    public static final class Builder {

        private String clientId;
        private String teamId;
        private String keyId;
        private PrivateKey signingPrivateKey;
        private Set<String> authorizedClientIds = new LinkedHashSet<>();
        private NonceMode nonceMode = NonceMode.SESSION;
        private URI issuer = URI.create(APPLE_ISSUER);
        private String redirectUri;
        private String authorizePath = "/auth/authorize";
        private String keysPath = "/auth/keys";
        private String scope = "email name";
        private String responseMode = "form_post";
        private boolean providerIgnoresState;
        private Duration httpTimeout = Duration.ofSeconds(10);
        private String callbackPath = "/auth/apple/callback";

        private Builder() {
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder teamId(String teamId) {
            this.teamId = teamId;
            return this;
        }

        public Builder keyId(String keyId) {
            this.keyId = keyId;
            return this;
        }

        public Builder signingPrivateKey(PrivateKey signingPrivateKey) {
            this.signingPrivateKey = signingPrivateKey;
            return this;
        }

        public Builder authorizedClientIds(Collection<String> authorizedClientIds) {
            this.authorizedClientIds = new LinkedHashSet<>(authorizedClientIds);
            return this;
        }

        public Builder nonceMode(NonceMode nonceMode) {
            this.nonceMode = nonceMode;
            return this;
        }

        public Builder issuer(URI issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder authorizePath(String authorizePath) {
            this.authorizePath = authorizePath;
            return this;
        }

        public Builder keysPath(String keysPath) {
            this.keysPath = keysPath;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder responseMode(String responseMode) {
            this.responseMode = responseMode;
            return this;
        }

        public Builder providerIgnoresState(boolean providerIgnoresState) {
            this.providerIgnoresState = providerIgnoresState;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder callbackPath(String callbackPath) {
            this.callbackPath = callbackPath;
            return this;
        }

        public AdapterConfig build() {
            return new AdapterConfig(clientId, teamId, keyId, signingPrivateKey, authorizedClientIds, nonceMode,
                    issuer, redirectUri, authorizePath, keysPath, scope, responseMode, providerIgnoresState,
                    httpTimeout, callbackPath);
        }
    }
}
