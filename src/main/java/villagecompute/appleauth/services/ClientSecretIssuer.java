/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import villagecompute.appleauth.config.AdapterConfig;
import villagecompute.appleauth.exceptions.ConfigurationException;
import villagecompute.appleauth.observability.AppleAuthMetrics;

/**
 * Mints the short-lived JWT Apple requires in place of a static OAuth2 client secret.
 *
 * <p>
 * Claims: {@code iss}=team id, {@code aud}=Apple issuer, {@code sub}=client id, {@code iat}=now,
 * {@code exp}=now+60s. Header: {@code alg}=ES256, {@code kid}=key id. A new assertion is minted for every token
 * exchange and never cached.
 *
 * <p>
 * See: https://developer.apple.com/documentation/accountorganizationaldatasharing/creating-a-client-secret
 */
@ApplicationScoped
public class ClientSecretIssuer {

    private static final Logger LOG = Logger.getLogger(ClientSecretIssuer.class);

    static final long LIFETIME_SECONDS = 60;

    @Inject
    AdapterConfig config;

    @Inject
    Clock clock;

    @Inject
    AppleAuthMetrics metrics;

    /**
     * @return compact ES256-signed client secret, valid for 60 seconds
     * @throws ConfigurationException
     *             if the configured key cannot sign ES256
     */
    public String issue() {
        if (config.signingPrivateKey() == null) {
            throw new ConfigurationException("Apple private key is not configured");
        }
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
        Instant expiration = now.plusSeconds(LIFETIME_SECONDS);
        try {
            String jwt = Jwts.builder().header().keyId(config.keyId()).and().issuer(config.teamId())
                    .audience().single(config.issuerUrl()).subject(config.clientId()).issuedAt(Date.from(now))
                    .expiration(Date.from(expiration)).signWith(config.signingPrivateKey(), Jwts.SIG.ES256)
                    .compact();
            metrics.recordClientSecretIssued();
            LOG.debugf("Generated Apple client secret JWT: iss=%s, sub=%s, exp=%s", config.teamId(),
                    config.clientId(), expiration);
            return jwt;
        } catch (JwtException | IllegalArgumentException e) {
            LOG.errorf(e, "Failed to generate Apple client secret");
            throw new ConfigurationException("Apple client secret generation failed", e);
        }
    }
}
