/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.appleauth.config.AdapterConfig;
import villagecompute.appleauth.config.NonceMode;
import villagecompute.appleauth.exceptions.ConfigurationException;

/**
 * Issues and later retrieves the one-time {@code nonce} bound to an authorization attempt.
 *
 * <p>
 * Lifecycle per {@link NonceMode}:
 * <ul>
 * <li><b>SESSION</b>: stored under {@link #SESSION_KEY} at issue time (overwriting an earlier attempt), deleted when
 * read back, so a second retrieval finds nothing</li>
 * <li><b>PARAM</b>: not stored; the caller echoes it as the {@code nonce} request parameter</li>
 * <li><b>IGNORE</b>: never created, never consulted</li>
 * </ul>
 */
@ApplicationScoped
public class NonceManager {

    private static final Logger LOG = Logger.getLogger(NonceManager.class);

    public static final String SESSION_KEY = "appleauth.nonce";

    static final int NONCE_BYTES = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    @Inject
    AdapterConfig config;

    /**
     * Generates a fresh nonce for the authorize request.
     *
     * @param context
     *            current request (its session receives the nonce in SESSION mode)
     * @return the nonce to send to Apple, empty in IGNORE mode
     * @throws ConfigurationException
     *             if no nonce mode is configured
     */
    public Optional<String> issue(RequestContext context) {
        NonceMode mode = mode();
        if (mode == NonceMode.IGNORE) {
            return Optional.empty();
        }
        String nonce = generate();
        if (mode == NonceMode.SESSION) {
            context.session().set(SESSION_KEY, nonce);
        }
        LOG.debugf("SECURITY: Issued nonce: mode=%s", mode);
        return Optional.of(nonce);
    }

    /**
     * Reads the nonce the identity token must echo.
     *
     * @param context
     *            current callback request
     * @return expected nonce, empty when none is available (or in IGNORE mode, where no check applies)
     * @throws ConfigurationException
     *             if no nonce mode is configured
     */
    public Optional<String> retrieveForVerification(RequestContext context) {
        return switch (mode()) {
            case SESSION -> context.session().delete(SESSION_KEY);
            case PARAM -> context.param("nonce");
            case IGNORE -> Optional.empty();
        };
    }

    NonceMode mode() {
        NonceMode mode = config.nonceMode();
        if (mode == null) {
            throw new ConfigurationException("Invalid nonce option: null. Must be session, param, or ignore");
        }
        return mode;
    }

    static String generate() {
        byte[] bytes = new byte[NONCE_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
