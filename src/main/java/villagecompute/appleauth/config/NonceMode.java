/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.config;

import java.util.Locale;

import villagecompute.appleauth.exceptions.ConfigurationException;

/**
 * Replay-protection strategy for the identity token {@code nonce} claim.
 *
 * <ul>
 * <li>{@link #SESSION} - nonce stored in the server-side session and consumed (read once) at verification</li>
 * <li>{@link #PARAM} - nonce echoed back by the caller as the {@code nonce} request parameter</li>
 * <li>{@link #IGNORE} - nonce neither stored nor checked</li>
 * </ul>
 */
public enum NonceMode {

    SESSION, PARAM, IGNORE;

    /**
     * Parses the configured value ({@code session}, {@code param} or {@code ignore}, case-insensitive).
     *
     * @param value
     *            raw configuration value
     * @return the matching mode
     * @throws ConfigurationException
     *             if the value is blank or not one of the three modes
     */
    public static NonceMode fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (NonceMode mode : values()) {
                if (mode.name().equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new ConfigurationException(
                "Invalid nonce option: " + value + ". Must be session, param, or ignore");
    }
}
