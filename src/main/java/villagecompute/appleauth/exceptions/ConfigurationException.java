/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Exception thrown when the adapter configuration is unusable (unknown nonce mode, unreadable private key, nonce check
 * demanded while nonce handling is disabled).
 */
public class ConfigurationException extends AppleAuthException {

    public ConfigurationException(String message) {
        super(FailureKind.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(FailureKind.CONFIGURATION_ERROR, message, cause);
    }
}
